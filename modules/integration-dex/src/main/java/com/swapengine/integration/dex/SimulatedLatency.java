package com.swapengine.integration.dex;

import java.time.Duration;
import java.util.random.RandomGenerator;

final class SimulatedLatency {
  private final Duration min;
  private final Duration max;
  private final RandomGenerator random;

  SimulatedLatency(Duration min, Duration max, RandomGenerator random) {
    this.min = min == null || min.isNegative() ? Duration.ZERO : min;
    this.max = max == null || max.compareTo(this.min) < 0 ? this.min : max;
    this.random = random;
  }

  void pause(String operation) {
    long minMillis = min.toMillis();
    long spread = max.toMillis() - minMillis;
    long waitMillis = spread == 0L ? minMillis : minMillis + random.nextLong(spread + 1);
    if (waitMillis == 0L) {
      return;
    }
    try {
      Thread.sleep(waitMillis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(operation + " interrupted", ex);
    }
  }
}
