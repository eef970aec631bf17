package com.swapengine.infra.kafka.retry;

import com.swapengine.infra.kafka.contract.MalformedJobException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded attempts with a fixed or doubling delay. {@code maxAttempts} counts the first attempt,
 * so {@code 1} means no retry. Exponential delays are {@code delay * 2^(n-1)}, capped at {@code
 * maxDelay}. A {@link MalformedJobException} is never retried.
 */
public final class BackoffRetryPolicy implements RetryPolicy {
  private final int maxAttempts;
  private final BackoffType type;
  private final Duration delay;
  private final Duration maxDelay;

  public BackoffRetryPolicy(int maxAttempts, BackoffType type, Duration delay, Duration maxDelay) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.type = Objects.requireNonNull(type, "type must not be null");
    this.delay = nonNegative(delay);
    this.maxDelay = maxDelay == null ? this.delay : max(this.delay, nonNegative(maxDelay));
  }

  public static BackoffRetryPolicy fixed(int maxAttempts, Duration delay) {
    return new BackoffRetryPolicy(maxAttempts, BackoffType.FIXED, delay, delay);
  }

  public static BackoffRetryPolicy exponential(int maxAttempts, Duration delay, Duration maxDelay) {
    return new BackoffRetryPolicy(maxAttempts, BackoffType.EXPONENTIAL, delay, maxDelay);
  }

  @Override
  public Optional<Duration> nextAttemptDelay(int failedAttempts, Exception failure) {
    if (failure instanceof MalformedJobException || failedAttempts >= maxAttempts) {
      return Optional.empty();
    }
    if (type == BackoffType.FIXED || delay.isZero()) {
      return Optional.of(delay);
    }
    int doublings = Math.min(Math.max(0, failedAttempts - 1), 30);
    long millis = delay.toMillis() << doublings;
    if (millis < 0 || millis > maxDelay.toMillis()) {
      return Optional.of(maxDelay);
    }
    return Optional.of(Duration.ofMillis(millis));
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public BackoffType type() {
    return type;
  }

  private static Duration nonNegative(Duration value) {
    if (value == null || value.isNegative()) {
      return Duration.ZERO;
    }
    return value;
  }

  private static Duration max(Duration a, Duration b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  @Override
  public String toString() {
    return "BackoffRetryPolicy{maxAttempts="
        + maxAttempts
        + ", type="
        + type
        + ", delay="
        + delay
        + ", maxDelay="
        + maxDelay
        + '}';
  }
}
