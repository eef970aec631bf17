package com.swapengine.infra.kafka.retry;

import java.time.Duration;
import java.util.Optional;

/** Decides whether a failed job attempt is retried, and after how long. */
public interface RetryPolicy {
  RetryPolicy NEVER = (failedAttempts, failure) -> Optional.empty();

  /**
   * @param failedAttempts attempts made so far, all failed; starts at 1
   * @return the delay before the next attempt, or empty to give up
   */
  Optional<Duration> nextAttemptDelay(int failedAttempts, Exception failure);
}
