package com.swapengine.infra.kafka.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.swapengine.infra.kafka.contract.MalformedJobException;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BackoffRetryPolicyTest {
  private static final Exception FAILURE = new IllegalStateException("provider down");

  @Test
  void fixedPolicyRetriesUntilAttemptsAreUsed() {
    RetryPolicy policy = BackoffRetryPolicy.fixed(3, Duration.ofMillis(250));

    assertEquals(Optional.of(Duration.ofMillis(250)), policy.nextAttemptDelay(1, FAILURE));
    assertEquals(Optional.of(Duration.ofMillis(250)), policy.nextAttemptDelay(2, FAILURE));
    assertTrue(policy.nextAttemptDelay(3, FAILURE).isEmpty());
  }

  @Test
  void exponentialPolicyDoublesUpToCap() {
    RetryPolicy policy =
        BackoffRetryPolicy.exponential(6, Duration.ofMillis(500), Duration.ofSeconds(3));

    assertEquals(Optional.of(Duration.ofMillis(500)), policy.nextAttemptDelay(1, FAILURE));
    assertEquals(Optional.of(Duration.ofMillis(1000)), policy.nextAttemptDelay(2, FAILURE));
    assertEquals(Optional.of(Duration.ofMillis(2000)), policy.nextAttemptDelay(3, FAILURE));
    assertEquals(Optional.of(Duration.ofSeconds(3)), policy.nextAttemptDelay(4, FAILURE));
    assertEquals(Optional.of(Duration.ofSeconds(3)), policy.nextAttemptDelay(5, FAILURE));
    assertTrue(policy.nextAttemptDelay(6, FAILURE).isEmpty());
  }

  @Test
  void singleAttemptNeverRetries() {
    assertTrue(BackoffRetryPolicy.fixed(1, Duration.ZERO).nextAttemptDelay(1, FAILURE).isEmpty());
    assertTrue(BackoffRetryPolicy.fixed(0, Duration.ZERO).nextAttemptDelay(1, FAILURE).isEmpty());
    assertTrue(RetryPolicy.NEVER.nextAttemptDelay(1, FAILURE).isEmpty());
  }

  @Test
  void malformedJobsAreNotRetried() {
    RetryPolicy policy = BackoffRetryPolicy.fixed(5, Duration.ZERO);

    assertTrue(policy.nextAttemptDelay(1, new MalformedJobException("bad header")).isEmpty());
  }

  @Test
  void negativeDelayIsTreatedAsImmediate() {
    RetryPolicy policy =
        new BackoffRetryPolicy(2, BackoffType.EXPONENTIAL, Duration.ofMillis(-5), null);

    assertEquals(Optional.of(Duration.ZERO), policy.nextAttemptDelay(1, FAILURE));
  }
}
