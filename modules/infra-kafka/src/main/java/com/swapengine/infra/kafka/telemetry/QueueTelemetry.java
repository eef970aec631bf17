package com.swapengine.infra.kafka.telemetry;

/** Queue-level measurements. Every hook defaults to doing nothing. */
public interface QueueTelemetry {
  QueueTelemetry NOOP = new QueueTelemetry() {};

  default void enqueued(String topic, String jobType, long latencyNanos) {}

  default void enqueueFailed(String topic, String jobType, Throwable error) {}

  default void attemptFailed(String topic, String jobType, int attempt, Throwable error) {}

  default void completed(String topic, String jobType, int attempts, long latencyNanos) {}

  default void deadLettered(String topic, String jobType, Throwable error) {}
}
