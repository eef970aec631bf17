package com.swapengine.infra.kafka.contract;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One unit of work on the order queue. The record key on the topic is always {@code orderId}, so
 * every delivery of a job for the same order lands on the same partition.
 */
public record JobEnvelope<T>(
    UUID jobId,
    String jobType,
    int schemaVersion,
    Instant enqueuedAt,
    String producer,
    String orderId,
    T payload) {
  public JobEnvelope {
    Objects.requireNonNull(jobId, "jobId must not be null");
    if (jobType == null || jobType.isBlank()) {
      throw new IllegalArgumentException("jobType must not be blank");
    }
    if (schemaVersion < 1) {
      throw new IllegalArgumentException("schemaVersion must be >= 1");
    }
    Objects.requireNonNull(enqueuedAt, "enqueuedAt must not be null");
    if (producer == null || producer.isBlank()) {
      throw new IllegalArgumentException("producer must not be blank");
    }
    if (orderId == null || orderId.isBlank()) {
      throw new IllegalArgumentException("orderId must not be blank");
    }
    Objects.requireNonNull(payload, "payload must not be null");
  }

  public static <T> JobEnvelope<T> newJob(
      String jobType,
      int schemaVersion,
      String producer,
      String orderId,
      T payload,
      Instant enqueuedAt) {
    return new JobEnvelope<>(
        UUID.randomUUID(), jobType, schemaVersion, enqueuedAt, producer, orderId, payload);
  }
}
