package com.swapengine.infra.kafka.producer;

import com.swapengine.infra.kafka.contract.JobEnvelope;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.RecordMetadata;

public interface JobPublisher {
  /**
   * Completes once the broker has acknowledged the job, or exceptionally with {@link
   * EnqueueFailedException}.
   */
  <T> CompletableFuture<RecordMetadata> enqueue(String topic, JobEnvelope<T> job);
}
