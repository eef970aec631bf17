package com.swapengine.infra.kafka.producer;

import com.swapengine.infra.kafka.contract.JobEnvelope;
import com.swapengine.infra.kafka.contract.JobTypes;
import com.swapengine.infra.kafka.contract.payload.OrderSubmittedV1;
import com.swapengine.infra.kafka.topics.QueueTopics;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/** Submission side of the order queue. */
public class OrderJobQueue {
  static final int SCHEMA_VERSION = 1;

  private final JobPublisher publisher;
  private final String producerName;
  private final Clock clock;

  public OrderJobQueue(JobPublisher publisher, String producerName, Clock clock) {
    this.publisher = publisher;
    this.producerName = producerName;
    this.clock = clock;
  }

  /** Completes with the enqueued job once the broker has it. */
  public CompletableFuture<JobEnvelope<OrderSubmittedV1>> submit(OrderSubmittedV1 order) {
    if (order == null || order.orderId() == null || order.orderId().isBlank()) {
      throw new IllegalArgumentException("order.orderId must not be blank");
    }
    JobEnvelope<OrderSubmittedV1> job =
        JobEnvelope.newJob(
            JobTypes.ORDER_SUBMITTED,
            SCHEMA_VERSION,
            producerName,
            order.orderId(),
            order,
            clock.instant());
    return publisher.enqueue(QueueTopics.ORDERS_SUBMITTED_V1, job).thenApply(metadata -> job);
  }
}
