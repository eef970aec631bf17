package com.swapengine.worker.consumer;

import com.swapengine.domain.orders.SwapOrder;
import com.swapengine.infra.kafka.codec.JobCodec;
import com.swapengine.infra.kafka.config.SwapQueueAutoConfiguration;
import com.swapengine.infra.kafka.consumer.JobDispatcher;
import com.swapengine.infra.kafka.consumer.JobOutcome;
import com.swapengine.infra.kafka.contract.JobEnvelope;
import com.swapengine.infra.kafka.contract.JobTypes;
import com.swapengine.infra.kafka.contract.payload.OrderSubmittedV1;
import com.swapengine.infra.kafka.deadletter.DeadLetterSink;
import com.swapengine.infra.kafka.retry.RetryPolicy;
import com.swapengine.infra.kafka.telemetry.QueueTelemetry;
import com.swapengine.infra.kafka.topics.QueueTopics;
import com.swapengine.worker.lifecycle.OrderLifecycleOrchestrator;
import java.time.Clock;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Pulls submitted orders off the queue and runs each through the lifecycle. The record is
 * acknowledged once the job completes or is dead-lettered.
 */
@Component
public class OrderSubmittedConsumer {
  private static final Logger log = LoggerFactory.getLogger(OrderSubmittedConsumer.class);

  private final JobDispatcher<OrderSubmittedV1> dispatcher;
  private final OrderLifecycleOrchestrator orchestrator;

  public OrderSubmittedConsumer(
      JobCodec jobCodec,
      RetryPolicy jobRetryPolicy,
      DeadLetterSink deadLetterSink,
      QueueTelemetry queueTelemetry,
      OrderLifecycleOrchestrator orchestrator,
      Clock clock) {
    this.orchestrator = orchestrator;
    this.dispatcher =
        new JobDispatcher<>(
            OrderSubmittedV1.class,
            JobTypes.ORDER_SUBMITTED,
            1,
            jobCodec,
            this::runLifecycle,
            jobRetryPolicy,
            deadLetterSink,
            queueTelemetry,
            clock);
  }

  @KafkaListener(
      topics = QueueTopics.ORDERS_SUBMITTED_V1,
      groupId = "${swap.queue.consumer.group-id:cg-swap-worker}",
      containerFactory = SwapQueueAutoConfiguration.LISTENER_FACTORY)
  public void onMessage(ConsumerRecord<String, String> record, Acknowledgment ack) {
    JobOutcome outcome = dispatcher.dispatch(record);
    log.debug(
        "Order job finished orderId={} partition={} offset={} outcome={}",
        record.key(),
        record.partition(),
        record.offset(),
        outcome);
    ack.acknowledge();
  }

  private void runLifecycle(JobEnvelope<OrderSubmittedV1> job) {
    OrderSubmittedV1 submitted = job.payload();
    orchestrator.process(
        SwapOrder.queued(
            submitted.orderId(),
            submitted.tokenIn(),
            submitted.tokenOut(),
            submitted.amount(),
            submitted.submittedAt() == null ? job.enqueuedAt() : submitted.submittedAt()));
  }
}
