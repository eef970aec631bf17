package com.swapengine.orderapi.orders;

import com.swapengine.infra.kafka.contract.payload.OrderSubmittedV1;
import com.swapengine.infra.kafka.producer.EnqueueFailedException;
import com.swapengine.infra.kafka.producer.OrderJobQueue;
import com.swapengine.infra.kafka.topics.QueueTopics;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Assigns an order id and places the order on the work queue. Returns only after the broker has
 * acknowledged the job, so an accepted order is never lost by the submission layer.
 */
@Service
public class OrderSubmissionService {
  private static final Logger log = LoggerFactory.getLogger(OrderSubmissionService.class);

  private final OrderJobQueue orderJobQueue;
  private final Clock clock;

  public OrderSubmissionService(OrderJobQueue orderJobQueue, Clock clock) {
    this.orderJobQueue = orderJobQueue;
    this.clock = clock;
  }

  public String submit(SubmitOrderCommand command) {
    String orderId = UUID.randomUUID().toString();
    OrderSubmittedV1 order =
        new OrderSubmittedV1(
            orderId, command.tokenIn(), command.tokenOut(), command.amount(), clock.instant());

    try {
      orderJobQueue.submit(order).join();
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof EnqueueFailedException enqueueFailed) {
        throw enqueueFailed;
      }
      throw new EnqueueFailedException(
          QueueTopics.ORDERS_SUBMITTED_V1,
          orderId,
          "Could not enqueue order " + orderId,
          ex.getCause() == null ? ex : ex.getCause());
    }

    log.info(
        "Order queued orderId={} pair={}/{} amount={}",
        orderId,
        command.tokenIn(),
        command.tokenOut(),
        command.amount());
    return orderId;
  }
}
