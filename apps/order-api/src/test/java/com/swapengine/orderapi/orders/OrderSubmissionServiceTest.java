package com.swapengine.orderapi.orders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.swapengine.infra.kafka.contract.payload.OrderSubmittedV1;
import com.swapengine.infra.kafka.producer.EnqueueFailedException;
import com.swapengine.infra.kafka.producer.OrderJobQueue;
import com.swapengine.infra.kafka.topics.QueueTopics;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class OrderSubmissionServiceTest {
  private static final Instant NOW = Instant.parse("2026-03-01T09:30:00Z");

  private final OrderJobQueue queue = mock(OrderJobQueue.class);
  private final OrderSubmissionService service =
      new OrderSubmissionService(queue, Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void queuesEachOrderUnderFreshId() {
    when(queue.submit(any())).thenReturn(CompletableFuture.completedFuture(null));

    String first = service.submit(new SubmitOrderCommand("USDC", "SOL", new BigDecimal("100")));
    String second = service.submit(new SubmitOrderCommand("USDC", "SOL", new BigDecimal("100")));

    assertNotEquals(first, second);
    ArgumentCaptor<OrderSubmittedV1> captor = ArgumentCaptor.forClass(OrderSubmittedV1.class);
    verify(queue, times(2)).submit(captor.capture());
    OrderSubmittedV1 queued = captor.getAllValues().get(0);
    assertEquals(first, queued.orderId());
    assertEquals("USDC", queued.tokenIn());
    assertEquals("SOL", queued.tokenOut());
    assertEquals(new BigDecimal("100"), queued.amount());
    assertEquals(NOW, queued.submittedAt());
  }

  @Test
  void rethrowsEnqueueFailureAsIs() {
    EnqueueFailedException failure =
        new EnqueueFailedException(
            QueueTopics.ORDERS_SUBMITTED_V1, "ord-1", "down", new IllegalStateException());
    when(queue.submit(any())).thenReturn(CompletableFuture.failedFuture(failure));

    EnqueueFailedException thrown =
        assertThrows(
            EnqueueFailedException.class,
            () -> service.submit(new SubmitOrderCommand("USDC", "SOL", BigDecimal.ONE)));
    assertSame(failure, thrown);
  }

  @Test
  void wrapsAnyOtherQueueFailure() {
    when(queue.submit(any()))
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("serializer")));

    EnqueueFailedException thrown =
        assertThrows(
            EnqueueFailedException.class,
            () -> service.submit(new SubmitOrderCommand("USDC", "SOL", BigDecimal.ONE)));
    assertEquals(QueueTopics.ORDERS_SUBMITTED_V1, thrown.getTopic());
    assertInstanceOf(IllegalStateException.class, thrown.getCause());
  }
}
