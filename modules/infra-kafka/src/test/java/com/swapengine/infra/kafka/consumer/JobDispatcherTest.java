package com.swapengine.infra.kafka.consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.swapengine.infra.kafka.codec.JobCodec;
import com.swapengine.infra.kafka.contract.JobEnvelope;
import com.swapengine.infra.kafka.contract.JobHeaders;
import com.swapengine.infra.kafka.contract.JobTypes;
import com.swapengine.infra.kafka.contract.MalformedJobException;
import com.swapengine.infra.kafka.contract.payload.OrderSubmittedV1;
import com.swapengine.infra.kafka.deadletter.DeadLetter;
import com.swapengine.infra.kafka.retry.BackoffRetryPolicy;
import com.swapengine.infra.kafka.retry.RetryPolicy;
import com.swapengine.infra.kafka.support.Jobs;
import com.swapengine.infra.kafka.telemetry.QueueTelemetry;
import com.swapengine.infra.kafka.topics.QueueTopics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.Test;

class JobDispatcherTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:10Z");

  private final JobCodec codec = JobCodec.withDefaults();
  private final List<DeadLetter> deadLetters = new ArrayList<>();
  private final List<JobEnvelope<OrderSubmittedV1>> handled = new ArrayList<>();

  @Test
  void completesJobOnFirstAttempt() {
    JobEnvelope<OrderSubmittedV1> job = Jobs.orderSubmitted("ord-1");
    JobDispatcher<OrderSubmittedV1> dispatcher = dispatcher(handled::add, RetryPolicy.NEVER);

    JobOutcome outcome = dispatcher.dispatch(Jobs.record(codec, job));

    assertEquals(JobOutcome.COMPLETED, outcome);
    assertEquals(List.of(job), handled);
    assertEquals(List.of(), deadLetters);
  }

  @Test
  void retriesFailedAttemptsUntilHandlerSucceeds() {
    AtomicInteger calls = new AtomicInteger();
    JobDispatcher<OrderSubmittedV1> dispatcher =
        dispatcher(
            job -> {
              if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("rpc busy");
              }
            },
            BackoffRetryPolicy.fixed(3, Duration.ZERO));

    JobOutcome outcome = dispatcher.dispatch(Jobs.record(codec, Jobs.orderSubmitted("ord-2")));

    assertEquals(JobOutcome.COMPLETED, outcome);
    assertEquals(3, calls.get());
    assertEquals(List.of(), deadLetters);
  }

  @Test
  void deadLettersAfterAttemptsAreExhausted() {
    AtomicInteger calls = new AtomicInteger();
    IllegalStateException failure = new IllegalStateException("worker crashed");
    JobDispatcher<OrderSubmittedV1> dispatcher =
        dispatcher(
            job -> {
              calls.incrementAndGet();
              throw failure;
            },
            BackoffRetryPolicy.fixed(2, Duration.ZERO));

    ConsumerRecord<String, String> record = Jobs.record(codec, Jobs.orderSubmitted("ord-3"));
    JobOutcome outcome = dispatcher.dispatch(record);

    assertEquals(JobOutcome.DEAD_LETTERED, outcome);
    assertEquals(2, calls.get());
    assertEquals(1, deadLetters.size());
    DeadLetter deadLetter = deadLetters.get(0);
    assertSame(record, deadLetter.record());
    assertSame(failure, deadLetter.cause());
    assertEquals(2, deadLetter.attempts());
    assertEquals(NOW, deadLetter.failedAt());
  }

  @Test
  void deadLettersRecordWithoutJobHeaders() {
    ConsumerRecord<String, String> record =
        new ConsumerRecord<>(
            QueueTopics.ORDERS_SUBMITTED_V1,
            0,
            5L,
            "ord-4",
            codec.encode(Jobs.orderSubmitted("ord-4")));
    JobDispatcher<OrderSubmittedV1> dispatcher = dispatcher(handled::add, RetryPolicy.NEVER);

    assertEquals(JobOutcome.DEAD_LETTERED, dispatcher.dispatch(record));
    assertEquals(List.of(), handled);
    assertInstanceOf(MalformedJobException.class, deadLetters.get(0).cause());
    assertEquals(1, deadLetters.get(0).attempts());
  }

  @Test
  void deadLettersUnexpectedJobType() {
    ConsumerRecord<String, String> record = Jobs.record(codec, Jobs.orderSubmitted("ord-5"));
    JobHeaders.put(record.headers(), JobHeaders.JOB_TYPE, "OrderCancelled");
    JobDispatcher<OrderSubmittedV1> dispatcher = dispatcher(handled::add, RetryPolicy.NEVER);

    assertEquals(JobOutcome.DEAD_LETTERED, dispatcher.dispatch(record));
    assertEquals(List.of(), handled);
    assertInstanceOf(MalformedJobException.class, deadLetters.get(0).cause());
  }

  @Test
  void deadLettersUnreadableBodyWithoutRetrying() {
    ConsumerRecord<String, String> valid = Jobs.record(codec, Jobs.orderSubmitted("ord-6"));
    ConsumerRecord<String, String> garbled =
        new ConsumerRecord<>(valid.topic(), valid.partition(), valid.offset(), valid.key(), "{oops");
    valid.headers().forEach(header -> garbled.headers().add(header));
    JobDispatcher<OrderSubmittedV1> dispatcher =
        dispatcher(handled::add, BackoffRetryPolicy.fixed(5, Duration.ZERO));

    assertEquals(JobOutcome.DEAD_LETTERED, dispatcher.dispatch(garbled));
    assertEquals(List.of(), handled);
    assertEquals(1, deadLetters.get(0).attempts());
  }

  private JobDispatcher<OrderSubmittedV1> dispatcher(
      JobHandler<OrderSubmittedV1> handler, RetryPolicy retryPolicy) {
    return new JobDispatcher<>(
        OrderSubmittedV1.class,
        JobTypes.ORDER_SUBMITTED,
        1,
        codec,
        handler,
        retryPolicy,
        deadLetters::add,
        QueueTelemetry.NOOP,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }
}
