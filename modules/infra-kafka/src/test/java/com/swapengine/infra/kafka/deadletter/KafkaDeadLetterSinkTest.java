package com.swapengine.infra.kafka.deadletter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.swapengine.infra.kafka.codec.JobCodec;
import com.swapengine.infra.kafka.contract.JobHeaders;
import com.swapengine.infra.kafka.support.Jobs;
import com.swapengine.infra.kafka.topics.QueueTopics;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

class KafkaDeadLetterSinkTest {
  private static final Instant FAILED_AT = Instant.parse("2026-03-01T12:00:05Z");

  @SuppressWarnings("unchecked")
  private final KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);

  private final ConsumerRecord<String, String> failed =
      Jobs.record(JobCodec.withDefaults(), Jobs.orderSubmitted("ord-9"));

  @Test
  void republishesToDeadLetterTopicWithDiagnostics() {
    CompletableFuture<SendResult<String, String>> sent = new CompletableFuture<>();
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(sent);
    KafkaDeadLetterSink sink = new KafkaDeadLetterSink(kafkaTemplate, true);

    sink.accept(new DeadLetter(failed, new IllegalStateException("worker crashed"), 3, FAILED_AT));

    ProducerRecord<String, String> record = captureSent();
    assertEquals(QueueTopics.ORDERS_SUBMITTED_DLQ_V1, record.topic());
    assertEquals("ord-9", record.key());
    assertEquals(failed.value(), record.value());
    assertEquals("OrderSubmitted", JobHeaders.read(record.headers(), JobHeaders.JOB_TYPE));
    assertEquals(
        QueueTopics.ORDERS_SUBMITTED_V1,
        JobHeaders.read(record.headers(), KafkaDeadLetterSink.SOURCE_TOPIC));
    assertEquals("2", JobHeaders.read(record.headers(), KafkaDeadLetterSink.SOURCE_PARTITION));
    assertEquals("41", JobHeaders.read(record.headers(), KafkaDeadLetterSink.SOURCE_OFFSET));
    assertEquals("3", JobHeaders.read(record.headers(), KafkaDeadLetterSink.ATTEMPTS));
    assertEquals(
        IllegalStateException.class.getName(),
        JobHeaders.read(record.headers(), KafkaDeadLetterSink.ERROR_CLASS));
    assertEquals(
        "worker crashed", JobHeaders.read(record.headers(), KafkaDeadLetterSink.ERROR_MESSAGE));
    assertEquals(
        FAILED_AT.toString(), JobHeaders.read(record.headers(), KafkaDeadLetterSink.FAILED_AT));
  }

  @Test
  void dropsPayloadWhenConfigured() {
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(new CompletableFuture<>());
    KafkaDeadLetterSink sink = new KafkaDeadLetterSink(kafkaTemplate, false);

    sink.accept(new DeadLetter(failed, new RuntimeException(), 1, FAILED_AT));

    ProducerRecord<String, String> record = captureSent();
    assertNull(record.value());
    assertEquals(
        "RuntimeException", JobHeaders.read(record.headers(), KafkaDeadLetterSink.ERROR_MESSAGE));
  }

  @Test
  void failedSendIsAbsorbed() {
    when(kafkaTemplate.send(any(ProducerRecord.class)))
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker gone")));
    KafkaDeadLetterSink sink = new KafkaDeadLetterSink(kafkaTemplate, true);

    sink.accept(new DeadLetter(failed, new IllegalStateException("x"), 1, FAILED_AT));

    captureSent();
  }

  @SuppressWarnings("unchecked")
  private ProducerRecord<String, String> captureSent() {
    ArgumentCaptor<ProducerRecord<String, String>> captor =
        ArgumentCaptor.forClass(ProducerRecord.class);
    verify(kafkaTemplate).send(captor.capture());
    return captor.getValue();
  }
}
