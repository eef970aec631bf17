package com.swapengine.infra.kafka.deadletter;

import com.swapengine.infra.kafka.contract.JobHeaders;
import com.swapengine.infra.kafka.topics.QueueTopics;
import java.util.Objects;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Republishes a dead job to {@code <topic>.dlq.v<n>}, keeping the original key and job headers
 * and adding {@code x-dlq-*} diagnostics. The send is not awaited; a failed send is logged.
 */
public class KafkaDeadLetterSink implements DeadLetterSink {
  private static final Logger log = LoggerFactory.getLogger(KafkaDeadLetterSink.class);

  static final String SOURCE_TOPIC = "x-dlq-source-topic";
  static final String SOURCE_PARTITION = "x-dlq-source-partition";
  static final String SOURCE_OFFSET = "x-dlq-source-offset";
  static final String ATTEMPTS = "x-dlq-attempts";
  static final String ERROR_CLASS = "x-dlq-error-class";
  static final String ERROR_MESSAGE = "x-dlq-error-message";
  static final String FAILED_AT = "x-dlq-failed-at";

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final boolean includePayload;

  public KafkaDeadLetterSink(KafkaTemplate<String, String> kafkaTemplate, boolean includePayload) {
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    this.includePayload = includePayload;
  }

  @Override
  public void accept(DeadLetter deadLetter) {
    ConsumerRecord<String, String> source = deadLetter.record();
    String target = QueueTopics.deadLetterTopicOf(deadLetter.sourceTopic());
    ProducerRecord<String, String> record =
        new ProducerRecord<>(target, source.key(), includePayload ? source.value() : null);
    for (Header header : source.headers()) {
      record.headers().add(header);
    }
    JobHeaders.put(record.headers(), SOURCE_TOPIC, source.topic());
    JobHeaders.put(record.headers(), SOURCE_PARTITION, Integer.toString(source.partition()));
    JobHeaders.put(record.headers(), SOURCE_OFFSET, Long.toString(source.offset()));
    JobHeaders.put(record.headers(), ATTEMPTS, Integer.toString(deadLetter.attempts()));
    JobHeaders.put(record.headers(), ERROR_CLASS, deadLetter.cause().getClass().getName());
    JobHeaders.put(record.headers(), ERROR_MESSAGE, deadLetter.reason());
    JobHeaders.put(record.headers(), FAILED_AT, deadLetter.failedAt().toString());

    kafkaTemplate
        .send(record)
        .whenComplete(
            (result, error) -> {
              if (error != null) {
                log.error(
                    "Dead letter not written target={} orderId={} offset={}",
                    target,
                    source.key(),
                    source.offset(),
                    error);
              } else {
                log.warn(
                    "Dead letter written target={} orderId={} attempts={} reason={}",
                    target,
                    source.key(),
                    deadLetter.attempts(),
                    deadLetter.reason());
              }
            });
  }
}
