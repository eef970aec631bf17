package com.swapengine.infra.kafka.producer;

import com.swapengine.infra.kafka.codec.JobCodec;
import com.swapengine.infra.kafka.contract.JobEnvelope;
import com.swapengine.infra.kafka.contract.JobHeaders;
import com.swapengine.infra.kafka.telemetry.QueueTelemetry;
import com.swapengine.infra.kafka.topics.QueueTopics;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

/** Writes jobs as JSON records keyed by orderId, with the job headers stamped on each record. */
public class KafkaJobPublisher implements JobPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaJobPublisher.class);

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final JobCodec codec;
  private final QueueTelemetry telemetry;
  private final Duration sendTimeout;

  public KafkaJobPublisher(
      KafkaTemplate<String, String> kafkaTemplate,
      JobCodec codec,
      QueueTelemetry telemetry,
      Duration sendTimeout) {
    this.kafkaTemplate = kafkaTemplate;
    this.codec = codec;
    this.telemetry = telemetry == null ? QueueTelemetry.NOOP : telemetry;
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
  }

  @Override
  public <T> CompletableFuture<RecordMetadata> enqueue(String topic, JobEnvelope<T> job) {
    QueueTopics.requireValid(topic);
    long started = System.nanoTime();

    ProducerRecord<String, String> record =
        new ProducerRecord<>(topic, job.orderId(), codec.encode(job));
    JobHeaders.stamp(record.headers(), job);

    CompletableFuture<RecordMetadata> acknowledged =
        kafkaTemplate.send(record).thenApply(result -> result.getRecordMetadata());
    if (!sendTimeout.isZero() && !sendTimeout.isNegative()) {
      acknowledged = acknowledged.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    return acknowledged.handle(
        (metadata, error) -> {
          if (error == null) {
            telemetry.enqueued(topic, job.jobType(), System.nanoTime() - started);
            log.debug(
                "Job enqueued topic={} orderId={} jobId={} partition={} offset={}",
                topic,
                job.orderId(),
                job.jobId(),
                metadata == null ? -1 : metadata.partition(),
                metadata == null ? -1L : metadata.offset());
            return metadata;
          }
          EnqueueFailedException failure = toEnqueueFailure(topic, job, error);
          telemetry.enqueueFailed(topic, job.jobType(), failure.getCause());
          throw failure;
        });
  }

  private static EnqueueFailedException toEnqueueFailure(
      String topic, JobEnvelope<?> job, Throwable error) {
    Throwable cause = error;
    while (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    String what = cause instanceof TimeoutException ? "Timed out enqueuing" : "Could not enqueue";
    return new EnqueueFailedException(
        topic,
        job.orderId(),
        what + " job " + job.jobType() + " orderId=" + job.orderId() + " topic=" + topic,
        cause);
  }
}
