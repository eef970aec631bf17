package com.swapengine.infra.kafka.consumer;

import com.swapengine.infra.kafka.codec.JobCodec;
import com.swapengine.infra.kafka.contract.JobEnvelope;
import com.swapengine.infra.kafka.contract.JobHeaders;
import com.swapengine.infra.kafka.contract.MalformedJobException;
import com.swapengine.infra.kafka.deadletter.DeadLetter;
import com.swapengine.infra.kafka.deadletter.DeadLetterSink;
import com.swapengine.infra.kafka.retry.RetryPolicy;
import com.swapengine.infra.kafka.telemetry.QueueTelemetry;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one job record to an outcome: decode, check it is the expected job type and version, then
 * call the handler, retrying failed attempts as the {@link RetryPolicy} allows. A record that
 * cannot be decoded or whose attempts are exhausted goes to the {@link DeadLetterSink}.
 *
 * <p>{@link #dispatch} never throws, so the listener can always acknowledge the record.
 */
public class JobDispatcher<T> {
  private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

  private final Class<T> payloadType;
  private final String jobType;
  private final int schemaVersion;
  private final JobCodec codec;
  private final JobHandler<T> handler;
  private final RetryPolicy retryPolicy;
  private final DeadLetterSink deadLetterSink;
  private final QueueTelemetry telemetry;
  private final Clock clock;

  public JobDispatcher(
      Class<T> payloadType,
      String jobType,
      int schemaVersion,
      JobCodec codec,
      JobHandler<T> handler,
      RetryPolicy retryPolicy,
      DeadLetterSink deadLetterSink,
      QueueTelemetry telemetry,
      Clock clock) {
    this.payloadType = payloadType;
    this.jobType = jobType;
    this.schemaVersion = schemaVersion;
    this.codec = codec;
    this.handler = handler;
    this.retryPolicy = retryPolicy == null ? RetryPolicy.NEVER : retryPolicy;
    this.deadLetterSink = deadLetterSink;
    this.telemetry = telemetry == null ? QueueTelemetry.NOOP : telemetry;
    this.clock = clock;
  }

  public JobOutcome dispatch(ConsumerRecord<String, String> record) {
    long started = System.nanoTime();

    JobEnvelope<T> job;
    try {
      job = open(record);
    } catch (RuntimeException ex) {
      telemetry.attemptFailed(record.topic(), jobType, 1, ex);
      return deadLetter(record, ex, 1);
    }

    int attempt = 1;
    while (true) {
      try {
        handler.handle(job);
        telemetry.completed(record.topic(), jobType, attempt, System.nanoTime() - started);
        return JobOutcome.COMPLETED;
      } catch (Exception ex) {
        telemetry.attemptFailed(record.topic(), jobType, attempt, ex);
        Optional<Duration> delay = retryPolicy.nextAttemptDelay(attempt, ex);
        if (delay.isEmpty()) {
          return deadLetter(record, ex, attempt);
        }
        log.info(
            "Retrying job orderId={} jobId={} attempt={} delay={} error={}",
            job.orderId(),
            job.jobId(),
            attempt,
            delay.get(),
            ex.getMessage());
        if (!pause(delay.get())) {
          return deadLetter(
              record, new IllegalStateException("Interrupted between job attempts", ex), attempt);
        }
        attempt++;
      }
    }
  }

  private JobEnvelope<T> open(ConsumerRecord<String, String> record) {
    String headerType = JobHeaders.require(record.headers(), JobHeaders.JOB_TYPE);
    int headerVersion = JobHeaders.requireVersion(record.headers());
    JobHeaders.require(record.headers(), JobHeaders.ORDER_ID);
    if (!jobType.equals(headerType) || schemaVersion != headerVersion) {
      throw new MalformedJobException(
          "Expected " + jobType + " v" + schemaVersion + " but got " + headerType + " v"
              + headerVersion);
    }

    JobEnvelope<T> job = codec.decode(record.value(), payloadType);
    if (!jobType.equals(job.jobType()) || schemaVersion != job.schemaVersion()) {
      throw new MalformedJobException(
          "Job body is " + job.jobType() + " v" + job.schemaVersion() + ", headers say "
              + headerType + " v" + headerVersion);
    }
    return job;
  }

  private JobOutcome deadLetter(ConsumerRecord<String, String> record, Exception cause, int attempts) {
    deadLetterSink.accept(new DeadLetter(record, cause, attempts, clock.instant()));
    telemetry.deadLettered(record.topic(), jobType, cause);
    return JobOutcome.DEAD_LETTERED;
  }

  private static boolean pause(Duration delay) {
    if (delay.isZero() || delay.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
