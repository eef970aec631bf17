package com.swapengine.infra.kafka.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerQueueTelemetry implements QueueTelemetry {
  static final String ENQUEUED = "swap.queue.enqueued";
  static final String ENQUEUE_LATENCY = "swap.queue.enqueue.latency";
  static final String ATTEMPT_FAILURES = "swap.queue.attempt.failures";
  static final String JOBS = "swap.queue.jobs";
  static final String JOB_LATENCY = "swap.queue.job.latency";
  static final String JOB_ATTEMPTS = "swap.queue.job.attempts";

  private final MeterRegistry registry;

  public MicrometerQueueTelemetry(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void enqueued(String topic, String jobType, long latencyNanos) {
    enqueueCounter(topic, jobType, "ok", "none").increment();
    Timer.builder(ENQUEUE_LATENCY)
        .description("Time until the broker acknowledged an enqueued job")
        .tags("topic", tag(topic), "job_type", tag(jobType))
        .register(registry)
        .record(Math.max(0L, latencyNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void enqueueFailed(String topic, String jobType, Throwable error) {
    enqueueCounter(topic, jobType, "failed", errorTag(error)).increment();
  }

  @Override
  public void attemptFailed(String topic, String jobType, int attempt, Throwable error) {
    Counter.builder(ATTEMPT_FAILURES)
        .description("Job attempts that threw")
        .tags("topic", tag(topic), "job_type", tag(jobType), "error", errorTag(error))
        .register(registry)
        .increment();
  }

  @Override
  public void completed(String topic, String jobType, int attempts, long latencyNanos) {
    jobCounter(topic, jobType, "completed").increment();
    Timer.builder(JOB_LATENCY)
        .description("Time from dequeue to job completion, retries included")
        .tags("topic", tag(topic), "job_type", tag(jobType))
        .register(registry)
        .record(Math.max(0L, latencyNanos), TimeUnit.NANOSECONDS);
    DistributionSummary.builder(JOB_ATTEMPTS)
        .description("Attempts needed by completed jobs")
        .tags("topic", tag(topic), "job_type", tag(jobType))
        .register(registry)
        .record(attempts);
  }

  @Override
  public void deadLettered(String topic, String jobType, Throwable error) {
    jobCounter(topic, jobType, "dead_lettered").increment();
  }

  private Counter enqueueCounter(String topic, String jobType, String outcome, String error) {
    return Counter.builder(ENQUEUED)
        .description("Jobs handed to the broker")
        .tags("topic", tag(topic), "job_type", tag(jobType), "outcome", outcome, "error", error)
        .register(registry);
  }

  private Counter jobCounter(String topic, String jobType, String outcome) {
    return Counter.builder(JOBS)
        .description("Jobs that left the queue, by outcome")
        .tags("topic", tag(topic), "job_type", tag(jobType), "outcome", outcome)
        .register(registry);
  }

  private static String tag(String value) {
    return value == null || value.isBlank() ? "unknown" : value;
  }

  private static String errorTag(Throwable error) {
    return error == null ? "none" : error.getClass().getSimpleName();
  }
}
