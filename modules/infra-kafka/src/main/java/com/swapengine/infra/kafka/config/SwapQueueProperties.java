package com.swapengine.infra.kafka.config;

import com.swapengine.infra.kafka.retry.BackoffType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "swap.queue")
public class SwapQueueProperties {
  private List<String> bootstrapServers = new ArrayList<>(List.of("localhost:9092"));
  private String clientId = "swap-engine";
  private final Producer producer = new Producer();
  private final Consumer consumer = new Consumer();
  private final Attempts attempts = new Attempts();
  private final DeadLetter deadLetter = new DeadLetter();
  private final Topics topics = new Topics();

  public List<String> getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(List<String> bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public String getClientId() {
    return clientId;
  }

  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  public Producer getProducer() {
    return producer;
  }

  public Consumer getConsumer() {
    return consumer;
  }

  public Attempts getAttempts() {
    return attempts;
  }

  public DeadLetter getDeadLetter() {
    return deadLetter;
  }

  public Topics getTopics() {
    return topics;
  }

  String bootstrapServersCsv() {
    if (bootstrapServers == null || bootstrapServers.isEmpty()) {
      throw new IllegalStateException("swap.queue.bootstrap-servers must not be empty");
    }
    return String.join(",", bootstrapServers);
  }

  /**
   * Partition count used when provisioning topics. Kafka hands each partition to a single
   * listener thread of the group, so fewer partitions than {@code consumer.concurrency} would leave
   * threads idle; the count is raised to the concurrency when configured lower.
   */
  int provisionedPartitions() {
    return Math.max(1, Math.max(topics.getPartitions(), consumer.getConcurrency()));
  }

  public static class Producer {
    private String acks = "all";
    private boolean idempotent = true;
    private String compression = "lz4";
    private Duration linger = Duration.ofMillis(5);
    private Duration deliveryTimeout = Duration.ofSeconds(30);
    /** Upper bound on how long a submission waits for the broker acknowledgement. */
    private Duration sendTimeout = Duration.ofSeconds(5);

    public String getAcks() {
      return acks;
    }

    public void setAcks(String acks) {
      this.acks = acks;
    }

    public boolean isIdempotent() {
      return idempotent;
    }

    public void setIdempotent(boolean idempotent) {
      this.idempotent = idempotent;
    }

    public String getCompression() {
      return compression;
    }

    public void setCompression(String compression) {
      this.compression = compression;
    }

    public Duration getLinger() {
      return linger;
    }

    public void setLinger(Duration linger) {
      this.linger = linger;
    }

    public Duration getDeliveryTimeout() {
      return deliveryTimeout;
    }

    public void setDeliveryTimeout(Duration deliveryTimeout) {
      this.deliveryTimeout = deliveryTimeout;
    }

    public Duration getSendTimeout() {
      return sendTimeout;
    }

    public void setSendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
    }
  }

  public static class Consumer {
    private String groupId = "cg-swap-worker";
    /** Listener threads; each processes one order at a time. */
    private int concurrency = 10;
    private int maxPollRecords = 10;
    private Duration maxPollInterval = Duration.ofMinutes(5);
    private String autoOffsetReset = "earliest";

    public String getGroupId() {
      return groupId;
    }

    public void setGroupId(String groupId) {
      this.groupId = groupId;
    }

    public int getConcurrency() {
      return concurrency;
    }

    public void setConcurrency(int concurrency) {
      this.concurrency = concurrency;
    }

    public int getMaxPollRecords() {
      return maxPollRecords;
    }

    public void setMaxPollRecords(int maxPollRecords) {
      this.maxPollRecords = maxPollRecords;
    }

    public Duration getMaxPollInterval() {
      return maxPollInterval;
    }

    public void setMaxPollInterval(Duration maxPollInterval) {
      this.maxPollInterval = maxPollInterval;
    }

    public String getAutoOffsetReset() {
      return autoOffsetReset;
    }

    public void setAutoOffsetReset(String autoOffsetReset) {
      this.autoOffsetReset = autoOffsetReset;
    }
  }

  /** Per-job attempts, the first one included. */
  public static class Attempts {
    private int max = 3;
    private BackoffType backoff = BackoffType.EXPONENTIAL;
    private Duration delay = Duration.ofMillis(500);
    private Duration maxDelay = Duration.ofSeconds(5);

    public int getMax() {
      return max;
    }

    public void setMax(int max) {
      this.max = max;
    }

    public BackoffType getBackoff() {
      return backoff;
    }

    public void setBackoff(BackoffType backoff) {
      this.backoff = backoff;
    }

    public Duration getDelay() {
      return delay;
    }

    public void setDelay(Duration delay) {
      this.delay = delay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }
  }

  public static class DeadLetter {
    private DeadLetterMode mode = DeadLetterMode.LOG;
    private boolean includePayload = true;

    public DeadLetterMode getMode() {
      return mode;
    }

    public void setMode(DeadLetterMode mode) {
      this.mode = mode;
    }

    public boolean isIncludePayload() {
      return includePayload;
    }

    public void setIncludePayload(boolean includePayload) {
      this.includePayload = includePayload;
    }
  }

  public static class Topics {
    private boolean provision = true;
    /** Should be at least {@code consumer.concurrency}: one partition feeds one listener thread. */
    private int partitions = 10;
    private short replicas = 1;

    public boolean isProvision() {
      return provision;
    }

    public void setProvision(boolean provision) {
      this.provision = provision;
    }

    public int getPartitions() {
      return partitions;
    }

    public void setPartitions(int partitions) {
      this.partitions = partitions;
    }

    public short getReplicas() {
      return replicas;
    }

    public void setReplicas(short replicas) {
      this.replicas = replicas;
    }
  }

  public enum DeadLetterMode {
    LOG,
    TOPIC
  }
}
