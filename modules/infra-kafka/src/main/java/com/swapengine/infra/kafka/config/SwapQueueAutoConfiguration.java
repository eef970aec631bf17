package com.swapengine.infra.kafka.config;

import com.swapengine.infra.kafka.codec.JobCodec;
import com.swapengine.infra.kafka.deadletter.DeadLetterSink;
import com.swapengine.infra.kafka.deadletter.KafkaDeadLetterSink;
import com.swapengine.infra.kafka.deadletter.LoggingDeadLetterSink;
import com.swapengine.infra.kafka.producer.JobPublisher;
import com.swapengine.infra.kafka.producer.KafkaJobPublisher;
import com.swapengine.infra.kafka.producer.OrderJobQueue;
import com.swapengine.infra.kafka.retry.BackoffRetryPolicy;
import com.swapengine.infra.kafka.retry.RetryPolicy;
import com.swapengine.infra.kafka.telemetry.MicrometerQueueTelemetry;
import com.swapengine.infra.kafka.telemetry.QueueTelemetry;
import com.swapengine.infra.kafka.topics.QueueTopics;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;

/**
 * Wires the order queue on Kafka. Every bean backs off when the application defines its own.
 * Listeners bind to {@value #LISTENER_FACTORY}.
 */
@AutoConfiguration
@EnableConfigurationProperties(SwapQueueProperties.class)
public class SwapQueueAutoConfiguration {
  private static final Logger log = LoggerFactory.getLogger(SwapQueueAutoConfiguration.class);

  public static final String LISTENER_FACTORY = "swapQueueListenerContainerFactory";

  @Bean
  @ConditionalOnMissingBean
  public JobCodec jobCodec() {
    return JobCodec.withDefaults();
  }

  @Bean
  @ConditionalOnMissingBean
  public QueueTelemetry queueTelemetry(ObjectProvider<MeterRegistry> meterRegistry) {
    MeterRegistry registry = meterRegistry.getIfAvailable();
    return registry == null ? QueueTelemetry.NOOP : new MicrometerQueueTelemetry(registry);
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy jobRetryPolicy(SwapQueueProperties properties) {
    SwapQueueProperties.Attempts attempts = properties.getAttempts();
    BackoffRetryPolicy policy =
        new BackoffRetryPolicy(
            attempts.getMax(), attempts.getBackoff(), attempts.getDelay(), attempts.getMaxDelay());
    log.info("Job retry policy {}", policy);
    return policy;
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadLetterSink deadLetterSink(
      KafkaTemplate<String, String> swapQueueTemplate, SwapQueueProperties properties) {
    SwapQueueProperties.DeadLetter deadLetter = properties.getDeadLetter();
    if (deadLetter.getMode() == SwapQueueProperties.DeadLetterMode.TOPIC) {
      return new KafkaDeadLetterSink(swapQueueTemplate, deadLetter.isIncludePayload());
    }
    return new LoggingDeadLetterSink();
  }

  @Bean
  @ConditionalOnMissingBean(name = "swapQueueProducerFactory")
  public ProducerFactory<String, String> swapQueueProducerFactory(SwapQueueProperties properties) {
    SwapQueueProperties.Producer producer = properties.getProducer();
    Map<String, Object> config = new HashMap<>();
    config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServersCsv());
    config.put(ProducerConfig.CLIENT_ID_CONFIG, properties.getClientId());
    config.put(ProducerConfig.ACKS_CONFIG, producer.getAcks());
    config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, producer.isIdempotent());
    config.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, producer.getCompression());
    config.put(ProducerConfig.LINGER_MS_CONFIG, (int) producer.getLinger().toMillis());
    config.put(
        ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, (int) producer.getDeliveryTimeout().toMillis());
    config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    return new DefaultKafkaProducerFactory<>(config);
  }

  @Bean
  @ConditionalOnMissingBean(name = "swapQueueTemplate")
  public KafkaTemplate<String, String> swapQueueTemplate(
      ProducerFactory<String, String> swapQueueProducerFactory) {
    return new KafkaTemplate<>(swapQueueProducerFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public JobPublisher jobPublisher(
      KafkaTemplate<String, String> swapQueueTemplate,
      JobCodec jobCodec,
      QueueTelemetry queueTelemetry,
      SwapQueueProperties properties) {
    return new KafkaJobPublisher(
        swapQueueTemplate, jobCodec, queueTelemetry, properties.getProducer().getSendTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public OrderJobQueue orderJobQueue(
      JobPublisher jobPublisher, SwapQueueProperties properties, ObjectProvider<Clock> clock) {
    return new OrderJobQueue(
        jobPublisher, properties.getClientId(), clock.getIfAvailable(Clock::systemUTC));
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "swap.queue.topics",
      name = "provision",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(name = "swapQueueTopics")
  public KafkaAdmin.NewTopics swapQueueTopics(SwapQueueProperties properties) {
    SwapQueueProperties.Topics topics = properties.getTopics();
    return new KafkaAdmin.NewTopics(
        QueueTopics.newTopics(properties.provisionedPartitions(), topics.getReplicas())
            .toArray(NewTopic[]::new));
  }

  @Bean
  @ConditionalOnMissingBean(name = "swapQueueConsumerFactory")
  public ConsumerFactory<String, String> swapQueueConsumerFactory(SwapQueueProperties properties) {
    SwapQueueProperties.Consumer consumer = properties.getConsumer();
    Map<String, Object> config = new HashMap<>();
    config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServersCsv());
    config.put(ConsumerConfig.CLIENT_ID_CONFIG, properties.getClientId());
    config.put(ConsumerConfig.GROUP_ID_CONFIG, consumer.getGroupId());
    config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, consumer.getAutoOffsetReset());
    config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    config.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, consumer.getMaxPollRecords());
    config.put(
        ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, (int) consumer.getMaxPollInterval().toMillis());
    config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
    config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
    return new DefaultKafkaConsumerFactory<>(config);
  }

  @Bean(name = LISTENER_FACTORY)
  @ConditionalOnMissingBean(name = LISTENER_FACTORY)
  public ConcurrentKafkaListenerContainerFactory<String, String> swapQueueListenerContainerFactory(
      ConsumerFactory<String, String> swapQueueConsumerFactory, SwapQueueProperties properties) {
    ConcurrentKafkaListenerContainerFactory<String, String> factory =
        new ConcurrentKafkaListenerContainerFactory<>();
    factory.setConsumerFactory(swapQueueConsumerFactory);
    factory.setConcurrency(Math.max(1, properties.getConsumer().getConcurrency()));
    factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
    return factory;
  }
}
