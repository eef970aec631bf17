package com.swapengine.infra.kafka.topics;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.kafka.clients.admin.NewTopic;

/** Topic names of the order queue and their dead-letter counterparts. */
public final class QueueTopics {
  // <domain>.<name>[.<qualifier>].v<version>
  private static final Pattern NAME =
      Pattern.compile("^[a-z][a-z0-9]*(\\.[a-z][a-z0-9]*)+\\.v[1-9][0-9]*$");
  private static final Pattern VERSION_SUFFIX = Pattern.compile("\\.v[1-9][0-9]*$");

  public static final String ORDERS_SUBMITTED_V1 = "orders.submitted.v1";
  public static final String ORDERS_SUBMITTED_DLQ_V1 = "orders.submitted.dlq.v1";

  private QueueTopics() {}

  public static List<String> all() {
    return List.of(ORDERS_SUBMITTED_V1, ORDERS_SUBMITTED_DLQ_V1);
  }

  public static boolean isValid(String topic) {
    return topic != null && NAME.matcher(topic).matches();
  }

  public static String requireValid(String topic) {
    if (!isValid(topic)) {
      throw new IllegalArgumentException("Invalid topic name: " + topic);
    }
    return topic;
  }

  /** {@code orders.submitted.v1} becomes {@code orders.submitted.dlq.v1}. */
  public static String deadLetterTopicOf(String sourceTopic) {
    requireValid(sourceTopic);
    Matcher version = VERSION_SUFFIX.matcher(sourceTopic);
    if (!version.find()) {
      throw new IllegalArgumentException("Topic has no version suffix: " + sourceTopic);
    }
    return sourceTopic.substring(0, version.start()) + ".dlq" + version.group();
  }

  public static List<NewTopic> newTopics(int partitions, short replicas) {
    if (partitions < 1) {
      throw new IllegalArgumentException("partitions must be >= 1");
    }
    if (replicas < 1) {
      throw new IllegalArgumentException("replicas must be >= 1");
    }
    return all().stream().map(name -> new NewTopic(name, partitions, replicas)).toList();
  }
}
