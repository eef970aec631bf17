package com.swapengine.infra.kafka.producer;

/** The broker did not accept a job, or did not acknowledge it within the send timeout. */
public class EnqueueFailedException extends RuntimeException {
  private final String topic;
  private final String orderId;

  public EnqueueFailedException(String topic, String orderId, String message, Throwable cause) {
    super(message, cause);
    this.topic = topic;
    this.orderId = orderId;
  }

  public String getTopic() {
    return topic;
  }

  public String getOrderId() {
    return orderId;
  }
}
