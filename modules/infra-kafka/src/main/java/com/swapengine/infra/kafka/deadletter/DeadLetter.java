package com.swapengine.infra.kafka.deadletter;

import java.time.Instant;
import org.apache.kafka.clients.consumer.ConsumerRecord;

/** A job record given up on, with the failure that ended it and the attempts it took. */
public record DeadLetter(
    ConsumerRecord<String, String> record, Exception cause, int attempts, Instant failedAt) {
  public String sourceTopic() {
    return record.topic();
  }

  public String reason() {
    String message = cause.getMessage();
    if (message == null || message.isBlank()) {
      return cause.getClass().getSimpleName();
    }
    return message;
  }
}
