package com.swapengine.infra.kafka.contract;

/**
 * A record that can never be processed: missing headers, an unreadable body or a job of another
 * type or version. It is dead-lettered on the first attempt.
 */
public class MalformedJobException extends RuntimeException {
  public MalformedJobException(String message) {
    super(message);
  }

  public MalformedJobException(String message, Throwable cause) {
    super(message, cause);
  }
}
