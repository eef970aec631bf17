package com.swapengine.infra.kafka.deadletter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDeadLetterSink implements DeadLetterSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingDeadLetterSink.class);

  @Override
  public void accept(DeadLetter deadLetter) {
    log.warn(
        "Dead-lettered job topic={} partition={} offset={} orderId={} attempts={} reason={}",
        deadLetter.sourceTopic(),
        deadLetter.record().partition(),
        deadLetter.record().offset(),
        deadLetter.record().key(),
        deadLetter.attempts(),
        deadLetter.reason());
  }
}
