package com.swapengine.infra.kafka.deadletter;

public interface DeadLetterSink {
  void accept(DeadLetter deadLetter);
}
