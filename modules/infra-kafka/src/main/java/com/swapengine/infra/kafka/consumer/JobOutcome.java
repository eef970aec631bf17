package com.swapengine.infra.kafka.consumer;

public enum JobOutcome {
  COMPLETED,
  DEAD_LETTERED
}
