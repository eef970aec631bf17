package com.swapengine.infra.kafka.retry;

public enum BackoffType {
  FIXED,
  EXPONENTIAL
}
