package com.swapengine.infra.kafka.consumer;

import com.swapengine.infra.kafka.contract.JobEnvelope;

@FunctionalInterface
public interface JobHandler<T> {
  void handle(JobEnvelope<T> job) throws Exception;
}
