package com.swapengine.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;

@SpringBootApplication
@EnableKafka
public class WorkerExecApplication {
  public static void main(String[] args) {
    SpringApplication.run(WorkerExecApplication.class, args);
  }
}
