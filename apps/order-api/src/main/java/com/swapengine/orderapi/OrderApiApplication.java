package com.swapengine.orderapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrderApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(OrderApiApplication.class, args);
  }
}
