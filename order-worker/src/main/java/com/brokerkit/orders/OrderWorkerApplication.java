package com.brokerkit.orders;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrderWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(OrderWorkerApplication.class, args);
  }
}
