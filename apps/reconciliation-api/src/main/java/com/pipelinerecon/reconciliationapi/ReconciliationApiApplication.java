package com.pipelinerecon.reconciliationapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReconciliationApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(ReconciliationApiApplication.class, args);
  }
}
