package com.flamingo.ai.contextlab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContextLabApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContextLabApplication.class, args);
  }
}
