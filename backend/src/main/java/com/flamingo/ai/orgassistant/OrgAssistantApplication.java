package com.flamingo.ai.orgassistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Organization assistant retrieval core. */
@SpringBootApplication
public class OrgAssistantApplication {

  public static void main(String[] args) {
    SpringApplication.run(OrgAssistantApplication.class, args);
  }
}
