package com.flamingo.ai.researchchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the research chat backend. */
@SpringBootApplication
public class ResearchChatApplication {

  public static void main(String[] args) {
    SpringApplication.run(ResearchChatApplication.class, args);
  }
}
