package com.flamingo.ai.ephemeralrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the ephemeral RAG store. */
@SpringBootApplication
public class EphemeralRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(EphemeralRagApplication.class, args);
  }
}
