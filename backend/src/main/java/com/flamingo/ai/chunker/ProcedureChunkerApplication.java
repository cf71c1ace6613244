package com.flamingo.ai.chunker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the procedure chunking service. */
@SpringBootApplication
public class ProcedureChunkerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProcedureChunkerApplication.class, args);
  }
}
