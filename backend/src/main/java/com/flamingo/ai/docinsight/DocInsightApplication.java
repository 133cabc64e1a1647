package com.flamingo.ai.docinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the document outline and persona relevance service. */
@SpringBootApplication
public class DocInsightApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocInsightApplication.class, args);
  }
}
