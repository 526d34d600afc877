package com.flamingo.ai.nlp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NlpPreprocessingApplication {

  public static void main(String[] args) {
    SpringApplication.run(NlpPreprocessingApplication.class, args);
  }
}
