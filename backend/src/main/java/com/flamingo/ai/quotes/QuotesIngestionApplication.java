package com.flamingo.ai.quotes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Command-line application that loads Wikiquote dumps into the quotes catalog. */
@SpringBootApplication
public class QuotesIngestionApplication {

  public static void main(String[] args) {
    System.exit(
        SpringApplication.exit(SpringApplication.run(QuotesIngestionApplication.class, args)));
  }
}
