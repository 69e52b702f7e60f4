package com.flamingo.ai.lawindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Builds a retrieval index of Vietnamese statutes, one entry per article. */
@SpringBootApplication
public class LawIndexApplication {

  public static void main(String[] args) {
    SpringApplication.run(LawIndexApplication.class, args);
  }
}
