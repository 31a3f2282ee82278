package com.flamingo.ai.resumescreener;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResumeScreenerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ResumeScreenerApplication.class, args);
  }
}
