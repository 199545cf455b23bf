package com.scholary.narrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NarratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(NarratorApplication.class, args);
  }
}
