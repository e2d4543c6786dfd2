package com.wordscout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WordScoutApplication {

  public static void main(String[] args) {
    SpringApplication.run(WordScoutApplication.class, args);
  }
}
