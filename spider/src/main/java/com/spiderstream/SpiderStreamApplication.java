package com.spiderstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SpiderStreamApplication {

  public static void main(String[] args) {
    SpringApplication.run(SpiderStreamApplication.class, args);
  }
}
