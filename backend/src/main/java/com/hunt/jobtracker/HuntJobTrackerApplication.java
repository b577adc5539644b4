package com.hunt.jobtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HuntJobTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(HuntJobTrackerApplication.class, args);
  }
}
