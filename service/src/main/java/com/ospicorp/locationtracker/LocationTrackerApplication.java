package com.ospicorp.locationtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LocationTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(LocationTrackerApplication.class, args);
  }
}
