package com.callcenter.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CallCenterApplication {

  public static void main(String[] args) {
    SpringApplication.run(CallCenterApplication.class, args);
  }
}
