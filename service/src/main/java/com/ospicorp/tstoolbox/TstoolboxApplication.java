package com.ospicorp.tstoolbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TstoolboxApplication {

  public static void main(String[] args) {
    SpringApplication.run(TstoolboxApplication.class, args);
  }
}
