package com.scholary.radio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RadioNarratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(RadioNarratorApplication.class, args);
  }
}
