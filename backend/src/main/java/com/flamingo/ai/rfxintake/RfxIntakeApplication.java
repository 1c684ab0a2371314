package com.flamingo.ai.rfxintake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the RFX intake service. */
@SpringBootApplication
public class RfxIntakeApplication {

  public static void main(String[] args) {
    SpringApplication.run(RfxIntakeApplication.class, args);
  }
}
