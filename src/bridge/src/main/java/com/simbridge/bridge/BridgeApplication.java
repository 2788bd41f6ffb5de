package com.simbridge.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BridgeApplication {
  // Main entrypoint: boots Spring, the telemetry pump and the WebSocket hub.
  public static void main(String[] args) {
    SpringApplication.run(BridgeApplication.class, args);
  }
}
