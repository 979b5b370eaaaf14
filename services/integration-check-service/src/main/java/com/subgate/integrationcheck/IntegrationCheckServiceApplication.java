package com.subgate.integrationcheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IntegrationCheckServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(IntegrationCheckServiceApplication.class, args);
  }
}
