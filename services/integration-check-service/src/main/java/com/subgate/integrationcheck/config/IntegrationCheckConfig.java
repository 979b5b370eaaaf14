package com.subgate.integrationcheck.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IntegrationCheckConfig {

  /** Upload timestamps in storage paths are taken from this clock. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
