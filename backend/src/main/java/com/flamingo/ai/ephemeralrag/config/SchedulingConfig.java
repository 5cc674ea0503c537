package com.flamingo.ai.ephemeralrag.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Enables the session sweep and provides the clock that all expiry decisions read. */
@Configuration
@EnableScheduling
public class SchedulingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
