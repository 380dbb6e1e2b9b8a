/*
 * Where: Shared configuration
 * What: Exposes a Clock bean
 * Why: Every time-dependent component reads "now" from the same injectable source
 */
package com.manageros.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
