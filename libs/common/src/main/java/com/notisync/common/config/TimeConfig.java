/*
 * Where: shared configuration
 * What: exposes the Clock every component reads time from
 * Why: night hours and backoff depend on local time, and tests need a fixed clock
 */
package com.notisync.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${notisync.time.zone:UTC}") String zone) {
    return Clock.system(ZoneId.of(zone));
  }
}
