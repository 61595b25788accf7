package com.notisync.device.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notisync.network")
public record NetworkProperties(Duration probeInterval, String healthPath) {

  public NetworkProperties {
    probeInterval = probeInterval == null ? Duration.ofSeconds(15) : probeInterval;
    healthPath = healthPath == null ? "/actuator/health" : healthPath;
  }
}
