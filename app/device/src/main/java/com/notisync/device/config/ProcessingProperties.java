package com.notisync.device.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notisync.processing")
public record ProcessingProperties(
    Boolean enabled,
    Duration interval,
    Integer batchSize,
    Duration maxProcessingTime,
    Boolean allowOnError,
    Integer errorLogCapacity) {

  public ProcessingProperties {
    enabled = enabled == null || enabled;
    interval = interval == null ? Duration.ofSeconds(5) : interval;
    batchSize = batchSize == null ? 20 : batchSize;
    maxProcessingTime = maxProcessingTime == null ? Duration.ofSeconds(30) : maxProcessingTime;
    allowOnError = allowOnError == null || allowOnError;
    errorLogCapacity = errorLogCapacity == null ? 50 : errorLogCapacity;
  }

  public static ProcessingProperties defaults() {
    return new ProcessingProperties(null, null, null, null, null, null);
  }
}
