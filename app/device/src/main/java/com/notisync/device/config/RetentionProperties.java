/*
 * Where: device configuration binding
 * What: holds retention cleanup settings
 * Why: keep local storage bounded once records are safely on the server
 */
package com.notisync.device.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notisync.retention")
public record RetentionProperties(boolean enabled, Duration retention, Duration cleanupInterval) {

  public RetentionProperties {
    retention = retention == null ? Duration.ofDays(7) : retention;
    cleanupInterval = cleanupInterval == null ? Duration.ofHours(1) : cleanupInterval;
  }
}
