package com.notisync.device.config;

import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Night hours are local to {@code zone}; start is inclusive and end exclusive. */
@ConfigurationProperties(prefix = "notisync.classification")
public record ClassificationProperties(Integer nightStartHour, Integer nightEndHour, ZoneId zone) {

  public ClassificationProperties {
    nightStartHour = nightStartHour == null ? 22 : nightStartHour;
    nightEndHour = nightEndHour == null ? 6 : nightEndHour;
    zone = zone == null ? ZoneId.systemDefault() : zone;
  }

  public static ClassificationProperties withZone(ZoneId zone) {
    return new ClassificationProperties(null, null, zone);
  }
}
