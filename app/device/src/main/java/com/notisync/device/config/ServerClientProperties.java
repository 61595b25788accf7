package com.notisync.device.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notisync.server")
public record ServerClientProperties(
    String baseUrl,
    Duration connectTimeout,
    Duration requestTimeout,
    String userId,
    String deviceId) {

  public ServerClientProperties {
    baseUrl = baseUrl == null ? "http://localhost:8080" : baseUrl;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
    userId = userId == null ? "local-user" : userId;
    deviceId = deviceId == null ? "local-device" : deviceId;
  }
}
