package com.notisync.server.service;

import com.notisync.common.api.NotificationPayload;
import com.notisync.server.config.ServerApiProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationValidator {

  private final ServerApiProperties properties;

  /** Throws {@link InvalidNotificationException} naming the first offending field. */
  public void validate(NotificationPayload payload) {
    if (payload == null) {
      throw new InvalidNotificationException("notification is required");
    }
    if (isBlank(payload.clientId())) {
      throw new InvalidNotificationException("client_id is required");
    }
    if (isBlank(payload.appName())) {
      throw new InvalidNotificationException("app_name is required");
    }
    requireMaxLength("app_name", payload.appName(), properties.appNameMaxLength());
    requireMaxLength("title", payload.title(), properties.titleMaxLength());
    requireMaxLength("body", payload.body(), properties.bodyMaxLength());
    if (isBlank(payload.title()) && isBlank(payload.body())) {
      throw new InvalidNotificationException("title or body is required");
    }
  }

  private void requireMaxLength(String field, String value, int maxLength) {
    if (value != null && value.length() > maxLength) {
      throw new InvalidNotificationException(
          field + " must be at most " + maxLength + " characters");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
