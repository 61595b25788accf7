package com.notisync.device.service;

import com.notisync.common.model.NotificationCategory;
import com.notisync.common.model.Priorities;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.RawCaptureEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Maps a raw listener event into an unsynced record skeleton. */
@Component
@RequiredArgsConstructor
public class CaptureNormalizer {

  private final Clock clock;

  public NotificationRecord normalize(RawCaptureEvent event) {
    if (event == null) {
      throw new InvalidNotificationException("capture event is required");
    }
    final String appIdentity = trimToNull(event.appIdentity());
    if (appIdentity == null) {
      throw new InvalidNotificationException("capture has no app identity");
    }
    final String title = event.title() == null ? "" : event.title().trim();
    final String body = event.body() == null ? "" : event.body().trim();
    if (title.isEmpty() && body.isEmpty()) {
      throw new InvalidNotificationException("capture has neither title nor body: " + appIdentity);
    }
    final Instant now = Instant.now(clock);
    final int priority =
        event.rawPriority() == null ? Priorities.DEFAULT : Priorities.clamp(event.rawPriority());
    final Map<String, Object> extras =
        event.extras() == null ? Map.of() : new LinkedHashMap<>(event.extras());
    return new NotificationRecord(
        UUID.randomUUID().toString(),
        null,
        appIdentity,
        title,
        body,
        NotificationCategory.PERSONAL,
        priority,
        event.timestamp() == null ? now : event.timestamp(),
        trimToNull(event.sourceId()),
        extras,
        false,
        0,
        null,
        false,
        false,
        now,
        null);
  }

  private static String trimToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
