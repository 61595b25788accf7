package com.notisync.common.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notisync.common.model.NotificationCategory;
import java.time.Instant;
import java.util.Map;

/** Server's copy of a notification, returned on conflicts and pushed to other devices. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ServerNotification(
    String id,
    String clientId,
    String sourceDeviceId,
    String appName,
    String packageName,
    String title,
    String body,
    NotificationCategory category,
    int priority,
    Instant timestamp,
    Map<String, Object> extras,
    @JsonProperty("is_read") boolean isRead,
    @JsonProperty("is_dismissed") boolean isDismissed,
    Instant updatedAt) {}
