package com.notisync.common.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notisync.common.model.NotificationCategory;
import java.time.Instant;
import java.util.Map;

/** Body of a create call; {@code clientId} is the device-generated id used for idempotency. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationPayload(
    String clientId,
    String appName,
    String title,
    String body,
    NotificationCategory category,
    Integer priority,
    Instant timestamp,
    String packageName,
    Map<String, Object> extras,
    @JsonProperty("is_read") boolean isRead,
    @JsonProperty("is_dismissed") boolean isDismissed) {}
