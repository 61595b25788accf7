package com.notisync.device.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notisync.common.api.ServerNotification;
import java.time.Instant;

/** Audit entry; never persisted as domain truth. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConflictResolution(
    String notificationId,
    NotificationRecord clientVersion,
    ServerNotification serverVersion,
    ConflictStrategy strategy,
    NotificationRecord resolvedVersion,
    Instant timestamp) {}
