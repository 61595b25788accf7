package com.notisync.common.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/**
 * {@code updatedAt} is the server copy's modification time, echoed back on later status
 * updates.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateNotificationResponse(String id, String clientId, Instant updatedAt) {}
