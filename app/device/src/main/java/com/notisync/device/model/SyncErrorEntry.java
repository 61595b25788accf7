package com.notisync.device.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** Diagnostics entry for an abandoned operation. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SyncErrorEntry(
    String operationId,
    SyncOperationType type,
    String notificationId,
    int attempts,
    String error,
    Instant occurredAt) {}
