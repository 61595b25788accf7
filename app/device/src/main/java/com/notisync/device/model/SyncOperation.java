/*
 * Where: device domain model
 * What: a pending local mutation as stored in sync_queue
 * Why: the queue row is the durable truth; the engine only holds a working copy
 */
package com.notisync.device.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SyncOperation(
    String id,
    SyncOperationType type,
    String notificationId,
    String payloadJson,
    int attempts,
    Instant createdAt,
    Instant lastAttempt,
    String lastError,
    Instant abandonedAt) {

  public static SyncOperation pending(
      String id, SyncOperationType type, String notificationId, String payloadJson, Instant now) {
    return new SyncOperation(id, type, notificationId, payloadJson, 0, now, null, null, null);
  }

  public SyncOperation withFailure(int newAttempts, Instant attemptedAt, String error) {
    return new SyncOperation(
        id,
        type,
        notificationId,
        payloadJson,
        newAttempts,
        createdAt,
        attemptedAt,
        error,
        abandonedAt);
  }

  public boolean abandoned() {
    return abandonedAt != null;
  }
}
