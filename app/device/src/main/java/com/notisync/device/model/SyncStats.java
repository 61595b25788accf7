package com.notisync.device.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/**
 * Running totals persisted to settings after every pass. {@code averageSyncTime} is in
 * milliseconds.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SyncStats(
    long totalSyncAttempts,
    long successfulSyncs,
    long failedSyncs,
    long conflictsResolved,
    long batchesSynced,
    double averageSyncTime,
    Instant lastSyncTime,
    Instant lastSuccessfulSync,
    long networkErrors,
    long serverErrors,
    long syncErrors) {

  public static SyncStats empty() {
    return new SyncStats(0, 0, 0, 0, 0, 0.0, null, null, 0, 0, 0);
  }
}
