package com.notisync.device.model;

import java.time.Instant;

/** In-memory view of a queued operation with its derived scheduling fields. */
public record PlannedOperation(SyncOperation operation, int priority, Instant nextRetry) {

  public boolean isDue(Instant now) {
    return !nextRetry.isAfter(now);
  }
}
