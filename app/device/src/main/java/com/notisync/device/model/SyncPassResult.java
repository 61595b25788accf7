package com.notisync.device.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SyncPassResult(
    Status status, int succeeded, int failed, int abandoned, int conflicts) {

  public enum Status {
    COMPLETED,
    PARTIAL,
    ALREADY_SYNCING,
    DISABLED,
    OFFLINE,
    FAILED
  }

  public static SyncPassResult skipped(Status status) {
    return new SyncPassResult(status, 0, 0, 0, 0);
  }

  public boolean ran() {
    return status == Status.COMPLETED || status == Status.PARTIAL;
  }
}
