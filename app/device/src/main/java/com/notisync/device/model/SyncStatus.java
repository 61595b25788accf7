package com.notisync.device.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SyncStatus(
    boolean syncing,
    boolean online,
    int pendingOperations,
    List<SyncOperation> abandonedOperations,
    List<SyncErrorEntry> recentErrors,
    SyncStats stats) {}
