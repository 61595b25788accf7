package com.notisync.device.model;

import java.util.List;

public record SyncBatch(SyncOperationType type, int priority, List<PlannedOperation> operations) {

  public SyncBatch {
    operations = List.copyOf(operations);
  }

  public int size() {
    return operations.size();
  }
}
