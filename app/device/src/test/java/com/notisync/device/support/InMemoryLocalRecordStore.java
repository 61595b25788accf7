package com.notisync.device.support;

import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.SyncErrorEntry;
import com.notisync.device.model.SyncOperation;
import com.notisync.device.repository.LocalRecordStore;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Map-backed store for engine-level tests; mirrors the ordering of the JDBC implementation. */
public class InMemoryLocalRecordStore implements LocalRecordStore {

  private final Map<String, NotificationRecord> records = new LinkedHashMap<>();
  private final Map<String, SyncOperation> operations = new LinkedHashMap<>();
  private final Map<String, String> settings = new HashMap<>();
  private final Deque<SyncErrorEntry> syncErrors = new ArrayDeque<>();

  @Override
  public synchronized void saveRecord(NotificationRecord record) {
    records.put(record.id(), record);
  }

  @Override
  public synchronized Optional<NotificationRecord> getRecord(String id) {
    return Optional.ofNullable(records.get(id));
  }

  @Override
  public synchronized Optional<NotificationRecord> findByServerId(String serverId) {
    return records.values().stream().filter(r -> serverId.equals(r.serverId())).findFirst();
  }

  @Override
  public synchronized List<NotificationRecord> listRecords(int limit, int offset) {
    return records.values().stream()
        .sorted(Comparator.comparing(NotificationRecord::timestamp).reversed())
        .skip(offset)
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized List<NotificationRecord> listUnsynced() {
    return records.values().stream().filter(r -> !r.synced()).toList();
  }

  @Override
  public synchronized void markSynced(String id, String serverId, Instant serverUpdatedAt) {
    final NotificationRecord record = records.get(id);
    if (record != null) {
      records.put(id, record.markSynced(serverId, serverUpdatedAt));
    }
  }

  @Override
  public synchronized void incrementSyncAttempts(String id, Instant attemptedAt) {
    final NotificationRecord r = records.get(id);
    if (r == null) {
      return;
    }
    records.put(
        id,
        new NotificationRecord(
            r.id(), r.serverId(), r.appIdentity(), r.title(), r.body(), r.category(), r.priority(),
            r.timestamp(), r.sourceId(), r.extras(), r.synced(), r.syncAttempts() + 1, attemptedAt,
            r.read(), r.dismissed(), r.updatedAt(), r.serverUpdatedAt()));
  }

  @Override
  public synchronized void enqueueOperation(SyncOperation operation) {
    operations.putIfAbsent(operation.id(), operation);
  }

  @Override
  public synchronized List<SyncOperation> listOperations(int limit) {
    return operations.values().stream()
        .filter(op -> !op.abandoned())
        .sorted(Comparator.comparing(SyncOperation::createdAt))
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized List<SyncOperation> listAbandonedOperations(int limit) {
    return operations.values().stream().filter(SyncOperation::abandoned).limit(limit).toList();
  }

  @Override
  public synchronized int countPendingOperations() {
    return (int) operations.values().stream().filter(op -> !op.abandoned()).count();
  }

  @Override
  public synchronized void updateOperation(
      String id, int attempts, Instant lastAttempt, String error) {
    final SyncOperation operation = operations.get(id);
    if (operation != null) {
      operations.put(id, operation.withFailure(attempts, lastAttempt, error));
    }
  }

  @Override
  public synchronized void markAbandoned(String id, Instant abandonedAt) {
    final SyncOperation o = operations.get(id);
    if (o != null) {
      operations.put(
          id,
          new SyncOperation(
              o.id(), o.type(), o.notificationId(), o.payloadJson(), o.attempts(), o.createdAt(),
              o.lastAttempt(), o.lastError(), abandonedAt));
    }
  }

  @Override
  public synchronized void removeOperation(String id) {
    operations.remove(id);
  }

  @Override
  public synchronized Optional<String> getSetting(String key) {
    return Optional.ofNullable(settings.get(key));
  }

  @Override
  public synchronized void setSetting(String key, String value) {
    settings.put(key, value);
  }

  @Override
  public synchronized void appendSyncError(SyncErrorEntry entry, int capacity) {
    syncErrors.addFirst(entry);
    while (syncErrors.size() > capacity) {
      syncErrors.removeLast();
    }
  }

  @Override
  public synchronized List<SyncErrorEntry> listSyncErrors(int limit) {
    return syncErrors.stream().limit(limit).toList();
  }

  @Override
  public synchronized int deleteSyncedOlderThan(Instant threshold) {
    final List<String> removable = new ArrayList<>();
    for (NotificationRecord record : records.values()) {
      final boolean queued =
          operations.values().stream().anyMatch(op -> op.notificationId().equals(record.id()));
      if (record.synced() && record.timestamp().isBefore(threshold) && !queued) {
        removable.add(record.id());
      }
    }
    removable.forEach(records::remove);
    return removable.size();
  }

  public synchronized List<SyncOperation> allOperations() {
    return new ArrayList<>(operations.values());
  }
}
