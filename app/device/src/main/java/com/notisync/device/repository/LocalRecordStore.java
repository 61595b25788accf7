/*
 * Where: device persistence boundary
 * What: CRUD contract over records, the sync queue, settings and the abandonment log
 * Why: the pipeline and the sync engine share state only through this contract
 */
package com.notisync.device.repository;

import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.SyncErrorEntry;
import com.notisync.device.model.SyncOperation;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Every call is atomic on its own. Writes to the same record id are last-writer-wins; divergence
 * with the server is handled by conflict resolution, not here.
 */
public interface LocalRecordStore {

  void saveRecord(NotificationRecord record);

  Optional<NotificationRecord> getRecord(String id);

  Optional<NotificationRecord> findByServerId(String serverId);

  /** Newest first by capture timestamp. */
  List<NotificationRecord> listRecords(int limit, int offset);

  List<NotificationRecord> listUnsynced();

  void markSynced(String id, String serverId, Instant serverUpdatedAt);

  void incrementSyncAttempts(String id, Instant attemptedAt);

  void enqueueOperation(SyncOperation operation);

  /** Operations still eligible for sync, oldest first. Abandoned rows are excluded. */
  List<SyncOperation> listOperations(int limit);

  List<SyncOperation> listAbandonedOperations(int limit);

  int countPendingOperations();

  void updateOperation(String id, int attempts, Instant lastAttempt, String error);

  void markAbandoned(String id, Instant abandonedAt);

  void removeOperation(String id);

  Optional<String> getSetting(String key);

  void setSetting(String key, String value);

  /** Appends and evicts the oldest entries beyond {@code capacity}. */
  void appendSyncError(SyncErrorEntry entry, int capacity);

  /** Newest first. */
  List<SyncErrorEntry> listSyncErrors(int limit);

  int deleteSyncedOlderThan(Instant threshold);
}
