/*
 * Where: device sync layer
 * What: turns queued local mutations into batched, retried calls against the server of record
 * Why: captures and user actions happen offline and must reach the server exactly once
 */
package com.notisync.device.sync;

import com.notisync.common.api.BatchCreateResponse;
import com.notisync.common.api.CreateNotificationResponse;
import com.notisync.common.api.NotificationPayload;
import com.notisync.common.api.ServerNotification;
import com.notisync.common.model.StatusAction;
import com.notisync.device.config.SyncProperties;
import com.notisync.device.model.ConflictResolution;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.PlannedOperation;
import com.notisync.device.model.SyncBatch;
import com.notisync.device.model.SyncErrorEntry;
import com.notisync.device.model.SyncOperation;
import com.notisync.device.model.SyncOperationType;
import com.notisync.device.model.SyncPassResult;
import com.notisync.device.model.SyncStatus;
import com.notisync.device.network.NetworkMonitor;
import com.notisync.device.repository.LocalRecordStore;
import com.notisync.device.service.DeviceMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Only one pass, main or retry, runs at a time; a request while a pass is running returns
 * {@link SyncPassResult.Status#ALREADY_SYNCING} and is not queued. The in-memory queue is a
 * working copy that is rebuilt from the store at the start of every pass.
 */
@Service
@RequiredArgsConstructor
public class SyncEngine {

  private static final Logger logger = LoggerFactory.getLogger(SyncEngine.class);

  private static final int STATUS_LIST_LIMIT = 20;

  private final LocalRecordStore store;
  private final NotificationServerClient serverClient;
  private final OperationPlanner planner;
  private final ConflictResolver conflictResolver;
  private final SyncStatsTracker statsTracker;
  private final OperationPayloads payloads;
  private final NetworkMonitor networkMonitor;
  private final SyncProperties properties;
  private final DeviceMetrics metrics;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  private final AtomicBoolean syncing = new AtomicBoolean(false);
  private final Map<String, PlannedOperation> workingQueue = new LinkedHashMap<>();

  public boolean isSyncing() {
    return syncing.get();
  }

  public SyncPassResult performSync() {
    return runGuarded("sync", this::mainPass);
  }

  /** Retries operations that already failed once and whose backoff has elapsed, one at a time. */
  public SyncPassResult retryFailedOperations() {
    return runGuarded("retry", this::retryPass);
  }

  public void onNetworkRestored() {
    logger.info("network restored; starting immediate sync");
    performSync();
  }

  public SyncStatus status() {
    return new SyncStatus(
        syncing.get(),
        networkMonitor.isOnline(),
        store.countPendingOperations(),
        store.listAbandonedOperations(STATUS_LIST_LIMIT),
        store.listSyncErrors(STATUS_LIST_LIMIT),
        statsTracker.current());
  }

  public List<ConflictResolution> recentConflicts() {
    return conflictResolver.recentResolutions();
  }

  private SyncPassResult runGuarded(String kind, PassBody body) {
    if (!properties.enabled()) {
      return SyncPassResult.skipped(SyncPassResult.Status.DISABLED);
    }
    if (properties.networkRequiredForSync() && !networkMonitor.isOnline()) {
      logger.debug("sync skipped while offline kind={}", kind);
      return SyncPassResult.skipped(SyncPassResult.Status.OFFLINE);
    }
    if (!syncing.compareAndSet(false, true)) {
      return SyncPassResult.skipped(SyncPassResult.Status.ALREADY_SYNCING);
    }
    final Instant startedAt = Instant.now(clock);
    final PassTally tally = new PassTally();
    SyncPassResult.Status status;
    try {
      final Instant now = refreshWorkingQueue(startedAt);
      body.run(tally, now);
      status =
          tally.failed() == 0 && tally.abandoned() == 0
              ? SyncPassResult.Status.COMPLETED
              : SyncPassResult.Status.PARTIAL;
    } catch (RuntimeException ex) {
      logger.error("sync pass aborted kind={}", kind, ex);
      status = SyncPassResult.Status.FAILED;
    } finally {
      syncing.set(false);
    }
    final Instant finishedAt = Instant.now(clock);
    final Duration duration = Duration.between(startedAt, finishedAt);
    finish(kind, status, tally, duration, finishedAt);
    return new SyncPassResult(
        status, tally.succeeded(), tally.failed(), tally.abandoned(), tally.conflicts());
  }

  private void finish(
      String kind,
      SyncPassResult.Status status,
      PassTally tally,
      Duration duration,
      Instant finishedAt) {
    try {
      statsTracker.recordPass(tally, duration, finishedAt);
      metrics.recordSyncPass(status.name().toLowerCase(Locale.ROOT), duration);
      metrics.recordOperations("synced", tally.succeeded());
      metrics.recordOperations("failed", tally.failed());
      metrics.recordOperations("abandoned", tally.abandoned());
      metrics.updateQueuePending(store.countPendingOperations());
    } catch (RuntimeException ex) {
      logger.warn("sync pass bookkeeping failed kind={}", kind, ex);
    }
    logger.info(
        "sync pass finished kind={} status={} succeeded={} failed={} abandoned={} conflicts={}"
            + " durationMs={}",
        kind,
        status,
        tally.succeeded(),
        tally.failed(),
        tally.abandoned(),
        tally.conflicts(),
        duration.toMillis());
  }

  private void mainPass(PassTally tally, Instant now) {
    final List<PlannedOperation> due = new ArrayList<>();
    for (PlannedOperation planned : workingQueue.values()) {
      if (planned.isDue(now)) {
        due.add(planned);
      }
    }
    // status changes for records still waiting on their create go out after every create
    final List<SyncOperation> awaitingCreate = new ArrayList<>();
    for (SyncBatch batch : planner.batches(due)) {
      tally.recordBatch();
      if (batch.type() == SyncOperationType.CREATE && batch.size() > 1) {
        sendCreateBatch(batch, tally, now);
      } else {
        for (PlannedOperation planned : batch.operations()) {
          final SyncOperation operation = planned.operation();
          if (batch.type() != SyncOperationType.CREATE && awaitsServerId(operation)) {
            awaitingCreate.add(operation);
          } else {
            sendSingle(operation, tally, now);
          }
        }
      }
    }
    for (SyncOperation operation : awaitingCreate) {
      sendSingle(operation, tally, now);
    }
  }

  private boolean awaitsServerId(SyncOperation operation) {
    return store
        .getRecord(operation.notificationId())
        .map(record -> record.serverId() == null)
        .orElse(false);
  }

  private void retryPass(PassTally tally, Instant now) {
    final List<PlannedOperation> candidates = new ArrayList<>();
    for (PlannedOperation planned : workingQueue.values()) {
      final int attempts = planned.operation().attempts();
      if (attempts > 0 && attempts < properties.maxRetryAttempts() && planned.isDue(now)) {
        candidates.add(planned);
      }
    }
    for (PlannedOperation planned : candidates) {
      sendSingle(planned.operation(), tally, now);
    }
  }

  /** Reloads pending operations, replacing the working copy; returns the pass time. */
  private Instant refreshWorkingQueue(Instant now) {
    final List<SyncOperation> stored = store.listOperations(properties.queueLoadLimit());
    workingQueue.clear();
    for (SyncOperation operation : stored) {
      if (operation.attempts() >= properties.maxRetryAttempts()) {
        abandon(operation, null, operation.lastError(), now);
        continue;
      }
      workingQueue.putIfAbsent(operation.id(), planner.plan(operation, now));
    }
    metrics.updateQueuePending(workingQueue.size());
    return now;
  }

  private void sendCreateBatch(SyncBatch batch, PassTally tally, Instant now) {
    final List<SyncOperation> sent = new ArrayList<>();
    final List<NotificationPayload> requestPayloads = new ArrayList<>();
    for (PlannedOperation planned : batch.operations()) {
      final SyncOperation operation = planned.operation();
      try {
        final Optional<NotificationPayload> payload = createPayload(operation);
        if (payload.isEmpty()) {
          complete(operation, tally);
          continue;
        }
        sent.add(operation);
        requestPayloads.add(payload.get());
      } catch (RuntimeException ex) {
        recordFailure(operation, null, ex.getMessage(), tally, now);
      }
    }
    if (sent.isEmpty()) {
      return;
    }
    final BatchCreateResponse response;
    try {
      response = serverClient.batchCreate(requestPayloads);
    } catch (SyncTransportException ex) {
      logger.warn(
          "sync batch failed size={} reason={} error={}",
          sent.size(),
          ex.reason(),
          ex.getMessage());
      for (SyncOperation operation : sent) {
        recordFailure(operation, ex.reason(), ex.getMessage(), tally, now);
      }
      return;
    }
    final List<BatchCreateResponse.ItemResult> results =
        response.results() == null ? List.of() : response.results();
    for (int i = 0; i < sent.size(); i++) {
      final SyncOperation operation = sent.get(i);
      if (i >= results.size()) {
        recordFailure(
            operation,
            SyncTransportException.Reason.INVALID_RESPONSE,
            "batch response has no result for this item",
            tally,
            now);
        continue;
      }
      final BatchCreateResponse.ItemResult result = results.get(i);
      if (result.accepted()) {
        completeCreate(operation, result.id(), result.updatedAt(), tally);
      } else {
        recordFailure(
            operation, SyncTransportException.Reason.REJECTED, result.error(), tally, now);
      }
    }
  }

  private void sendSingle(SyncOperation operation, PassTally tally, Instant now) {
    try {
      switch (operation.type()) {
        case CREATE -> sendCreate(operation, tally, now);
        case UPDATE, DELETE -> sendStatus(operation, tally, now);
      }
    } catch (SyncTransportException ex) {
      recordFailure(operation, ex.reason(), ex.getMessage(), tally, now);
    } catch (RuntimeException ex) {
      logger.warn("sync operation failed operationId={}", operation.id(), ex);
      recordFailure(operation, null, ex.getMessage(), tally, now);
    }
  }

  private void sendCreate(SyncOperation operation, PassTally tally, Instant now) {
    final Optional<NotificationPayload> payload = createPayload(operation);
    if (payload.isEmpty()) {
      complete(operation, tally);
      return;
    }
    final CreateNotificationResponse response = serverClient.createNotification(payload.get());
    completeCreate(operation, response.id(), response.updatedAt(), tally);
  }

  /** Empty when the record already has a server copy and the operation only needs removing. */
  private Optional<NotificationPayload> createPayload(SyncOperation operation) {
    final Optional<NotificationRecord> record = store.getRecord(operation.notificationId());
    if (record.isPresent() && record.get().synced()) {
      return Optional.empty();
    }
    return Optional.of(
        record.map(payloads::toPayload).orElseGet(() -> payloads.readCreatePayload(operation)));
  }

  private void sendStatus(SyncOperation operation, PassTally tally, Instant now) {
    final Optional<NotificationRecord> found = store.getRecord(operation.notificationId());
    if (found.isEmpty()) {
      logger.warn(
          "sync operation dropped; record no longer exists operationId={} notificationId={}",
          operation.id(),
          operation.notificationId());
      complete(operation, tally);
      return;
    }
    final NotificationRecord record = found.get();
    if (record.serverId() == null) {
      // not a failure: the operation stays queued, unattempted, until the create lands
      logger.debug(
          "sync operation deferred until create lands operationId={} notificationId={}",
          operation.id(),
          record.id());
      return;
    }
    final StatusAction action =
        operation.type() == SyncOperationType.DELETE
            ? StatusAction.DISMISS
            : payloads.actionOf(operation, StatusAction.READ);
    final StatusUpdateResult result =
        serverClient.updateStatus(record.serverId(), action, record.serverUpdatedAt());
    if (result.conflict()) {
      resolveConflict(operation, record, action, result.serverVersion(), tally, now);
      return;
    }
    transactionTemplate.executeWithoutResult(
        status -> {
          if (result.serverVersion() != null) {
            store.markSynced(record.id(), record.serverId(), result.serverVersion().updatedAt());
          }
          store.removeOperation(operation.id());
        });
    workingQueue.remove(operation.id());
    tally.recordSuccess();
  }

  private void resolveConflict(
      SyncOperation operation,
      NotificationRecord local,
      StatusAction action,
      ServerNotification serverVersion,
      PassTally tally,
      Instant now) {
    tally.recordConflict();
    if (!properties.enableConflictResolution()) {
      logger.warn(
          "conflict ignored; resolution disabled operationId={} notificationId={}",
          operation.id(),
          local.id());
      complete(operation, tally);
      return;
    }
    final ConflictResolution resolution =
        conflictResolver.resolve(local, serverVersion, properties.conflictResolutionStrategy());
    final NotificationRecord resolved = resolution.resolvedVersion();
    final Optional<SyncOperation> followUp = followUp(action, resolved, serverVersion, now);
    transactionTemplate.executeWithoutResult(
        status -> {
          store.saveRecord(resolved);
          store.removeOperation(operation.id());
          followUp.ifPresent(store::enqueueOperation);
        });
    workingQueue.remove(operation.id());
    metrics.recordConflict(resolution.strategy().wireName());
    logger.info(
        "conflict resolved notificationId={} strategy={} followUp={}",
        local.id(),
        resolution.strategy().wireName(),
        followUp.isPresent());
    tally.recordSuccess();
  }

  /** Re-sends the user's action when the resolved record keeps it but the server copy lacks it. */
  private Optional<SyncOperation> followUp(
      StatusAction action, NotificationRecord resolved, ServerNotification server, Instant now) {
    final boolean missingOnServer =
        switch (action) {
          case READ, CLICK -> resolved.read() && !server.isRead();
          case DISMISS -> resolved.dismissed() && !server.isDismissed();
        };
    if (!missingOnServer) {
      return Optional.empty();
    }
    return Optional.of(
        SyncOperation.pending(
            UUID.randomUUID().toString(),
            SyncOperationType.UPDATE,
            resolved.id(),
            payloads.actionPayload(action),
            now));
  }

  private void completeCreate(
      SyncOperation operation, String serverId, Instant serverUpdatedAt, PassTally tally) {
    transactionTemplate.executeWithoutResult(
        status -> {
          store.markSynced(operation.notificationId(), serverId, serverUpdatedAt);
          store.removeOperation(operation.id());
        });
    workingQueue.remove(operation.id());
    tally.recordSuccess();
  }

  private void complete(SyncOperation operation, PassTally tally) {
    store.removeOperation(operation.id());
    workingQueue.remove(operation.id());
    tally.recordSuccess();
  }

  private void recordFailure(
      SyncOperation operation,
      SyncTransportException.Reason reason,
      String error,
      PassTally tally,
      Instant now) {
    final int attempts = operation.attempts() + 1;
    final String message = truncate(error);
    if (operation.type() == SyncOperationType.CREATE) {
      store.incrementSyncAttempts(operation.notificationId(), now);
    }
    if (attempts >= properties.maxRetryAttempts()) {
      abandon(operation.withFailure(attempts, now, message), reason, message, now);
      tally.recordAbandoned(reason);
      return;
    }
    store.updateOperation(operation.id(), attempts, now, message);
    final SyncOperation failed = operation.withFailure(attempts, now, message);
    workingQueue.put(operation.id(), planner.plan(failed, now));
    logger.warn(
        "sync operation failed operationId={} type={} attempts={} reason={} error={}",
        operation.id(),
        operation.type().wireName(),
        attempts,
        reason,
        message);
    tally.recordFailure(reason);
  }

  /** The row stays in the queue, flagged, so it remains visible for diagnostics. */
  private void abandon(
      SyncOperation operation, SyncTransportException.Reason reason, String error, Instant now) {
    final SyncErrorEntry entry =
        new SyncErrorEntry(
            operation.id(),
            operation.type(),
            operation.notificationId(),
            operation.attempts(),
            error,
            now);
    transactionTemplate.executeWithoutResult(
        status -> {
          store.updateOperation(operation.id(), operation.attempts(), now, error);
          store.markAbandoned(operation.id(), now);
          store.appendSyncError(entry, properties.errorLogCapacity());
        });
    workingQueue.remove(operation.id());
    logger.error(
        "sync operation abandoned operationId={} type={} notificationId={} attempts={}"
            + " reason={} error={}",
        operation.id(),
        operation.type().wireName(),
        operation.notificationId(),
        operation.attempts(),
        reason,
        error);
  }

  private String truncate(String error) {
    final String message = error == null ? "unknown error" : error;
    final int max = properties.errorMessageMaxLength();
    return message.length() <= max ? message : message.substring(0, max);
  }

  @FunctionalInterface
  private interface PassBody {
    void run(PassTally tally, Instant now);
  }
}
