/*
 * Where: device service layer
 * What: applies user actions to local records and queues them for the server
 * Why: actions must take effect immediately even while the device is offline
 */
package com.notisync.device.service;

import com.notisync.common.model.StatusAction;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.SyncOperation;
import com.notisync.device.model.SyncOperationType;
import com.notisync.device.repository.LocalRecordStore;
import com.notisync.device.sync.OperationPayloads;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class LocalMutationService {

  private final LocalRecordStore store;
  private final OperationPayloads payloads;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public NotificationRecord markRead(String recordId) {
    return apply(recordId, StatusAction.READ);
  }

  public NotificationRecord markDismissed(String recordId) {
    return apply(recordId, StatusAction.DISMISS);
  }

  public NotificationRecord markClicked(String recordId) {
    return apply(recordId, StatusAction.CLICK);
  }

  /** The local row stays; the server copy is dismissed once the operation syncs. */
  public void delete(String recordId) {
    final NotificationRecord record = load(recordId);
    store.enqueueOperation(
        SyncOperation.pending(
            UUID.randomUUID().toString(),
            SyncOperationType.DELETE,
            record.id(),
            payloads.actionPayload(StatusAction.DISMISS),
            Instant.now(clock)));
  }

  private NotificationRecord apply(String recordId, StatusAction action) {
    final Instant now = Instant.now(clock);
    final NotificationRecord updated = load(recordId).applyAction(action, now);
    final SyncOperation operation =
        SyncOperation.pending(
            UUID.randomUUID().toString(),
            SyncOperationType.UPDATE,
            recordId,
            payloads.actionPayload(action),
            now);
    transactionTemplate.executeWithoutResult(
        status -> {
          store.saveRecord(updated);
          store.enqueueOperation(operation);
        });
    return updated;
  }

  private NotificationRecord load(String recordId) {
    return store.getRecord(recordId).orElseThrow(() -> new RecordNotFoundException(recordId));
  }
}
