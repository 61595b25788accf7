package com.notisync.device.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notisync.common.model.StatusAction;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.SyncOperation;
import com.notisync.device.model.SyncOperationType;
import com.notisync.device.support.InMemoryLocalRecordStore;
import com.notisync.device.support.NoOpTransactionManager;
import com.notisync.device.support.TestRecords;
import com.notisync.device.sync.OperationPayloads;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class LocalMutationServiceTest {

  private static final Instant CAPTURED = Instant.parse("2026-03-02T10:00:00Z");
  private static final Instant NOW = Instant.parse("2026-03-02T10:05:00Z");

  private final InMemoryLocalRecordStore store = new InMemoryLocalRecordStore();
  private final OperationPayloads payloads =
      new OperationPayloads(new ObjectMapper().findAndRegisterModules());
  private final LocalMutationService service =
      new LocalMutationService(
          store, payloads, NoOpTransactionManager.template(), Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void markReadUpdatesRecordAndQueuesUpdate() {
    store.saveRecord(TestRecords.synced("local-1", "srv-1", CAPTURED, CAPTURED));

    final NotificationRecord updated = service.markRead("local-1");

    assertThat(updated.read()).isTrue();
    assertThat(updated.updatedAt()).isEqualTo(NOW);
    assertThat(store.getRecord("local-1").orElseThrow().read()).isTrue();
    final SyncOperation operation = store.listOperations(10).get(0);
    assertThat(operation.type()).isEqualTo(SyncOperationType.UPDATE);
    assertThat(payloads.actionOf(operation, null)).isEqualTo(StatusAction.READ);
  }

  @Test
  void clickAlsoMarksRead() {
    store.saveRecord(TestRecords.synced("local-1", "srv-1", CAPTURED, CAPTURED));

    assertThat(service.markClicked("local-1").read()).isTrue();
  }

  @Test
  void deleteKeepsLocalRecordAndQueuesDismiss() {
    store.saveRecord(TestRecords.synced("local-1", "srv-1", CAPTURED, CAPTURED));

    service.delete("local-1");

    assertThat(store.getRecord("local-1")).isPresent();
    final SyncOperation operation = store.listOperations(10).get(0);
    assertThat(operation.type()).isEqualTo(SyncOperationType.DELETE);
    assertThat(payloads.actionOf(operation, null)).isEqualTo(StatusAction.DISMISS);
  }

  @Test
  void unknownRecordIsNotFound() {
    assertThatThrownBy(() -> service.markDismissed("missing"))
        .isInstanceOf(RecordNotFoundException.class);
    assertThat(store.listOperations(10)).isEmpty();
  }
}
