package com.notisync.device.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notisync.common.api.BatchCreateResponse;
import com.notisync.common.api.CreateNotificationResponse;
import com.notisync.common.api.NotificationPayload;
import com.notisync.common.api.ServerNotification;
import com.notisync.common.model.StatusAction;
import com.notisync.device.config.SyncProperties;
import com.notisync.device.model.ConflictStrategy;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.SyncOperation;
import com.notisync.device.model.SyncOperationType;
import com.notisync.device.model.SyncPassResult;
import com.notisync.device.model.SyncStats;
import com.notisync.device.network.NetworkMonitor;
import com.notisync.device.service.DeviceMetrics;
import com.notisync.device.support.InMemoryLocalRecordStore;
import com.notisync.device.support.NoOpTransactionManager;
import com.notisync.device.support.TestRecords;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class SyncEngineTest {

  private static final Instant CAPTURED = Instant.parse("2026-03-02T10:00:00Z");
  private static final Instant NOW = Instant.parse("2026-03-02T10:00:30Z");

  private final InMemoryLocalRecordStore store = new InMemoryLocalRecordStore();
  private final NotificationServerClient client = mock(NotificationServerClient.class);
  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private final OperationPayloads payloads = new OperationPayloads(objectMapper);
  private final FixedNetworkMonitor network = new FixedNetworkMonitor(true);

  @Test
  void singleCreateMarksRecordSynced() {
    queueCreate("local-1", CAPTURED);
    when(client.createNotification(any()))
        .thenReturn(new CreateNotificationResponse("srv-1", "local-1", NOW));

    final SyncPassResult result = engine(SyncProperties.defaults()).performSync();

    assertThat(result.status()).isEqualTo(SyncPassResult.Status.COMPLETED);
    assertThat(result.succeeded()).isEqualTo(1);
    final NotificationRecord record = store.getRecord("local-1").orElseThrow();
    assertThat(record.synced()).isTrue();
    assertThat(record.serverId()).isEqualTo("srv-1");
    assertThat(record.serverUpdatedAt()).isEqualTo(NOW);
    assertThat(store.allOperations()).isEmpty();
  }

  @Test
  void createsGoOutAsOneBatchWithPerItemResults() {
    queueCreate("local-1", CAPTURED);
    queueCreate("local-2", CAPTURED.plusSeconds(1));
    queueCreate("local-3", CAPTURED.plusSeconds(2));
    when(client.batchCreate(anyList()))
        .thenReturn(
            new BatchCreateResponse(
                List.of(
                    BatchCreateResponse.ItemResult.accepted("local-1", "srv-1", NOW),
                    BatchCreateResponse.ItemResult.rejected("local-2", "title too long"),
                    BatchCreateResponse.ItemResult.accepted("local-3", "srv-3", NOW))));

    final SyncPassResult result = engine(SyncProperties.defaults()).performSync();

    assertThat(result.status()).isEqualTo(SyncPassResult.Status.PARTIAL);
    assertThat(result.succeeded()).isEqualTo(2);
    assertThat(result.failed()).isEqualTo(1);
    verify(client, times(1)).batchCreate(anyList());
    verify(client, never()).createNotification(any());
    assertThat(store.getRecord("local-2").orElseThrow().synced()).isFalse();
    final SyncOperation remaining = store.allOperations().get(0);
    assertThat(remaining.notificationId()).isEqualTo("local-2");
    assertThat(remaining.attempts()).isEqualTo(1);
    assertThat(remaining.lastError()).isEqualTo("title too long");
  }

  @Test
  void failedOperationBacksOffBeforeNextAttempt() {
    queueCreate("local-1", CAPTURED);
    when(client.createNotification(any()))
        .thenThrow(new SyncTransportException(SyncTransportException.Reason.TIMEOUT, "timed out"));
    final SyncEngine engine = engine(SyncProperties.defaults());

    final SyncPassResult first = engine.performSync();
    final SyncPassResult second = engine.performSync();

    assertThat(first.status()).isEqualTo(SyncPassResult.Status.PARTIAL);
    assertThat(first.failed()).isEqualTo(1);
    assertThat(second.failed()).isZero();
    verify(client, times(1)).createNotification(any());
    final SyncOperation operation = store.allOperations().get(0);
    assertThat(operation.attempts()).isEqualTo(1);
    assertThat(operation.lastAttempt()).isEqualTo(NOW);
    assertThat(store.getRecord("local-1").orElseThrow().syncAttempts()).isEqualTo(1);
    final SyncStats stats = engine.status().stats();
    assertThat(stats.totalSyncAttempts()).isEqualTo(2);
    assertThat(stats.failedSyncs()).isEqualTo(1);
    assertThat(stats.networkErrors()).isEqualTo(1);
  }

  @Test
  void operationIsAbandonedAfterMaxAttemptsAndStaysVisible() {
    store.saveRecord(TestRecords.unsynced("local-1", "Notes", "Hi", "there", CAPTURED));
    store.enqueueOperation(
        new SyncOperation(
            "op-1", SyncOperationType.CREATE, "local-1", payloads.createPayload(record("local-1")),
            4, CAPTURED, CAPTURED.minusSeconds(3600), "earlier failure", null));
    when(client.createNotification(any()))
        .thenThrow(new SyncTransportException(SyncTransportException.Reason.SERVER_ERROR, "503"));
    final SyncEngine engine = engine(SyncProperties.defaults());

    final SyncPassResult result = engine.performSync();

    assertThat(result.abandoned()).isEqualTo(1);
    assertThat(store.listOperations(10)).isEmpty();
    assertThat(store.listAbandonedOperations(10))
        .singleElement()
        .satisfies(operation -> assertThat(operation.attempts()).isEqualTo(5));
    assertThat(store.listSyncErrors(10)).singleElement()
        .satisfies(entry -> assertThat(entry.error()).isEqualTo("503"));
    assertThat(engine.status().pendingOperations()).isZero();
    assertThat(engine.status().stats().serverErrors()).isEqualTo(1);
  }

  @Test
  void conflictIsResolvedAndMissingActionIsResent() {
    store.saveRecord(
        TestRecords.synced("local-1", "srv-1", CAPTURED, CAPTURED)
            .applyAction(StatusAction.READ, NOW));
    store.enqueueOperation(
        SyncOperation.pending(
            "op-1", SyncOperationType.UPDATE, "local-1",
            payloads.actionPayload(StatusAction.READ), CAPTURED));
    final ServerNotification serverVersion =
        TestRecords.server("srv-1", "local-1", false, false, NOW.plusSeconds(5));
    when(client.updateStatus("srv-1", StatusAction.READ, CAPTURED))
        .thenReturn(StatusUpdateResult.conflict(serverVersion));
    final SyncEngine engine = engine(withStrategy(ConflictStrategy.MERGE));

    final SyncPassResult result = engine.performSync();

    assertThat(result.conflicts()).isEqualTo(1);
    assertThat(result.succeeded()).isEqualTo(1);
    final NotificationRecord resolved = store.getRecord("local-1").orElseThrow();
    assertThat(resolved.title()).isEqualTo("Hello (edited)");
    assertThat(resolved.read()).isTrue();
    assertThat(resolved.serverUpdatedAt()).isEqualTo(NOW.plusSeconds(5));
    final SyncOperation followUp = store.allOperations().get(0);
    assertThat(followUp.id()).isNotEqualTo("op-1");
    assertThat(followUp.type()).isEqualTo(SyncOperationType.UPDATE);
    assertThat(payloads.actionOf(followUp, null)).isEqualTo(StatusAction.READ);
    assertThat(engine.recentConflicts()).hasSize(1);
  }

  @Test
  void serverWinsConflictQueuesNothing() {
    store.saveRecord(
        TestRecords.synced("local-1", "srv-1", CAPTURED, CAPTURED)
            .applyAction(StatusAction.READ, NOW));
    store.enqueueOperation(
        SyncOperation.pending(
            "op-1", SyncOperationType.UPDATE, "local-1",
            payloads.actionPayload(StatusAction.READ), CAPTURED));
    when(client.updateStatus(eq("srv-1"), any(), any()))
        .thenReturn(
            StatusUpdateResult.conflict(
                TestRecords.server("srv-1", "local-1", false, true, NOW.plusSeconds(5))));

    engine(withStrategy(ConflictStrategy.SERVER_WINS)).performSync();

    assertThat(store.allOperations()).isEmpty();
    assertThat(store.getRecord("local-1").orElseThrow().dismissed()).isTrue();
  }

  @Test
  void statusUpdateWaitsForServerIdWithoutChargingAnAttempt() {
    store.saveRecord(TestRecords.unsynced("local-1", "Notes", "Hi", "there", CAPTURED));
    store.enqueueOperation(
        SyncOperation.pending(
            "op-1", SyncOperationType.DELETE, "local-1",
            payloads.actionPayload(StatusAction.DISMISS), CAPTURED));

    final SyncPassResult result = engine(SyncProperties.defaults()).performSync();

    assertThat(result.status()).isEqualTo(SyncPassResult.Status.COMPLETED);
    assertThat(result.failed()).isZero();
    verify(client, never()).updateStatus(any(), any(), any());
    final SyncOperation waiting = store.allOperations().get(0);
    assertThat(waiting.attempts()).isZero();
    assertThat(waiting.lastError()).isNull();
  }

  @Test
  void freshUpdateIsSentAfterOlderCreateOfSameRecord() {
    // the offline create scores below the fresh update, yet must reach the server first
    final Instant capturedOffline = NOW.minusSeconds(600);
    queueCreate("local-1", capturedOffline);
    store.enqueueOperation(
        SyncOperation.pending(
            "op-upd", SyncOperationType.UPDATE, "local-1",
            payloads.actionPayload(StatusAction.READ), NOW));
    when(client.createNotification(any()))
        .thenReturn(new CreateNotificationResponse("srv-1", "local-1", NOW));
    when(client.updateStatus(eq("srv-1"), eq(StatusAction.READ), any()))
        .thenReturn(StatusUpdateResult.ok(null));

    final SyncPassResult result = engine(SyncProperties.defaults()).performSync();

    assertThat(result.status()).isEqualTo(SyncPassResult.Status.COMPLETED);
    assertThat(result.succeeded()).isEqualTo(2);
    assertThat(result.failed()).isZero();
    final InOrder order = inOrder(client);
    order.verify(client).createNotification(any());
    order.verify(client).updateStatus(eq("srv-1"), eq(StatusAction.READ), any());
    assertThat(store.getRecord("local-1").orElseThrow().synced()).isTrue();
    assertThat(store.allOperations()).isEmpty();
    assertThat(store.listSyncErrors(10)).isEmpty();
  }

  @Test
  void skipsWhileOffline() {
    queueCreate("local-1", CAPTURED);
    network.online = false;

    final SyncPassResult result = engine(SyncProperties.defaults()).performSync();

    assertThat(result.status()).isEqualTo(SyncPassResult.Status.OFFLINE);
    verify(client, never()).createNotification(any());
  }

  @Test
  void skipsWhenDisabled() {
    final SyncProperties disabled =
        new SyncProperties(
            false, null, null, null, null, null, null, null, null, null, null, null, null, null,
            null, null);

    assertThat(engine(disabled).performSync().status())
        .isEqualTo(SyncPassResult.Status.DISABLED);
  }

  @Test
  void overlappingRequestReturnsAlreadySyncing() {
    queueCreate("local-1", CAPTURED);
    final SyncEngine engine = engine(SyncProperties.defaults());
    final AtomicReference<SyncPassResult> nested = new AtomicReference<>();
    when(client.createNotification(any()))
        .thenAnswer(
            invocation -> {
              nested.set(engine.retryFailedOperations());
              return new CreateNotificationResponse("srv-1", "local-1", NOW);
            });

    final SyncPassResult outer = engine.performSync();

    assertThat(outer.status()).isEqualTo(SyncPassResult.Status.COMPLETED);
    assertThat(nested.get().status()).isEqualTo(SyncPassResult.Status.ALREADY_SYNCING);
    assertThat(engine.isSyncing()).isFalse();
  }

  @Test
  void retryPassOnlyTouchesPreviouslyFailedDueOperations() {
    queueCreate("local-1", CAPTURED);
    store.saveRecord(TestRecords.unsynced("local-2", "Notes", "Retry", "me", CAPTURED));
    store.enqueueOperation(
        new SyncOperation(
            "op-local-2", SyncOperationType.CREATE, "local-2",
            payloads.createPayload(record("local-2")), 1, CAPTURED, CAPTURED, "timed out", null));
    when(client.createNotification(any()))
        .thenReturn(new CreateNotificationResponse("srv-2", "local-2", NOW));

    final SyncPassResult result = engine(SyncProperties.defaults()).retryFailedOperations();

    assertThat(result.succeeded()).isEqualTo(1);
    assertThat(store.getRecord("local-2").orElseThrow().synced()).isTrue();
    assertThat(store.getRecord("local-1").orElseThrow().synced()).isFalse();
    verify(client, times(1)).createNotification(any(NotificationPayload.class));
  }

  private SyncEngine engine(SyncProperties properties) {
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    return new SyncEngine(
        store,
        client,
        new OperationPlanner(properties),
        new ConflictResolver(properties, clock),
        new SyncStatsTracker(store, objectMapper),
        payloads,
        network,
        properties,
        new DeviceMetrics(new SimpleMeterRegistry()),
        NoOpTransactionManager.template(),
        clock);
  }

  private static SyncProperties withStrategy(ConflictStrategy strategy) {
    return new SyncProperties(
        null, null, null, null, null, null, null, null, strategy, null, null, null, null, null,
        null, null);
  }

  private void queueCreate(String id, Instant at) {
    store.saveRecord(TestRecords.unsynced(id, "Notes", "Title " + id, "Body", at));
    store.enqueueOperation(
        SyncOperation.pending(
            "op-" + id, SyncOperationType.CREATE, id, payloads.createPayload(record(id)), at));
  }

  private NotificationRecord record(String id) {
    return store.getRecord(id).orElseThrow();
  }

  private static final class FixedNetworkMonitor implements NetworkMonitor {

    private boolean online;

    private FixedNetworkMonitor(boolean online) {
      this.online = online;
    }

    @Override
    public boolean isOnline() {
      return online;
    }

    @Override
    public boolean probe() {
      return online;
    }

    @Override
    public void addReconnectListener(Runnable listener) {}
  }
}
