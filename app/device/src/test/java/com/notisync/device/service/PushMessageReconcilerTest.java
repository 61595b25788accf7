package com.notisync.device.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notisync.common.api.PushMessage;
import com.notisync.common.api.PushMessageType;
import com.notisync.common.api.ServerNotification;
import com.notisync.common.model.StatusAction;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.support.InMemoryLocalRecordStore;
import com.notisync.device.support.TestRecords;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class PushMessageReconcilerTest {

  private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");
  private static final Instant T1 = Instant.parse("2026-03-02T10:01:00Z");
  private static final Instant T2 = Instant.parse("2026-03-02T10:02:00Z");

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private final InMemoryLocalRecordStore store = new InMemoryLocalRecordStore();
  private final PushMessageReconciler reconciler =
      new PushMessageReconciler(store, objectMapper, Clock.fixed(T2, ZoneOffset.UTC));

  @Test
  void newNotificationFromAnotherDeviceIsStoredAsSynced() {
    reconciler.handle(
        message(
            PushMessageType.NOTIFICATION_NEW,
            TestRecords.server("srv-9", "other-local", false, false, T1)));

    final NotificationRecord stored = store.findByServerId("srv-9").orElseThrow();
    assertThat(stored.synced()).isTrue();
    assertThat(stored.serverUpdatedAt()).isEqualTo(T1);
  }

  @Test
  void echoOfOwnCreateMarksLocalRecordSynced() {
    store.saveRecord(TestRecords.unsynced("local-1", "Messages", "Hello", "body", T0));

    reconciler.handle(
        message(
            PushMessageType.NOTIFICATION_NEW,
            TestRecords.server("srv-1", "local-1", false, false, T1)));

    final NotificationRecord stored = store.getRecord("local-1").orElseThrow();
    assertThat(stored.synced()).isTrue();
    assertThat(stored.serverId()).isEqualTo("srv-1");
    assertThat(store.listRecords(10, 0)).hasSize(1);
  }

  @Test
  void updateMergesFlagsAndTakesServerContent() {
    store.saveRecord(
        TestRecords.synced("local-1", "srv-1", T0, T0).applyAction(StatusAction.READ, T0));

    reconciler.handle(
        message(
            PushMessageType.NOTIFICATION_UPDATE,
            TestRecords.server("srv-1", "local-1", false, true, T1)));

    final NotificationRecord stored = store.getRecord("local-1").orElseThrow();
    assertThat(stored.read()).isTrue();
    assertThat(stored.dismissed()).isTrue();
    assertThat(stored.title()).isEqualTo("Hello (edited)");
    assertThat(stored.serverUpdatedAt()).isEqualTo(T1);
  }

  @Test
  void staleUpdateIsIgnored() {
    store.saveRecord(TestRecords.synced("local-1", "srv-1", T0, T2));

    reconciler.handle(
        message(
            PushMessageType.NOTIFICATION_UPDATE,
            TestRecords.server("srv-1", "local-1", true, true, T1)));

    final NotificationRecord stored = store.getRecord("local-1").orElseThrow();
    assertThat(stored.read()).isFalse();
    assertThat(stored.title()).isEqualTo("Hello");
  }

  @Test
  void controlMessagesChangeNothing() {
    reconciler.handle(new PushMessage(PushMessageType.PING, null, T0));

    assertThat(store.listRecords(10, 0)).isEmpty();
  }

  @Test
  void notificationMessageWithoutDataIsPermanentFailure() {
    assertThatThrownBy(
            () -> reconciler.handle(new PushMessage(PushMessageType.NOTIFICATION_NEW, null, T0)))
        .isInstanceOf(PushMessagePermanentException.class);
  }

  private PushMessage message(PushMessageType type, ServerNotification notification) {
    return new PushMessage(type, objectMapper.valueToTree(notification), T1);
  }
}
