package com.notisync.device.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.notisync.common.model.StatusAction;
import com.notisync.device.AbstractPostgresContainerTest;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.SyncErrorEntry;
import com.notisync.device.model.SyncOperation;
import com.notisync.device.model.SyncOperationType;
import com.notisync.device.support.TestRecords;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JdbcLocalRecordStoreTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-02T10:00:00Z");

  @Autowired private JdbcLocalRecordStore store;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    final MapSqlParameterSource none = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM sync_queue", none);
    jdbcTemplate.update("DELETE FROM sync_error_log", none);
    jdbcTemplate.update("DELETE FROM app_settings", none);
    jdbcTemplate.update("DELETE FROM notifications", none);
  }

  @Test
  void recordRoundTripsExtrasAndFlags() {
    final NotificationRecord record =
        TestRecords.unsynced("local-1", "Messages", "Ana", "Your code is 123456", BASE_TIME)
            .withExtras(Map.of("tags", List.of("otp"), "channel", "sms"));

    store.saveRecord(record);

    final NotificationRecord loaded = store.getRecord("local-1").orElseThrow();
    assertThat(loaded.tags()).containsExactly("otp");
    assertThat(loaded.extras()).containsEntry("channel", "sms");
    assertThat(loaded.timestamp()).isEqualTo(BASE_TIME);
    assertThat(loaded.synced()).isFalse();
    assertThat(store.listUnsynced()).extracting(NotificationRecord::id).containsExactly("local-1");
  }

  @Test
  void saveOverwritesExistingRecord() {
    final NotificationRecord record = TestRecords.synced("local-1", "srv-1", BASE_TIME, BASE_TIME);
    store.saveRecord(record);

    store.saveRecord(record.applyAction(StatusAction.DISMISS, BASE_TIME.plusSeconds(10)));

    final NotificationRecord loaded = store.getRecord("local-1").orElseThrow();
    assertThat(loaded.dismissed()).isTrue();
    assertThat(loaded.updatedAt()).isEqualTo(BASE_TIME.plusSeconds(10));
    assertThat(store.findByServerId("srv-1")).isPresent();
  }

  @Test
  void markSyncedAndAttemptsAreRecorded() {
    store.saveRecord(TestRecords.unsynced("local-1", "Notes", "t", "b", BASE_TIME));

    store.incrementSyncAttempts("local-1", BASE_TIME.plusSeconds(1));
    store.markSynced("local-1", "srv-1", BASE_TIME.plusSeconds(2));

    final NotificationRecord loaded = store.getRecord("local-1").orElseThrow();
    assertThat(loaded.syncAttempts()).isEqualTo(1);
    assertThat(loaded.lastSyncAttempt()).isEqualTo(BASE_TIME.plusSeconds(1));
    assertThat(loaded.synced()).isTrue();
    assertThat(loaded.serverUpdatedAt()).isEqualTo(BASE_TIME.plusSeconds(2));
    assertThat(store.listUnsynced()).isEmpty();
  }

  @Test
  void recordsAreListedNewestFirst() {
    store.saveRecord(TestRecords.unsynced("old", "Notes", "t", "b", BASE_TIME));
    store.saveRecord(TestRecords.unsynced("new", "Notes", "t", "b", BASE_TIME.plusSeconds(60)));

    assertThat(store.listRecords(10, 0)).extracting(NotificationRecord::id)
        .containsExactly("new", "old");
    assertThat(store.listRecords(1, 1)).extracting(NotificationRecord::id).containsExactly("old");
  }

  @Test
  void queueKeepsOrderAndHidesAbandonedRows() {
    store.enqueueOperation(operation("op-2", BASE_TIME.plusSeconds(5)));
    store.enqueueOperation(operation("op-1", BASE_TIME));
    store.enqueueOperation(operation("op-1", BASE_TIME));

    store.updateOperation("op-2", 5, BASE_TIME.plusSeconds(30), "503");
    store.markAbandoned("op-2", BASE_TIME.plusSeconds(30));

    assertThat(store.listOperations(10)).extracting(SyncOperation::id).containsExactly("op-1");
    assertThat(store.countPendingOperations()).isEqualTo(1);
    final SyncOperation abandoned = store.listAbandonedOperations(10).get(0);
    assertThat(abandoned.attempts()).isEqualTo(5);
    assertThat(abandoned.lastError()).isEqualTo("503");
    assertThat(abandoned.abandoned()).isTrue();

    store.removeOperation("op-1");
    assertThat(store.countPendingOperations()).isZero();
  }

  @Test
  void syncErrorLogIsCappedNewestFirst() {
    for (int i = 0; i < 4; i++) {
      store.appendSyncError(
          new SyncErrorEntry(
              "op-" + i, SyncOperationType.CREATE, "local-" + i, 5, "error " + i,
              BASE_TIME.plusSeconds(i)),
          3);
    }

    assertThat(store.listSyncErrors(10)).extracting(SyncErrorEntry::operationId)
        .containsExactly("op-3", "op-2", "op-1");
  }

  @Test
  void settingsAreUpserted() {
    store.setSetting("sync_stats", "{\"total_sync_attempts\":1}");
    store.setSetting("sync_stats", "{\"total_sync_attempts\":2}");

    assertThat(store.getSetting("sync_stats")).contains("{\"total_sync_attempts\":2}");
    assertThat(store.getSetting("missing")).isEmpty();
  }

  @Test
  void retentionDeletesOnlyOldSyncedRecordsWithoutPendingWork() {
    final Instant old = BASE_TIME.minus(Duration.ofDays(10));
    store.saveRecord(TestRecords.synced("old-synced", "srv-1", old, old));
    store.saveRecord(TestRecords.synced("old-queued", "srv-2", old, old));
    store.saveRecord(TestRecords.unsynced("old-unsynced", "Notes", "t", "b", old));
    store.saveRecord(TestRecords.synced("fresh", "srv-3", BASE_TIME, BASE_TIME));
    store.enqueueOperation(
        SyncOperation.pending("op-1", SyncOperationType.UPDATE, "old-queued", "{}", BASE_TIME));

    final int deleted = store.deleteSyncedOlderThan(BASE_TIME.minus(Duration.ofDays(7)));

    assertThat(deleted).isEqualTo(1);
    assertThat(store.getRecord("old-synced")).isEmpty();
    assertThat(store.getRecord("old-queued")).isPresent();
    assertThat(store.getRecord("old-unsynced")).isPresent();
    assertThat(store.getRecord("fresh")).isPresent();
  }

  private static SyncOperation operation(String id, Instant createdAt) {
    return SyncOperation.pending(id, SyncOperationType.CREATE, "local-" + id, "{}", createdAt);
  }
}
