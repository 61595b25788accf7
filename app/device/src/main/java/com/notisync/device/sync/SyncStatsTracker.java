package com.notisync.device.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notisync.device.model.SyncStats;
import com.notisync.device.repository.LocalRecordStore;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Running sync totals, persisted under {@value #SETTING_KEY} after every pass. */
@Component
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "collaborators are shared Spring beans")
public class SyncStatsTracker {

  static final String SETTING_KEY = "sync_stats";

  private static final Logger logger = LoggerFactory.getLogger(SyncStatsTracker.class);

  private final LocalRecordStore store;
  private final ObjectMapper objectMapper;

  private SyncStats current;

  public synchronized SyncStats current() {
    if (current == null) {
      current = load();
    }
    return current;
  }

  public synchronized SyncStats recordPass(PassTally tally, Duration duration, Instant finishedAt) {
    final SyncStats previous = current();
    final boolean success = tally.failed() == 0 && tally.abandoned() == 0;
    final long passes = previous.totalSyncAttempts() + 1;
    final double average =
        previous.averageSyncTime() + (duration.toMillis() - previous.averageSyncTime()) / passes;
    current =
        new SyncStats(
            passes,
            previous.successfulSyncs() + (success ? 1 : 0),
            previous.failedSyncs() + (success ? 0 : 1),
            previous.conflictsResolved() + tally.conflicts(),
            previous.batchesSynced() + tally.batches(),
            average,
            finishedAt,
            success ? finishedAt : previous.lastSuccessfulSync(),
            previous.networkErrors() + tally.networkErrors(),
            previous.serverErrors() + tally.serverErrors(),
            previous.syncErrors() + tally.syncErrors());
    persist(current);
    return current;
  }

  private SyncStats load() {
    try {
      return store
          .getSetting(SETTING_KEY)
          .map(this::read)
          .orElseGet(SyncStats::empty);
    } catch (RuntimeException ex) {
      logger.warn("sync stats not loaded; starting from zero", ex);
      return SyncStats.empty();
    }
  }

  private SyncStats read(String json) {
    try {
      return objectMapper.readValue(json, SyncStats.class);
    } catch (JsonProcessingException ex) {
      logger.warn("stored sync stats unreadable; starting from zero error={}", ex.getMessage());
      return SyncStats.empty();
    }
  }

  private void persist(SyncStats stats) {
    try {
      store.setSetting(SETTING_KEY, objectMapper.writeValueAsString(stats));
    } catch (JsonProcessingException | RuntimeException ex) {
      // in-memory totals stay authoritative until the next successful write
      logger.warn("sync stats not persisted", ex);
    }
  }
}
