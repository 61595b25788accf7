/*
 * Where: device service layer
 * What: removes synced notifications older than the retention period
 * Why: the server holds the history; the device keeps only a recent window
 */
package com.notisync.device.service;

import com.notisync.device.config.RetentionProperties;
import com.notisync.device.repository.LocalRecordStore;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RetentionService {

  private static final Logger logger = LoggerFactory.getLogger(RetentionService.class);

  private final LocalRecordStore store;
  private final RetentionProperties properties;
  private final Clock clock;

  /** Unsynced records and records with queued operations are never removed. */
  public int cleanup() {
    final Instant threshold = Instant.now(clock).minus(properties.retention());
    final int deleted = store.deleteSyncedOlderThan(threshold);
    logger.info("retention cleanup deleted notifications={} threshold={}", deleted, threshold);
    return deleted;
  }
}
