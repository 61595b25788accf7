/*
 * Where: device configuration binding
 * What: sync engine cadence, batching, retry and conflict settings
 * Why: connectivity differs per deployment so these stay tunable
 */
package com.notisync.device.config;

import com.notisync.device.model.ConflictStrategy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notisync.sync")
public record SyncProperties(
    Boolean enabled,
    Duration syncInterval,
    Duration retryInterval,
    Integer maxRetryAttempts,
    Integer batchSize,
    Integer maxBatchSize,
    Double exponentialBackoffBase,
    Duration maxBackoffDelay,
    ConflictStrategy conflictResolutionStrategy,
    Boolean enableBatchOptimization,
    Boolean enableConflictResolution,
    Boolean networkRequiredForSync,
    Integer errorLogCapacity,
    Integer resolutionHistoryCapacity,
    Integer errorMessageMaxLength,
    Integer queueLoadLimit) {

  public SyncProperties {
    enabled = enabled == null || enabled;
    syncInterval = syncInterval == null ? Duration.ofSeconds(30) : syncInterval;
    retryInterval = retryInterval == null ? Duration.ofSeconds(60) : retryInterval;
    maxRetryAttempts = maxRetryAttempts == null ? 5 : maxRetryAttempts;
    batchSize = batchSize == null ? 20 : batchSize;
    maxBatchSize = maxBatchSize == null ? 100 : maxBatchSize;
    exponentialBackoffBase = exponentialBackoffBase == null ? 2.0 : exponentialBackoffBase;
    maxBackoffDelay = maxBackoffDelay == null ? Duration.ofMinutes(5) : maxBackoffDelay;
    conflictResolutionStrategy =
        conflictResolutionStrategy == null
            ? ConflictStrategy.TIMESTAMP_BASED
            : conflictResolutionStrategy;
    enableBatchOptimization = enableBatchOptimization == null || enableBatchOptimization;
    enableConflictResolution = enableConflictResolution == null || enableConflictResolution;
    networkRequiredForSync = networkRequiredForSync == null || networkRequiredForSync;
    errorLogCapacity = errorLogCapacity == null ? 50 : errorLogCapacity;
    resolutionHistoryCapacity = resolutionHistoryCapacity == null ? 100 : resolutionHistoryCapacity;
    errorMessageMaxLength = errorMessageMaxLength == null ? 1000 : errorMessageMaxLength;
    queueLoadLimit = queueLoadLimit == null ? 1000 : queueLoadLimit;
  }

  public static SyncProperties defaults() {
    return new SyncProperties(
        null, null, null, null, null, null, null, null, null, null, null, null, null, null, null,
        null);
  }

  /** Configured batch size, never above the hard cap. */
  public int effectiveBatchSize() {
    return Math.max(1, Math.min(batchSize, maxBatchSize));
  }
}
