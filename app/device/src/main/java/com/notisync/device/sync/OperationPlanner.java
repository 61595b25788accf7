/*
 * Where: device sync layer
 * What: derives priority and next retry time per queued operation and groups them into batches
 * Why: recent creates should reach the server first, and failing operations back off
 */
package com.notisync.device.sync;

import com.notisync.device.config.SyncProperties;
import com.notisync.device.model.PlannedOperation;
import com.notisync.device.model.SyncBatch;
import com.notisync.device.model.SyncOperation;
import com.notisync.device.model.SyncOperationType;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class OperationPlanner {

  private static final Duration FRESH = Duration.ofMinutes(1);
  private static final Duration RECENT = Duration.ofMinutes(5);
  private static final int MAX_ATTEMPT_PENALTY = 3;

  private static final Comparator<PlannedOperation> BY_PRIORITY =
      Comparator.comparingInt(PlannedOperation::priority).reversed();

  private final SyncProperties properties;

  public PlannedOperation plan(SyncOperation operation, Instant now) {
    return new PlannedOperation(operation, priority(operation, now), nextRetry(operation));
  }

  /**
   * Base 1, +2 when younger than a minute or +1 under five, +1 for creates, minus up to 3 for
   * attempts.
   */
  public int priority(SyncOperation operation, Instant now) {
    int priority = 1;
    final Duration age = Duration.between(operation.createdAt(), now);
    if (age.compareTo(FRESH) < 0) {
      priority += 2;
    } else if (age.compareTo(RECENT) < 0) {
      priority += 1;
    }
    if (operation.type() == SyncOperationType.CREATE) {
      priority += 1;
    }
    priority -= Math.min(operation.attempts(), MAX_ATTEMPT_PENALTY);
    return Math.max(0, priority);
  }

  /** Never-attempted operations are due from creation. */
  public Instant nextRetry(SyncOperation operation) {
    if (operation.attempts() == 0 || operation.lastAttempt() == null) {
      return operation.createdAt();
    }
    return operation.lastAttempt().plus(backoffDelay(operation.attempts()));
  }

  /** {@code min(base^attempts * 1s, maxBackoffDelay)}. */
  public Duration backoffDelay(int attempts) {
    final long capMillis = properties.maxBackoffDelay().toMillis();
    final double millis = Math.pow(properties.exponentialBackoffBase(), attempts) * 1000.0;
    if (Double.isNaN(millis) || millis >= capMillis) {
      return properties.maxBackoffDelay();
    }
    return Duration.ofMillis((long) millis);
  }

  /**
   * Batches ordered by descending priority. With optimization on, operations of one type are
   * chunked in priority order so only the last chunk of each type may be short; otherwise every
   * operation is its own batch.
   */
  public List<SyncBatch> batches(List<PlannedOperation> operations) {
    final List<PlannedOperation> ordered = new ArrayList<>(operations);
    ordered.sort(BY_PRIORITY);
    final List<SyncBatch> batches = new ArrayList<>();
    if (!properties.enableBatchOptimization()) {
      for (PlannedOperation operation : ordered) {
        batches.add(
            new SyncBatch(operation.operation().type(), operation.priority(), List.of(operation)));
      }
      return batches;
    }
    final Map<SyncOperationType, List<PlannedOperation>> byType =
        new EnumMap<>(SyncOperationType.class);
    for (PlannedOperation operation : ordered) {
      byType
          .computeIfAbsent(operation.operation().type(), ignored -> new ArrayList<>())
          .add(operation);
    }
    final int size = properties.effectiveBatchSize();
    for (Map.Entry<SyncOperationType, List<PlannedOperation>> entry : byType.entrySet()) {
      final List<PlannedOperation> sameType = entry.getValue();
      for (int start = 0; start < sameType.size(); start += size) {
        final List<PlannedOperation> chunk =
            sameType.subList(start, Math.min(start + size, sameType.size()));
        batches.add(new SyncBatch(entry.getKey(), chunk.get(0).priority(), chunk));
      }
    }
    batches.sort(Comparator.comparingInt(SyncBatch::priority).reversed());
    return batches;
  }
}
