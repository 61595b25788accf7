/*
 * Where: device service layer
 * What: Micrometer meters for capture outcomes, sync passes and the pending queue
 * Why: queue growth and abandonment are the first signs of a device stuck offline
 */
package com.notisync.device.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class DeviceMetrics {

  private static final String METRIC_CAPTURE_TOTAL = "notisync.capture.total";
  private static final String METRIC_SYNC_PASS_TOTAL = "notisync.sync.pass.total";
  private static final String METRIC_SYNC_PASS_DURATION = "notisync.sync.pass.duration";
  private static final String METRIC_SYNC_OPERATION_TOTAL = "notisync.sync.operation.total";
  private static final String METRIC_CONFLICT_TOTAL = "notisync.sync.conflict.total";
  private static final String METRIC_QUEUE_PENDING = "notisync.sync.queue.pending";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger queuePending = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Timer passTimer;

  public DeviceMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_QUEUE_PENDING, queuePending, AtomicInteger::get)
        .description("Sync operations waiting in the local queue")
        .register(meterRegistry);
    this.passTimer =
        Timer.builder(METRIC_SYNC_PASS_DURATION)
            .description("Wall time of a sync pass")
            .register(meterRegistry);
  }

  /** outcome: accepted, duplicate, blocked, invalid, error */
  public void recordCapture(String outcome) {
    increment(METRIC_CAPTURE_TOTAL, "outcome", outcome);
  }

  public void recordSyncPass(String status, Duration duration) {
    increment(METRIC_SYNC_PASS_TOTAL, "status", status);
    passTimer.record(duration);
  }

  /** result: synced, failed, abandoned */
  public void recordOperations(String result, int count) {
    if (count <= 0) {
      return;
    }
    counter(METRIC_SYNC_OPERATION_TOTAL, "result", result).increment(count);
  }

  public void recordConflict(String strategy) {
    increment(METRIC_CONFLICT_TOTAL, "strategy", strategy);
  }

  public void updateQueuePending(int pending) {
    queuePending.set(Math.max(pending, 0));
  }

  private void increment(String name, String tagKey, String tagValue) {
    counter(name, tagKey, tagValue).increment();
  }

  private Counter counter(String name, String tagKey, String tagValue) {
    return counters.computeIfAbsent(
        name + ":" + tagValue,
        ignored ->
            Counter.builder(name).tags(Tags.of(tagKey, tagValue)).register(meterRegistry));
  }
}
