package com.notisync.server.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class ServerMetrics {

  private static final String METRIC_NOTIFICATION_TOTAL = "notisync.server.notification.total";
  private static final String METRIC_STATUS_UPDATE_TOTAL = "notisync.server.status.update.total";
  private static final String METRIC_PUSH_TOTAL = "notisync.server.push.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public ServerMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /** outcome: created, deduplicated, rejected, blocked */
  public void recordNotification(String outcome) {
    counter(METRIC_NOTIFICATION_TOTAL, "outcome", outcome).increment();
  }

  /** result: applied, unchanged, conflict */
  public void recordStatusUpdate(String result) {
    counter(METRIC_STATUS_UPDATE_TOTAL, "result", result).increment();
  }

  /** result: published, failed */
  public void recordPush(String result) {
    counter(METRIC_PUSH_TOTAL, "result", result).increment();
  }

  private Counter counter(String name, String tagKey, String tagValue) {
    return counters.computeIfAbsent(
        name + ":" + tagValue,
        ignored ->
            Counter.builder(name).tags(Tags.of(tagKey, tagValue)).register(meterRegistry));
  }
}
