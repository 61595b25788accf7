/*
 * Where: device capture pipeline
 * What: suppresses repeat captures of the same logical notification inside a time window
 * Why: platform listeners re-post updates and group summaries for a single event
 */
package com.notisync.device.service;

import com.google.common.annotations.VisibleForTesting;
import com.notisync.device.config.DeduplicationProperties;
import com.notisync.device.model.DeduplicationResult;
import com.notisync.device.model.NotificationRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Keeps the last-seen time per deduplication key. Entries older than twice the window are purged
 * on every call; the map never grows past {@code maxEntries}.
 */
@Component
public class Deduplicator {

  private static final Map<String, Function<NotificationRecord, String>> FIELD_EXTRACTORS =
      Map.of(
          "appIdentity", NotificationRecord::appIdentity,
          "appName", NotificationRecord::appIdentity,
          "title", NotificationRecord::title,
          "body", NotificationRecord::body,
          "sourceId", NotificationRecord::sourceId,
          "packageName", NotificationRecord::sourceId);

  private final DeduplicationProperties properties;
  private final Clock clock;
  private final List<Function<NotificationRecord, String>> keyFields;
  // access order is insertion order; a re-seen key is moved to the tail
  private final LinkedHashMap<List<String>, Entry> recent = new LinkedHashMap<>();

  public Deduplicator(DeduplicationProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
    this.keyFields = new ArrayList<>();
    for (String field : properties.fields()) {
      final Function<NotificationRecord, String> extractor = FIELD_EXTRACTORS.get(field);
      if (extractor == null) {
        throw new IllegalArgumentException("unsupported deduplication field: " + field);
      }
      keyFields.add(extractor);
    }
  }

  public DeduplicationResult process(NotificationRecord record) {
    return process(record, Instant.now(clock));
  }

  public synchronized DeduplicationResult process(NotificationRecord record, Instant now) {
    if (!properties.enabled()) {
      return DeduplicationResult.accepted("deduplication disabled");
    }
    final Duration window = properties.window();
    purgeOlderThan(now.minus(window.multipliedBy(2)));

    final List<String> values = keyValues(record);
    final Instant windowStart = now.minus(window);
    final Entry existing = recent.get(values);
    if (existing != null && existing.lastSeen().isAfter(windowStart)) {
      return DeduplicationResult.duplicate("exact duplicate within window");
    }
    if (properties.fuzzyMatching()) {
      for (Entry entry : recent.values()) {
        if (entry.lastSeen().isAfter(windowStart)
            && similarity(values, entry.values()) >= properties.similarityThreshold()) {
          return DeduplicationResult.duplicate("similar to recent capture");
        }
      }
    }
    remember(values, new Entry(values, now));
    return DeduplicationResult.accepted("unique");
  }

  @VisibleForTesting
  synchronized int size() {
    return recent.size();
  }

  public synchronized void clear() {
    recent.clear();
  }

  /** Mean per-field similarity over fields where at least one side is non-empty. */
  @VisibleForTesting
  static double similarity(List<String> left, List<String> right) {
    double total = 0;
    int fields = 0;
    for (int i = 0; i < left.size(); i++) {
      final String a = left.get(i);
      final String b = right.get(i);
      if (a.isEmpty() && b.isEmpty()) {
        continue;
      }
      total += stringSimilarity(a, b);
      fields++;
    }
    return fields == 0 ? 0 : total / fields;
  }

  @VisibleForTesting
  static double stringSimilarity(String a, String b) {
    final String longer = a.length() >= b.length() ? a : b;
    final String shorter = a.length() >= b.length() ? b : a;
    if (longer.isEmpty()) {
      return 1.0;
    }
    return (longer.length() - levenshtein(longer, shorter)) / (double) longer.length();
  }

  private static int levenshtein(String a, String b) {
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        final int substitution = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        current[j] =
            Math.min(
                Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + substitution);
      }
      final int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }

  private List<String> keyValues(NotificationRecord record) {
    final List<String> values = new ArrayList<>(keyFields.size());
    for (Function<NotificationRecord, String> field : keyFields) {
      final String value = field.apply(record);
      values.add(value == null ? "" : value.trim().toLowerCase(Locale.ROOT));
    }
    return List.copyOf(values);
  }

  private void purgeOlderThan(Instant cutoff) {
    final Iterator<Map.Entry<List<String>, Entry>> iterator = recent.entrySet().iterator();
    while (iterator.hasNext()) {
      if (iterator.next().getValue().lastSeen().isBefore(cutoff)) {
        iterator.remove();
      }
    }
  }

  private void remember(List<String> key, Entry entry) {
    recent.remove(key);
    recent.put(key, entry);
    final Iterator<List<String>> oldest = recent.keySet().iterator();
    while (recent.size() > properties.maxEntries() && oldest.hasNext()) {
      oldest.next();
      oldest.remove();
    }
  }

  private record Entry(List<String> values, Instant lastSeen) {}
}
