/*
 * Where: device domain model
 * What: a captured notification as persisted in the local store
 * Why: pipeline, sync engine and push reconciliation all read and write this snapshot
 */
package com.notisync.device.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notisync.common.model.NotificationCategory;
import com.notisync.common.model.Priorities;
import com.notisync.common.model.StatusAction;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code updatedAt} is the last local modification; {@code serverUpdatedAt} is the server
 * modification time this device last observed. {@code synced} implies a server id.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationRecord(
    String id,
    String serverId,
    String appIdentity,
    String title,
    String body,
    NotificationCategory category,
    int priority,
    Instant timestamp,
    String sourceId,
    Map<String, Object> extras,
    boolean synced,
    int syncAttempts,
    Instant lastSyncAttempt,
    boolean read,
    boolean dismissed,
    Instant updatedAt,
    Instant serverUpdatedAt) {

  public static final String TAGS_KEY = "tags";

  public NotificationRecord {
    if (synced && serverId == null) {
      throw new IllegalArgumentException("synced record requires a server id: " + id);
    }
    priority = Priorities.clamp(priority);
    category = category == null ? NotificationCategory.PERSONAL : category;
    // values may be null when decoded from JSON, which rules out Map.copyOf
    extras =
        extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    syncAttempts = Math.max(0, syncAttempts);
  }

  public List<String> tags() {
    final Object raw = extras.get(TAGS_KEY);
    final List<String> tags = new ArrayList<>();
    if (raw instanceof List<?> list) {
      for (Object tag : list) {
        if (tag != null) {
          tags.add(tag.toString());
        }
      }
    }
    return tags;
  }

  public NotificationRecord markSynced(String newServerId, Instant serverSeenAt) {
    return new NotificationRecord(
        id, newServerId, appIdentity, title, body, category, priority, timestamp, sourceId, extras,
        true, syncAttempts, lastSyncAttempt, read, dismissed, updatedAt, serverSeenAt);
  }

  public NotificationRecord applyAction(StatusAction action, Instant now) {
    final boolean newRead = read || action == StatusAction.READ || action == StatusAction.CLICK;
    final boolean newDismissed = dismissed || action == StatusAction.DISMISS;
    return new NotificationRecord(
        id, serverId, appIdentity, title, body, category, priority, timestamp, sourceId, extras,
        synced, syncAttempts, lastSyncAttempt, newRead, newDismissed, now, serverUpdatedAt);
  }

  public NotificationRecord withClassification(
      String newTitle,
      String newBody,
      NotificationCategory newCategory,
      int newPriority,
      Map<String, Object> newExtras,
      boolean newRead,
      boolean newDismissed) {
    return new NotificationRecord(
        id, serverId, appIdentity, newTitle, newBody, newCategory, newPriority, timestamp, sourceId,
        newExtras, synced, syncAttempts, lastSyncAttempt, newRead, newDismissed, updatedAt,
        serverUpdatedAt);
  }

  public NotificationRecord withExtras(Map<String, Object> newExtras) {
    return new NotificationRecord(
        id, serverId, appIdentity, title, body, category, priority, timestamp, sourceId, newExtras,
        synced, syncAttempts, lastSyncAttempt, read, dismissed, updatedAt, serverUpdatedAt);
  }
}
