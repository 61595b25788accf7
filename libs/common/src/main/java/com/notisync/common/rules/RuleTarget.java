package com.notisync.common.rules;

import com.notisync.common.model.NotificationCategory;
import com.notisync.common.model.Priorities;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the notification fields rules can read and write. Both the device pipeline and
 * the server authority map their own records into this shape.
 */
public record RuleTarget(
    String appIdentity,
    String sourceId,
    String title,
    String body,
    NotificationCategory category,
    int priority,
    Instant timestamp,
    Map<String, Object> extras,
    List<String> tags,
    boolean read,
    boolean dismissed) {

  public RuleTarget {
    title = title == null ? "" : title;
    body = body == null ? "" : body;
    category = category == null ? NotificationCategory.PERSONAL : category;
    priority = Priorities.clamp(priority);
    extras = extras == null ? Map.of() : extras;
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public String text() {
    return title + " " + body;
  }
}
