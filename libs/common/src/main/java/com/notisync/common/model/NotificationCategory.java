package com.notisync.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum NotificationCategory {
  WORK("work"),
  PERSONAL("personal"),
  JUNK("junk");

  private final String wireName;

  NotificationCategory(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** Accepts "Work", "work" and "WORK" alike. */
  @JsonCreator
  public static NotificationCategory fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("category is required");
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (NotificationCategory category : values()) {
      if (category.wireName.equals(normalized)) {
        return category;
      }
    }
    throw new IllegalArgumentException("unknown category: " + value);
  }
}
