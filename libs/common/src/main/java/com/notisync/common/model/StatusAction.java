package com.notisync.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** User actions on a notification that are replicated to the server. */
public enum StatusAction {
  READ("read"),
  DISMISS("dismiss"),
  CLICK("click");

  private final String wireName;

  StatusAction(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static StatusAction fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("action is required");
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (StatusAction action : values()) {
      if (action.wireName.equals(normalized)) {
        return action;
      }
    }
    throw new IllegalArgumentException("unknown action: " + value);
  }
}
