package com.notisync.common.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PushMessageType {
  NOTIFICATION_NEW("notification_new"),
  NOTIFICATION_UPDATE("notification_update"),
  SYNC_STATUS("sync_status"),
  PING("ping"),
  PONG("pong");

  private final String wireName;

  PushMessageType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static PushMessageType fromWireName(String value) {
    for (PushMessageType type : values()) {
      if (type.wireName.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown push message type: " + value);
  }
}
