package com.notisync.device.model;

public enum SyncOperationType {
  CREATE("create"),
  UPDATE("update"),
  DELETE("delete");

  private final String wireName;

  SyncOperationType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static SyncOperationType fromWireName(String value) {
    for (SyncOperationType type : values()) {
      if (type.wireName.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown sync operation type: " + value);
  }
}
