package com.notisync.device.model;

import java.util.Locale;

/**
 * Bound from {@code client-wins}, {@code server-wins}, {@code timestamp-based} or
 * {@code merge}.
 */
public enum ConflictStrategy {
  CLIENT_WINS,
  SERVER_WINS,
  TIMESTAMP_BASED,
  MERGE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
