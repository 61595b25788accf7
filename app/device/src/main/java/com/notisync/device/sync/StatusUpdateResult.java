package com.notisync.device.sync;

import com.notisync.common.api.ServerNotification;

/** On success {@code serverVersion} is the updated server copy when the server returned one. */
public record StatusUpdateResult(boolean conflict, ServerNotification serverVersion) {

  public static StatusUpdateResult ok(ServerNotification serverVersion) {
    return new StatusUpdateResult(false, serverVersion);
  }

  public static StatusUpdateResult conflict(ServerNotification serverVersion) {
    return new StatusUpdateResult(true, serverVersion);
  }
}
