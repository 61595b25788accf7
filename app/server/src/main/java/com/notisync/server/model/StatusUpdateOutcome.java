package com.notisync.server.model;

import com.notisync.common.api.ServerNotification;

public record StatusUpdateOutcome(Status status, ServerNotification notification) {

  public enum Status {
    APPLIED,
    UNCHANGED,
    CONFLICT
  }

  public static StatusUpdateOutcome applied(ServerNotification notification) {
    return new StatusUpdateOutcome(Status.APPLIED, notification);
  }

  public static StatusUpdateOutcome unchanged(ServerNotification notification) {
    return new StatusUpdateOutcome(Status.UNCHANGED, notification);
  }

  public static StatusUpdateOutcome conflict(ServerNotification notification) {
    return new StatusUpdateOutcome(Status.CONFLICT, notification);
  }

  public boolean conflicted() {
    return status == Status.CONFLICT;
  }
}
