package com.notisync.server.model;

import com.notisync.common.api.ServerNotification;

/** {@code created} is false when an earlier request with the same client id already stored it. */
public record CreateOutcome(ServerNotification notification, boolean created) {}
