package com.notisync.device.sync;

import com.notisync.common.api.BatchCreateResponse;
import com.notisync.common.api.CreateNotificationResponse;
import com.notisync.common.api.NotificationPayload;
import com.notisync.common.model.StatusAction;
import java.time.Instant;
import java.util.List;

/** Calls to the server of record. Every failure surfaces as {@link SyncTransportException}. */
public interface NotificationServerClient {

  CreateNotificationResponse createNotification(NotificationPayload payload);

  /** One result per payload, in order. */
  BatchCreateResponse batchCreate(List<NotificationPayload> payloads);

  StatusUpdateResult updateStatus(String serverId, StatusAction action, Instant clientUpdatedAt);

  boolean isReachable();
}
