package com.notisync.server.service;

import com.notisync.common.api.PushMessageType;
import com.notisync.common.api.ServerNotification;

/** Fans a changed server copy out to the user's other devices. */
public interface NotificationPublisher {

  void publish(String userId, PushMessageType type, ServerNotification notification);
}
