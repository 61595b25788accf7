package com.notisync.server.service;

import com.notisync.common.api.PushMessageType;
import com.notisync.common.api.ServerNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Used when NATS is disabled; devices then only learn about changes on their next sync pass. */
@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingNotificationPublisher implements NotificationPublisher {

  private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationPublisher.class);

  @Override
  public void publish(String userId, PushMessageType type, ServerNotification notification) {
    logger.debug(
        "push skipped; nats disabled userId={} type={} notificationId={}",
        userId,
        type.wireName(),
        notification.id());
  }
}
