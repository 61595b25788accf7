/*
 * Where: server NATS publishing
 * What: publishes notification_new / notification_update push messages to the user's subject
 * Why: other devices of the same user reconcile without waiting for their next sync pass
 */
package com.notisync.server.nats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notisync.common.api.PushMessage;
import com.notisync.common.api.PushMessageType;
import com.notisync.common.api.ServerNotification;
import com.notisync.server.config.PushNatsProperties;
import com.notisync.server.service.NotificationPublisher;
import com.notisync.server.service.ServerMetrics;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true")
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "collaborators are shared Spring beans")
public class JetStreamNotificationPublisher implements NotificationPublisher {

  private static final Logger logger =
      LoggerFactory.getLogger(JetStreamNotificationPublisher.class);
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_MESSAGE_TYPE = "message_type";

  private final JetStream jetStream;
  private final PushNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final ServerMetrics metrics;
  private final Clock clock;

  /** Failures are logged and counted; the caller's write has already committed. */
  @Override
  public void publish(String userId, PushMessageType type, ServerNotification notification) {
    final String subject = properties.subjectFor(userId);
    try {
      final PushMessage message =
          new PushMessage(type, objectMapper.valueToTree(notification), Instant.now(clock));
      final PublishAck ack =
          jetStream.publish(
              subject, buildHeaders(type, notification), objectMapper.writeValueAsBytes(message));
      if (ack == null) {
        throw new IllegalStateException("puback is missing");
      }
      metrics.recordPush("published");
      logger.debug(
          "push published subject={} type={} notificationId={} seq={}",
          subject,
          type.wireName(),
          notification.id(),
          ack.getSeqno());
    } catch (JetStreamApiException | IOException | RuntimeException ex) {
      metrics.recordPush("failed");
      logger.warn(
          "push publish failed subject={} type={} notificationId={}",
          subject,
          type.wireName(),
          notification.id(),
          ex);
    }
  }

  private Headers buildHeaders(PushMessageType type, ServerNotification notification) {
    final Headers headers = new Headers();
    // one message id per server version, so a retried publish is de-duplicated by the stream
    headers.add(HEADER_MESSAGE_ID, messageId(type, notification));
    headers.add(HEADER_MESSAGE_TYPE, type.wireName());
    return headers;
  }

  static String messageId(PushMessageType type, ServerNotification notification) {
    return type.wireName()
        + ":"
        + notification.id()
        + ":"
        + notification.updatedAt().toEpochMilli();
  }
}
