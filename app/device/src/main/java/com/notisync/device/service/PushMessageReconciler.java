/*
 * Where: device service layer
 * What: applies server push messages to the local record store
 * Why: changes made on other devices arrive here without waiting for a sync pass
 */
package com.notisync.device.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notisync.common.api.PushMessage;
import com.notisync.common.api.ServerNotification;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.repository.LocalRecordStore;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "collaborators are shared Spring beans")
public class PushMessageReconciler {

  private static final Logger logger = LoggerFactory.getLogger(PushMessageReconciler.class);

  private final LocalRecordStore store;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public void handle(PushMessage message) {
    if (message == null || message.type() == null) {
      throw new PushMessagePermanentException("push message has no type");
    }
    switch (message.type()) {
      case NOTIFICATION_NEW -> applyNew(readNotification(message));
      case NOTIFICATION_UPDATE -> applyUpdate(readNotification(message));
      case SYNC_STATUS, PING, PONG ->
          logger.debug("push message acknowledged type={}", message.type().wireName());
    }
  }

  private void applyNew(ServerNotification server) {
    final Optional<NotificationRecord> local = findLocal(server);
    if (local.isEmpty()) {
      store.saveRecord(fromServer(server));
      logger.info("push notification stored serverId={} app={}", server.id(), server.appName());
      return;
    }
    final NotificationRecord record = local.get();
    if (!record.synced()) {
      // our own create echoed back before the sync response was applied
      store.markSynced(record.id(), server.id(), server.updatedAt());
    }
  }

  private void applyUpdate(ServerNotification server) {
    final Optional<NotificationRecord> local = findLocal(server);
    if (local.isEmpty()) {
      store.saveRecord(fromServer(server));
      return;
    }
    final NotificationRecord record = local.get();
    if (record.serverUpdatedAt() != null
        && server.updatedAt() != null
        && !server.updatedAt().isAfter(record.serverUpdatedAt())) {
      logger.debug("stale push update ignored serverId={}", server.id());
      return;
    }
    final Instant updatedAt =
        record.updatedAt() == null
                || (server.updatedAt() != null && server.updatedAt().isAfter(record.updatedAt()))
            ? server.updatedAt()
            : record.updatedAt();
    store.saveRecord(
        new NotificationRecord(
            record.id(),
            server.id(),
            record.appIdentity(),
            server.title() == null ? record.title() : server.title(),
            server.body() == null ? record.body() : server.body(),
            server.category() == null ? record.category() : server.category(),
            server.priority(),
            record.timestamp(),
            record.sourceId(),
            record.extras(),
            true,
            record.syncAttempts(),
            record.lastSyncAttempt(),
            record.read() || server.isRead(),
            record.dismissed() || server.isDismissed(),
            updatedAt,
            server.updatedAt()));
  }

  private Optional<NotificationRecord> findLocal(ServerNotification server) {
    final Optional<NotificationRecord> byServerId = store.findByServerId(server.id());
    if (byServerId.isPresent() || server.clientId() == null) {
      return byServerId;
    }
    return store.getRecord(server.clientId());
  }

  private NotificationRecord fromServer(ServerNotification server) {
    final Instant now = Instant.now(clock);
    return new NotificationRecord(
        UUID.randomUUID().toString(),
        server.id(),
        server.appName(),
        server.title(),
        server.body(),
        server.category(),
        server.priority(),
        server.timestamp() == null ? now : server.timestamp(),
        server.packageName(),
        server.extras(),
        true,
        0,
        null,
        server.isRead(),
        server.isDismissed(),
        server.updatedAt() == null ? now : server.updatedAt(),
        server.updatedAt());
  }

  private ServerNotification readNotification(PushMessage message) {
    if (message.data() == null || message.data().isNull()) {
      throw new PushMessagePermanentException(
          "push message has no data type=" + message.type().wireName());
    }
    final ServerNotification server;
    try {
      server = objectMapper.treeToValue(message.data(), ServerNotification.class);
    } catch (JsonProcessingException ex) {
      throw new PushMessagePermanentException("push notification data is invalid", ex);
    }
    if (server.id() == null || server.appName() == null) {
      throw new PushMessagePermanentException("push notification has no id or app name");
    }
    return server;
  }
}
