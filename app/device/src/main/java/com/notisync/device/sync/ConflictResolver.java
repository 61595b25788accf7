/*
 * Where: device sync layer
 * What: reconciles a local record with a newer server copy using the configured strategy
 * Why: devices update the same notification without any cross-device lock
 */
package com.notisync.device.sync;

import com.notisync.common.api.ServerNotification;
import com.notisync.device.config.SyncProperties;
import com.notisync.device.model.ConflictResolution;
import com.notisync.device.model.ConflictStrategy;
import com.notisync.device.model.NotificationRecord;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * The resolved record depends only on the two versions and the strategy. Every strategy marks the
 * record synced against the server copy it saw.
 */
@Component
@RequiredArgsConstructor
public class ConflictResolver {

  private final SyncProperties properties;
  private final Clock clock;
  private final Deque<ConflictResolution> history = new ArrayDeque<>();

  public ConflictResolution resolve(
      NotificationRecord local, ServerNotification server, ConflictStrategy strategy) {
    final NotificationRecord resolved = resolvedVersion(local, server, strategy);
    final ConflictResolution resolution =
        new ConflictResolution(local.id(), local, server, strategy, resolved, Instant.now(clock));
    synchronized (history) {
      history.addLast(resolution);
      while (history.size() > properties.resolutionHistoryCapacity()) {
        history.removeFirst();
      }
    }
    return resolution;
  }

  public List<ConflictResolution> recentResolutions() {
    synchronized (history) {
      return new ArrayList<>(history);
    }
  }

  static NotificationRecord resolvedVersion(
      NotificationRecord local, ServerNotification server, ConflictStrategy strategy) {
    return switch (strategy) {
      case CLIENT_WINS -> clientWins(local, server);
      case SERVER_WINS -> serverWins(local, server);
      case TIMESTAMP_BASED ->
          localIsNewer(local, server) ? clientWins(local, server) : serverWins(local, server);
      case MERGE -> merge(local, server);
    };
  }

  private static boolean localIsNewer(NotificationRecord local, ServerNotification server) {
    if (local.updatedAt() == null) {
      return false;
    }
    return server.updatedAt() == null || local.updatedAt().isAfter(server.updatedAt());
  }

  private static NotificationRecord clientWins(
      NotificationRecord local, ServerNotification server) {
    return build(
        local, server, local.title(), local.body(), local, local.read(), local.dismissed());
  }

  private static NotificationRecord serverWins(
      NotificationRecord local, ServerNotification server) {
    return build(
        local,
        server,
        orLocal(server.title(), local.title()),
        orLocal(server.body(), local.body()),
        null,
        server.isRead(),
        server.isDismissed());
  }

  // user-action flags originate on the device; content is the server's
  private static NotificationRecord merge(NotificationRecord local, ServerNotification server) {
    return build(
        local,
        server,
        orLocal(server.title(), local.title()),
        orLocal(server.body(), local.body()),
        null,
        local.read(),
        local.dismissed());
  }

  /** {@code classificationSource} non-null keeps its category and priority over the server's. */
  private static NotificationRecord build(
      NotificationRecord local,
      ServerNotification server,
      String title,
      String body,
      NotificationRecord classificationSource,
      boolean read,
      boolean dismissed) {
    final boolean keepLocal = classificationSource != null;
    return new NotificationRecord(
        local.id(),
        server.id(),
        local.appIdentity(),
        title,
        body,
        keepLocal || server.category() == null ? local.category() : server.category(),
        keepLocal ? local.priority() : server.priority(),
        local.timestamp(),
        local.sourceId(),
        local.extras(),
        true,
        local.syncAttempts(),
        local.lastSyncAttempt(),
        read,
        dismissed,
        later(local.updatedAt(), server.updatedAt()),
        server.updatedAt());
  }

  private static String orLocal(String serverValue, String localValue) {
    return serverValue == null ? localValue : serverValue;
  }

  private static Instant later(Instant a, Instant b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return a.isAfter(b) ? a : b;
  }
}
