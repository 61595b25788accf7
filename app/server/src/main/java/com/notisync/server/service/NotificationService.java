/*
 * Where: server service layer
 * What: idempotent create, batch create and status updates on the server copy
 * Why: devices retry freely, so every write has to be safe to repeat
 */
package com.notisync.server.service;

import com.notisync.common.api.BatchCreateResponse;
import com.notisync.common.api.NotificationPayload;
import com.notisync.common.api.PushMessageType;
import com.notisync.common.api.ServerNotification;
import com.notisync.common.api.StatusUpdateRequest;
import com.notisync.common.model.StatusAction;
import com.notisync.common.rules.InvalidRuleException;
import com.notisync.server.config.ServerApiProperties;
import com.notisync.server.model.CreateOutcome;
import com.notisync.server.model.StatusUpdateOutcome;
import com.notisync.server.repository.ServerNotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class NotificationService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

  private final ServerNotificationRepository notificationRepository;
  private final RuleAuthority ruleAuthority;
  private final NotificationValidator validator;
  private final NotificationPublisher publisher;
  private final ServerMetrics metrics;
  private final ServerApiProperties properties;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public CreateOutcome create(String userId, String deviceId, NotificationPayload payload) {
    validator.validate(payload);
    final CreateOutcome outcome =
        Objects.requireNonNull(
            transactionTemplate.execute(status -> createInTransaction(userId, deviceId, payload)));
    if (outcome.created()) {
      publisher.publish(userId, PushMessageType.NOTIFICATION_NEW, outcome.notification());
    }
    return outcome;
  }

  /** Items are stored independently; an invalid item is reported and does not fail the batch. */
  public BatchCreateResponse createBatch(
      String userId, String deviceId, List<NotificationPayload> payloads) {
    if (payloads == null) {
      throw new InvalidNotificationException("notifications are required");
    }
    if (payloads.size() > properties.maxBatchSize()) {
      throw new BatchTooLargeException(payloads.size(), properties.maxBatchSize());
    }
    final List<BatchCreateResponse.ItemResult> results = new ArrayList<>(payloads.size());
    for (NotificationPayload payload : payloads) {
      final String clientId = payload == null ? null : payload.clientId();
      try {
        final ServerNotification stored = create(userId, deviceId, payload).notification();
        results.add(
            BatchCreateResponse.ItemResult.accepted(clientId, stored.id(), stored.updatedAt()));
      } catch (InvalidNotificationException | InvalidRuleException ex) {
        metrics.recordNotification("rejected");
        logger.warn(
            "batch item rejected userId={} clientId={} reason={}",
            userId,
            clientId,
            ex.getMessage());
        results.add(BatchCreateResponse.ItemResult.rejected(clientId, ex.getMessage()));
      }
    }
    logger.info(
        "batch create completed userId={} deviceId={} size={} accepted={}",
        userId,
        deviceId,
        payloads.size(),
        results.stream().filter(BatchCreateResponse.ItemResult::accepted).count());
    return new BatchCreateResponse(results);
  }

  /**
   * A {@code clientUpdatedAt} older than the server copy is a conflict and changes nothing. A
   * missing {@code clientUpdatedAt} never conflicts.
   */
  public StatusUpdateOutcome updateStatus(String userId, String id, StatusUpdateRequest request) {
    if (request == null || request.action() == null) {
      throw new IllegalArgumentException("action is required");
    }
    final StatusUpdateOutcome outcome =
        Objects.requireNonNull(
            transactionTemplate.execute(status -> updateInTransaction(userId, id, request)));
    metrics.recordStatusUpdate(outcome.status().name().toLowerCase(Locale.ROOT));
    if (outcome.status() == StatusUpdateOutcome.Status.APPLIED) {
      publisher.publish(userId, PushMessageType.NOTIFICATION_UPDATE, outcome.notification());
    }
    return outcome;
  }

  public List<ServerNotification> list(String userId) {
    return notificationRepository.findByUser(userId, properties.listLimit());
  }

  private CreateOutcome createInTransaction(
      String userId, String deviceId, NotificationPayload payload) {
    final Optional<ServerNotification> existing =
        notificationRepository.findByClientId(userId, payload.clientId());
    if (existing.isPresent()) {
      metrics.recordNotification("deduplicated");
      logger.debug(
          "duplicate create ignored userId={} clientId={} id={}",
          userId,
          payload.clientId(),
          existing.get().id());
      return new CreateOutcome(existing.get(), false);
    }
    final Instant now = Instant.now(clock);
    final RuleAuthority.Verdict verdict = ruleAuthority.judge(userId, payload, now);
    final ServerNotification candidate =
        new ServerNotification(
            UUID.randomUUID().toString(),
            payload.clientId(),
            deviceId,
            payload.appName(),
            payload.packageName(),
            payload.title() == null ? "" : payload.title(),
            payload.body() == null ? "" : payload.body(),
            verdict.category(),
            verdict.priority(),
            payload.timestamp() == null ? now : payload.timestamp(),
            verdict.extras(),
            verdict.read(),
            verdict.dismissed(),
            now);
    final Optional<ServerNotification> inserted =
        notificationRepository.insertIfAbsent(userId, candidate, now);
    if (inserted.isEmpty()) {
      // a concurrent request with the same client id won the insert
      metrics.recordNotification("deduplicated");
      return new CreateOutcome(
          notificationRepository
              .findByClientId(userId, payload.clientId())
              .orElseThrow(() -> new IllegalStateException("deduplicated row is missing")),
          false);
    }
    metrics.recordNotification(verdict.blocked() ? "blocked" : "created");
    logger.info(
        "notification created userId={} deviceId={} clientId={} id={} category={} blocked={}",
        userId,
        deviceId,
        payload.clientId(),
        inserted.get().id(),
        verdict.category().wireName(),
        verdict.blocked());
    return new CreateOutcome(inserted.get(), true);
  }

  private StatusUpdateOutcome updateInTransaction(
      String userId, String id, StatusUpdateRequest request) {
    final ServerNotification current =
        notificationRepository
            .findById(userId, id)
            .orElseThrow(() -> new NotificationNotFoundException(id));
    if (request.clientUpdatedAt() != null
        && current.updatedAt().isAfter(request.clientUpdatedAt())) {
      logger.info(
          "status update conflict userId={} id={} action={} serverUpdatedAt={} clientUpdatedAt={}",
          userId,
          id,
          request.action().wireName(),
          current.updatedAt(),
          request.clientUpdatedAt());
      return StatusUpdateOutcome.conflict(current);
    }
    final boolean read = current.isRead() || request.action() != StatusAction.DISMISS;
    final boolean dismissed = current.isDismissed() || request.action() == StatusAction.DISMISS;
    if (read == current.isRead() && dismissed == current.isDismissed()) {
      return StatusUpdateOutcome.unchanged(current);
    }
    final Instant now = Instant.now(clock);
    // keep updated_at strictly increasing so conflict checks see every change
    final Instant updatedAt =
        now.isAfter(current.updatedAt()) ? now : current.updatedAt().plusMillis(1);
    final ServerNotification updated =
        notificationRepository
            .updateFlags(userId, id, read, dismissed, updatedAt)
            .orElseThrow(() -> new NotificationNotFoundException(id));
    return StatusUpdateOutcome.applied(updated);
  }
}
