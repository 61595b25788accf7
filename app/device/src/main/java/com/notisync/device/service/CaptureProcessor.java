/*
 * Where: device capture pipeline
 * What: queues normalized captures and drains them through dedup, rules and classification
 * Why: the listener must return immediately, and one bad capture must not stall the rest
 */
package com.notisync.device.service;

import com.notisync.common.model.NotificationCategory;
import com.notisync.common.rules.RuleEvaluation;
import com.notisync.common.rules.RuleTarget;
import com.notisync.device.config.ProcessingProperties;
import com.notisync.device.model.DeduplicationResult;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.ProcessingError;
import com.notisync.device.model.ProcessingSummary;
import com.notisync.device.model.RawCaptureEvent;
import com.notisync.device.model.SyncOperation;
import com.notisync.device.model.SyncOperationType;
import com.notisync.device.repository.LocalRecordStore;
import com.notisync.device.sync.OperationPayloads;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class CaptureProcessor {

  private static final Logger logger = LoggerFactory.getLogger(CaptureProcessor.class);

  private final CaptureNormalizer normalizer;
  private final Deduplicator deduplicator;
  private final ClientRuleService ruleService;
  private final Classifier classifier;
  private final LocalRecordStore store;
  private final OperationPayloads payloads;
  private final TransactionTemplate transactionTemplate;
  private final ProcessingProperties properties;
  private final DeviceMetrics metrics;
  private final Clock clock;

  private final Queue<NotificationRecord> pending = new ConcurrentLinkedQueue<>();
  private final Deque<ProcessingError> errorLog = new ArrayDeque<>();

  /**
   * Validates and queues a capture.
   *
   * @return the id the record will be stored under
   * @throws InvalidNotificationException when the capture cannot become a record
   */
  public String submit(RawCaptureEvent event) {
    final NotificationRecord record;
    try {
      record = normalizer.normalize(event);
    } catch (InvalidNotificationException ex) {
      metrics.recordCapture("invalid");
      throw ex;
    }
    pending.add(record);
    return record.id();
  }

  public int queueSize() {
    return pending.size();
  }

  /** Drains up to one batch, stopping early once max-processing-time has elapsed. */
  public ProcessingSummary processPending() {
    if (pending.isEmpty()) {
      return ProcessingSummary.empty();
    }
    final Instant deadline = Instant.now(clock).plus(properties.maxProcessingTime());
    int processed = 0;
    int accepted = 0;
    int duplicates = 0;
    int blocked = 0;
    int failed = 0;
    while (processed < properties.batchSize() && Instant.now(clock).isBefore(deadline)) {
      final NotificationRecord record = pending.poll();
      if (record == null) {
        break;
      }
      processed++;
      switch (processOne(record)) {
        case ACCEPTED -> accepted++;
        case DUPLICATE -> duplicates++;
        case BLOCKED -> blocked++;
        case FAILED -> failed++;
      }
    }
    final ProcessingSummary summary =
        new ProcessingSummary(processed, accepted, duplicates, blocked, failed);
    logger.info(
        "capture batch processed processed={} accepted={} duplicates={} blocked={} failed={}"
            + " remaining={}",
        processed,
        accepted,
        duplicates,
        blocked,
        failed,
        pending.size());
    return summary;
  }

  public List<ProcessingError> recentErrors() {
    synchronized (errorLog) {
      return new ArrayList<>(errorLog);
    }
  }

  private Outcome processOne(NotificationRecord record) {
    final NotificationRecord classified;
    try {
      final DeduplicationResult dedup = deduplicator.process(record);
      if (!dedup.capture()) {
        logger.debug("capture dropped recordId={} reason={}", record.id(), dedup.reason());
        metrics.recordCapture("duplicate");
        return Outcome.DUPLICATE;
      }
      final RuleEvaluation evaluation = ruleService.evaluate(record);
      if (evaluation.blocked()) {
        logger.debug("capture blocked recordId={} app={}", record.id(), record.appIdentity());
        metrics.recordCapture("blocked");
        return Outcome.BLOCKED;
      }
      classified = classify(record, evaluation);
    } catch (RuntimeException ex) {
      logger.warn(
          "capture processing failed recordId={} app={}", record.id(), record.appIdentity(), ex);
      remember(record, ex);
      if (!properties.allowOnError()) {
        metrics.recordCapture("error");
        return Outcome.FAILED;
      }
      return persist(record) ? Outcome.ACCEPTED : Outcome.FAILED;
    }
    return persist(classified) ? Outcome.ACCEPTED : Outcome.FAILED;
  }

  private NotificationRecord classify(NotificationRecord record, RuleEvaluation evaluation) {
    final RuleTarget result = evaluation.result();
    NotificationCategory category = result.category();
    if (!evaluation.categoryAssigned() && category == NotificationCategory.PERSONAL) {
      category = classifier.categorize(result.appIdentity(), result.sourceId(), result.text());
    }
    int priority = result.priority();
    if (!evaluation.priorityAssigned()) {
      priority =
          classifier.prioritize(priority, result.appIdentity(), result.text(), record.timestamp());
    }
    return record.withClassification(
        result.title(),
        result.body(),
        category,
        priority,
        result.extras(),
        result.read(),
        result.dismissed());
  }

  private boolean persist(NotificationRecord record) {
    final SyncOperation create =
        SyncOperation.pending(
            UUID.randomUUID().toString(),
            SyncOperationType.CREATE,
            record.id(),
            payloads.createPayload(record),
            Instant.now(clock));
    try {
      transactionTemplate.executeWithoutResult(
          status -> {
            store.saveRecord(record);
            store.enqueueOperation(create);
          });
    } catch (RuntimeException ex) {
      logger.warn("capture not persisted recordId={}", record.id(), ex);
      remember(record, ex);
      metrics.recordCapture("error");
      return false;
    }
    metrics.recordCapture("accepted");
    return true;
  }

  private void remember(NotificationRecord record, RuntimeException ex) {
    synchronized (errorLog) {
      errorLog.addLast(
          new ProcessingError(
              record.id(),
              record.appIdentity(),
              String.valueOf(ex.getMessage()),
              Instant.now(clock)));
      while (errorLog.size() > properties.errorLogCapacity()) {
        errorLog.removeFirst();
      }
    }
  }

  private enum Outcome {
    ACCEPTED,
    DUPLICATE,
    BLOCKED,
    FAILED
  }
}
