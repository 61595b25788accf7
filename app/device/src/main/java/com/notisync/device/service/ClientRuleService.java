/*
 * Where: device rule management
 * What: owns the device rule set, seeds defaults and runs the shared evaluator on records
 * Why: rules must apply offline, before anything reaches the server
 */
package com.notisync.device.service;

import com.notisync.common.rules.DefaultRules;
import com.notisync.common.rules.Rule;
import com.notisync.common.rules.RuleAction;
import com.notisync.common.rules.RuleApplication;
import com.notisync.common.rules.RuleCodec;
import com.notisync.common.rules.RuleConditions;
import com.notisync.common.rules.RuleDocument;
import com.notisync.common.rules.RuleEvaluation;
import com.notisync.common.rules.RuleEvaluator;
import com.notisync.common.rules.RuleTarget;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.RuleTriggerStats;
import com.notisync.device.repository.DeviceRuleRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ClientRuleService {

  private static final Logger logger = LoggerFactory.getLogger(ClientRuleService.class);

  private final DeviceRuleRepository ruleRepository;
  private final RuleEvaluator ruleEvaluator;
  private final RuleCodec ruleCodec;
  private final Clock clock;

  private volatile List<Rule> cachedRules;

  public RuleEvaluation evaluate(NotificationRecord record) {
    final RuleEvaluation evaluation = ruleEvaluator.evaluate(toTarget(record), rules());
    if (!evaluation.matched().isEmpty()) {
      try {
        ruleRepository.recordTriggers(
            evaluation.matched().stream().map(RuleApplication::ruleId).toList(),
            Instant.now(clock));
      } catch (RuntimeException ex) {
        // statistics only; the evaluation result stands
        logger.warn("rule trigger stats not recorded notificationId={}", record.id(), ex);
      }
    }
    return evaluation;
  }

  public List<Rule> rules() {
    List<Rule> rules = cachedRules;
    if (rules == null) {
      rules = loadRules();
      cachedRules = rules;
    }
    return rules;
  }

  public Rule getRule(String id) {
    return ruleRepository.findById(id).orElseThrow(() -> new RuleNotFoundException(id));
  }

  public Rule createRule(RuleDocument document) {
    final Instant now = Instant.now(clock);
    final String id = document.id() == null || document.id().isBlank()
        ? UUID.randomUUID().toString()
        : document.id();
    final Rule rule =
        ruleCodec.decode(
            new RuleDocument(
                id,
                document.name(),
                document.type(),
                document.priority(),
                document.enabled(),
                document.conditions(),
                document.actions(),
                document.schemaVersion(),
                now,
                now));
    ruleRepository.save(rule);
    invalidate();
    logger.info("rule created ruleId={} type={}", rule.id(), rule.type().wireName());
    return rule;
  }

  /** Only fields present in {@code changes} are applied; the rule type never changes. */
  public Rule updateRule(String id, RuleDocument changes) {
    final Rule existing = getRule(id);
    final RuleConditions conditions =
        changes.conditions() == null
            ? null
            : ruleCodec.decodeConditions(existing.type(), changes.conditions());
    final List<RuleAction> actions =
        changes.actions() == null ? null : ruleCodec.decodeActions(changes.actions());
    final Rule updated =
        existing.update(
            changes.name(),
            changes.priority(),
            changes.enabled(),
            conditions,
            actions,
            Instant.now(clock));
    ruleRepository.save(updated);
    invalidate();
    return updated;
  }

  public void deleteRule(String id) {
    if (!ruleRepository.delete(id)) {
      throw new RuleNotFoundException(id);
    }
    invalidate();
  }

  public List<RuleTriggerStats> triggerStats() {
    return ruleRepository.findTriggerStats();
  }

  public RuleDocument toDocument(Rule rule) {
    return ruleCodec.encode(rule);
  }

  static RuleTarget toTarget(NotificationRecord record) {
    return new RuleTarget(
        record.appIdentity(),
        record.sourceId(),
        record.title(),
        record.body(),
        record.category(),
        record.priority(),
        record.timestamp(),
        record.extras(),
        record.tags(),
        record.read(),
        record.dismissed());
  }

  private List<Rule> loadRules() {
    if (ruleRepository.count() == 0) {
      final List<Rule> defaults = DefaultRules.create(Instant.now(clock));
      defaults.forEach(ruleRepository::save);
      logger.info("default rules seeded count={}", defaults.size());
    }
    return List.copyOf(ruleRepository.findAll());
  }

  private void invalidate() {
    cachedRules = null;
  }
}
