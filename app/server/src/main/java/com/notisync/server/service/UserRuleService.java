/*
 * Where: server rule management
 * What: per-user rule CRUD through the shared codec, with default rules seeded on first use
 * Why: the Rule Authority and the rule endpoints must read the same validated rule set
 */
package com.notisync.server.service;

import com.notisync.common.rules.DefaultRules;
import com.notisync.common.rules.Rule;
import com.notisync.common.rules.RuleAction;
import com.notisync.common.rules.RuleCodec;
import com.notisync.common.rules.RuleConditions;
import com.notisync.common.rules.RuleDocument;
import com.notisync.server.repository.UserRuleRepository;
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
public class UserRuleService {

  private static final Logger logger = LoggerFactory.getLogger(UserRuleService.class);

  private final UserRuleRepository ruleRepository;
  private final RuleCodec ruleCodec;
  private final Clock clock;

  public List<Rule> rules(String userId) {
    if (ruleRepository.countByUser(userId) == 0) {
      final List<Rule> defaults = DefaultRules.create(Instant.now(clock));
      defaults.forEach(rule -> ruleRepository.save(userId, rule));
      logger.info("default rules seeded userId={} count={}", userId, defaults.size());
    }
    return ruleRepository.findByUser(userId);
  }

  public Rule createRule(String userId, RuleDocument document) {
    final Instant now = Instant.now(clock);
    final String id =
        document.id() == null || document.id().isBlank()
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
    ruleRepository.save(userId, rule);
    logger.info("rule created userId={} ruleId={} type={}", userId, id, rule.type().wireName());
    return rule;
  }

  /** Fields missing from {@code changes} keep their stored value; the type is fixed. */
  public Rule updateRule(String userId, String id, RuleDocument changes) {
    final Rule existing =
        ruleRepository.findById(userId, id).orElseThrow(() -> new RuleNotFoundException(id));
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
    ruleRepository.save(userId, updated);
    return updated;
  }

  public void deleteRule(String userId, String id) {
    if (!ruleRepository.delete(userId, id)) {
      throw new RuleNotFoundException(id);
    }
    logger.info("rule deleted userId={} ruleId={}", userId, id);
  }

  public RuleDocument toDocument(Rule rule) {
    return ruleCodec.encode(rule);
  }
}
