/*
 * Where: server service layer
 * What: re-evaluates every accepted notification against the user's rules
 * Why: the server copy is authoritative, so its classification wins over the device's
 */
package com.notisync.server.service;

import com.google.common.annotations.VisibleForTesting;
import com.notisync.common.api.NotificationPayload;
import com.notisync.common.model.NotificationCategory;
import com.notisync.common.model.Priorities;
import com.notisync.common.rules.RuleApplication;
import com.notisync.common.rules.RuleEvaluation;
import com.notisync.common.rules.RuleEvaluator;
import com.notisync.common.rules.RuleTarget;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RuleAuthority {

  private static final Logger logger = LoggerFactory.getLogger(RuleAuthority.class);

  private final UserRuleService ruleService;
  private final RuleEvaluator ruleEvaluator;

  /**
   * Only category, priority, read, dismissed and tags are taken from the evaluation. Title and
   * body stay as captured. A blocked notification is still stored, dismissed.
   */
  public Verdict judge(String userId, NotificationPayload payload, Instant now) {
    final RuleEvaluation evaluation =
        ruleEvaluator.evaluate(toTarget(payload, now), ruleService.rules(userId));
    final RuleTarget result = evaluation.result();
    if (!evaluation.matched().isEmpty()) {
      logger.debug(
          "authority rules matched userId={} clientId={} rules={} blocked={}",
          userId,
          payload.clientId(),
          evaluation.matched().stream().map(RuleApplication::ruleId).toList(),
          evaluation.blocked());
    }
    return new Verdict(
        result.category(),
        result.priority(),
        result.read(),
        result.dismissed() || evaluation.blocked(),
        result.extras(),
        evaluation.blocked());
  }

  @VisibleForTesting
  static RuleTarget toTarget(NotificationPayload payload, Instant now) {
    final Map<String, Object> extras = payload.extras() == null ? Map.of() : payload.extras();
    return new RuleTarget(
        payload.appName(),
        payload.packageName(),
        payload.title(),
        payload.body(),
        payload.category(),
        payload.priority() == null ? Priorities.DEFAULT : payload.priority(),
        payload.timestamp() == null ? now : payload.timestamp(),
        extras,
        tags(extras),
        payload.isRead(),
        payload.isDismissed());
  }

  private static List<String> tags(Map<String, Object> extras) {
    if (extras.get("tags") instanceof List<?> rawTags) {
      return rawTags.stream().map(String::valueOf).toList();
    }
    return List.of();
  }

  public record Verdict(
      NotificationCategory category,
      int priority,
      boolean read,
      boolean dismissed,
      Map<String, Object> extras,
      boolean blocked) {}
}
