package com.notisync.common.rules;

import java.time.Instant;
import java.util.List;

/**
 * Immutable rule definition. Higher {@code priority} is evaluated first; changes go through
 * {@link #update} which bumps {@code updatedAt}.
 */
public record Rule(
    String id,
    String name,
    RuleType type,
    int priority,
    boolean enabled,
    RuleConditions conditions,
    List<RuleAction> actions,
    Instant createdAt,
    Instant updatedAt) {

  public Rule {
    if (id == null || id.isBlank()) {
      throw new InvalidRuleException("rule id is required");
    }
    if (name == null || name.isBlank()) {
      throw new InvalidRuleException("rule name is required");
    }
    if (type == null) {
      throw new InvalidRuleException("rule type is required");
    }
    if (conditions == null || conditions.ruleType() != type) {
      throw new InvalidRuleException(
          "conditions do not match rule type " + type.wireName() + " for rule " + id);
    }
    actions = actions == null ? List.of() : List.copyOf(actions);
    if (actions.isEmpty()) {
      throw new InvalidRuleException("rule requires at least one action");
    }
  }

  public boolean blocks() {
    return actions.stream().anyMatch(RuleAction.Block.class::isInstance);
  }

  public Rule update(
      String newName,
      Integer newPriority,
      Boolean newEnabled,
      RuleConditions newConditions,
      List<RuleAction> newActions,
      Instant now) {
    return new Rule(
        id,
        newName == null ? name : newName,
        type,
        newPriority == null ? priority : newPriority,
        newEnabled == null ? enabled : newEnabled,
        newConditions == null ? conditions : newConditions,
        newActions == null ? actions : newActions,
        createdAt,
        now);
  }
}
