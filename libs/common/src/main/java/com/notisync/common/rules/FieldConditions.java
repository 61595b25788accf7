package com.notisync.common.rules;

import java.util.List;

/** Field/operator conditions combined with AND. */
public record FieldConditions(List<FieldCondition> all) implements RuleConditions {

  public FieldConditions {
    all = all == null ? List.of() : List.copyOf(all);
    if (all.isEmpty()) {
      throw new InvalidRuleException("custom rule requires at least one condition");
    }
  }

  @Override
  public RuleType ruleType() {
    return RuleType.CUSTOM;
  }
}
