package com.notisync.common.rules;

import java.util.List;

public record RuleApplication(
    String ruleId, String ruleName, int rulePriority, List<RuleAction> actions) {

  public RuleApplication {
    actions = List.copyOf(actions);
  }
}
