package com.notisync.common.rules;

import java.util.List;
import java.util.Set;

public record RuleEvaluation(
    RuleTarget result, List<RuleApplication> matched, boolean blocked, Set<MutableField> assigned) {

  public RuleEvaluation {
    matched = List.copyOf(matched);
    assigned = Set.copyOf(assigned);
  }

  public boolean categoryAssigned() {
    return assigned.contains(MutableField.CATEGORY);
  }

  public boolean priorityAssigned() {
    return assigned.contains(MutableField.PRIORITY);
  }
}
