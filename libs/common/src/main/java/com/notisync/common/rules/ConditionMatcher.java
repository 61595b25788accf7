package com.notisync.common.rules;

/** Matching strategy for one {@link RuleType}, registered in {@link RuleEvaluator}. */
public interface ConditionMatcher {

  RuleType getSupportedRuleType();

  boolean matches(RuleConditions conditions, RuleTarget target);
}
