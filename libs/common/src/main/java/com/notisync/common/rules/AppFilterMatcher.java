package com.notisync.common.rules;

public class AppFilterMatcher implements ConditionMatcher {

  @Override
  public RuleType getSupportedRuleType() {
    return RuleType.APP_FILTER;
  }

  @Override
  public boolean matches(RuleConditions conditions, RuleTarget target) {
    final AppFilterConditions appFilter = (AppFilterConditions) conditions;
    for (String excluded : appFilter.excludeApps()) {
      if (identifies(excluded, target)) {
        return false;
      }
    }
    for (String included : appFilter.appNames()) {
      if (identifies(included, target)) {
        return true;
      }
    }
    return false;
  }

  private boolean identifies(String name, RuleTarget target) {
    return name.equalsIgnoreCase(target.appIdentity()) || name.equalsIgnoreCase(target.sourceId());
  }
}
