package com.notisync.common.rules;

import java.util.List;

/** Matches when the app identity or source id is listed and not excluded. Case-insensitive. */
public record AppFilterConditions(List<String> appNames, List<String> excludeApps)
    implements RuleConditions {

  public AppFilterConditions {
    appNames = appNames == null ? List.of() : List.copyOf(appNames);
    excludeApps = excludeApps == null ? List.of() : List.copyOf(excludeApps);
    if (appNames.isEmpty()) {
      throw new InvalidRuleException("app_filter requires at least one app name");
    }
  }

  @Override
  public RuleType ruleType() {
    return RuleType.APP_FILTER;
  }
}
