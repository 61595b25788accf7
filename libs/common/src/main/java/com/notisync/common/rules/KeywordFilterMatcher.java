package com.notisync.common.rules;

import java.util.Locale;

public class KeywordFilterMatcher implements ConditionMatcher {

  @Override
  public RuleType getSupportedRuleType() {
    return RuleType.KEYWORD_FILTER;
  }

  @Override
  public boolean matches(RuleConditions conditions, RuleTarget target) {
    final KeywordFilterConditions keywordFilter = (KeywordFilterConditions) conditions;
    final StringBuilder searchText = new StringBuilder();
    if (keywordFilter.matchTitle()) {
      searchText.append(target.title()).append(' ');
    }
    if (keywordFilter.matchBody()) {
      searchText.append(target.body()).append(' ');
    }
    final String text = fold(searchText.toString(), keywordFilter.caseSensitive());
    // exclusions win over inclusions
    for (String excluded : keywordFilter.excludeKeywords()) {
      if (text.contains(fold(excluded, keywordFilter.caseSensitive()))) {
        return false;
      }
    }
    for (String keyword : keywordFilter.keywords()) {
      if (text.contains(fold(keyword, keywordFilter.caseSensitive()))) {
        return true;
      }
    }
    return false;
  }

  private String fold(String value, boolean caseSensitive) {
    return caseSensitive ? value : value.toLowerCase(Locale.ROOT);
  }
}
