package com.notisync.common.rules;

import java.util.List;

public record KeywordFilterConditions(
    List<String> keywords,
    List<String> excludeKeywords,
    boolean caseSensitive,
    boolean matchTitle,
    boolean matchBody)
    implements RuleConditions {

  public KeywordFilterConditions {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
    excludeKeywords = excludeKeywords == null ? List.of() : List.copyOf(excludeKeywords);
    if (keywords.isEmpty()) {
      throw new InvalidRuleException("keyword_filter requires at least one keyword");
    }
    if (!matchTitle && !matchBody) {
      throw new InvalidRuleException("keyword_filter must match title, body or both");
    }
  }

  @Override
  public RuleType ruleType() {
    return RuleType.KEYWORD_FILTER;
  }
}
