package com.notisync.common.rules;

import java.util.List;

/** Empty keyword list means {@link TextHeuristics#PROMOTIONAL_KEYWORDS}. */
public record PromoMuteConditions(List<String> keywords) implements RuleConditions {

  public PromoMuteConditions {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }

  public List<String> effectiveKeywords() {
    return keywords.isEmpty() ? TextHeuristics.PROMOTIONAL_KEYWORDS : keywords;
  }

  @Override
  public RuleType ruleType() {
    return RuleType.PROMO_MUTE;
  }
}
