package com.notisync.common.rules;

public class PromoMatcher implements ConditionMatcher {

  @Override
  public RuleType getSupportedRuleType() {
    return RuleType.PROMO_MUTE;
  }

  @Override
  public boolean matches(RuleConditions conditions, RuleTarget target) {
    final PromoMuteConditions promo = (PromoMuteConditions) conditions;
    return TextHeuristics.looksPromotional(target.text(), promo.effectiveKeywords());
  }
}
