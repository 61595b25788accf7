package com.notisync.common.rules;

public class OtpMatcher implements ConditionMatcher {

  @Override
  public RuleType getSupportedRuleType() {
    return RuleType.OTP_ALWAYS;
  }

  @Override
  public boolean matches(RuleConditions conditions, RuleTarget target) {
    return TextHeuristics.looksLikeOtp(target.text());
  }
}
