package com.notisync.common.rules;

/** No parameters: matching is delegated to {@link TextHeuristics#looksLikeOtp(String)}. */
public record OtpAlwaysConditions() implements RuleConditions {

  @Override
  public RuleType ruleType() {
    return RuleType.OTP_ALWAYS;
  }
}
