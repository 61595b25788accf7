package com.notisync.common.rules;

import java.util.Locale;

/** Each type admits exactly one {@link RuleConditions} variant. */
public enum RuleType {
  APP_FILTER("app_filter"),
  KEYWORD_FILTER("keyword_filter"),
  TIME_BASED("time_based"),
  OTP_ALWAYS("otp_always"),
  PROMO_MUTE("promo_mute"),
  CUSTOM("custom");

  private final String wireName;

  RuleType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static RuleType fromWireName(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidRuleException("rule type is required");
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (RuleType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    throw new InvalidRuleException("unknown rule type: " + value);
  }
}
