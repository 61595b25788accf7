package com.notisync.common.rules;

public enum RuleField {
  APP_IDENTITY("appName"),
  SOURCE_ID("packageName"),
  TITLE("title"),
  BODY("body"),
  CATEGORY("category"),
  PRIORITY("priority"),
  TIMESTAMP("timestamp"),
  EXTRAS("extras");

  private final String wireName;

  RuleField(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static RuleField fromWireName(String value) {
    for (RuleField field : values()) {
      if (field.wireName.equals(value)) {
        return field;
      }
    }
    throw new InvalidRuleException("unknown condition field: " + value);
  }
}
