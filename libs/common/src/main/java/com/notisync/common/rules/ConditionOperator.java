package com.notisync.common.rules;

public enum ConditionOperator {
  EQUALS("equals"),
  NOT_EQUALS("notEquals"),
  CONTAINS("contains"),
  NOT_CONTAINS("notContains"),
  STARTS_WITH("startsWith"),
  ENDS_WITH("endsWith"),
  REGEX("regex"),
  GREATER_THAN("greaterThan"),
  LESS_THAN("lessThan"),
  GREATER_THAN_OR_EQUAL("greaterThanOrEqual"),
  LESS_THAN_OR_EQUAL("lessThanOrEqual"),
  IN("in"),
  NOT_IN("notIn"),
  EXISTS("exists"),
  NOT_EXISTS("notExists");

  private final String wireName;

  ConditionOperator(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public boolean isSetOperator() {
    return this == IN || this == NOT_IN;
  }

  public boolean isExistenceCheck() {
    return this == EXISTS || this == NOT_EXISTS;
  }

  public boolean isNumeric() {
    return this == GREATER_THAN
        || this == LESS_THAN
        || this == GREATER_THAN_OR_EQUAL
        || this == LESS_THAN_OR_EQUAL;
  }

  public static ConditionOperator fromWireName(String value) {
    for (ConditionOperator operator : values()) {
      if (operator.wireName.equals(value)) {
        return operator;
      }
    }
    throw new InvalidRuleException("unknown condition operator: " + value);
  }
}
