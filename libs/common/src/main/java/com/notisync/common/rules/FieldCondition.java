package com.notisync.common.rules;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One field test. {@code extrasKey} is only used with {@link RuleField#EXTRAS}; {@code values}
 * only with set operators; existence checks carry no operand.
 */
public record FieldCondition(
    RuleField field,
    String extrasKey,
    ConditionOperator operator,
    String value,
    List<String> values,
    boolean caseSensitive,
    boolean negate) {

  public FieldCondition {
    if (field == null) {
      throw new InvalidRuleException("condition field is required");
    }
    if (operator == null) {
      throw new InvalidRuleException("condition operator is required");
    }
    if (field == RuleField.EXTRAS && (extrasKey == null || extrasKey.isBlank())) {
      throw new InvalidRuleException("extras condition requires a key");
    }
    values = values == null ? List.of() : List.copyOf(values);
    if (operator.isSetOperator() && values.isEmpty()) {
      throw new InvalidRuleException(operator.wireName() + " requires a list of values");
    }
    if (!operator.isSetOperator() && !operator.isExistenceCheck() && value == null) {
      throw new InvalidRuleException(operator.wireName() + " requires a value");
    }
    if (operator == ConditionOperator.REGEX) {
      try {
        Pattern.compile(value);
      } catch (PatternSyntaxException ex) {
        throw new InvalidRuleException("invalid regex: " + value, ex);
      }
    }
  }

  public static FieldCondition of(RuleField field, ConditionOperator operator, String value) {
    return new FieldCondition(field, null, operator, value, List.of(), false, false);
  }

  public static FieldCondition in(RuleField field, List<String> values) {
    return new FieldCondition(field, null, ConditionOperator.IN, null, values, false, false);
  }
}
