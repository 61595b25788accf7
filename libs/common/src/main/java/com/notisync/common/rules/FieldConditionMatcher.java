package com.notisync.common.rules;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;

/** AND over {@link FieldConditions#all()}. */
public class FieldConditionMatcher implements ConditionMatcher {

  private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

  @Override
  public RuleType getSupportedRuleType() {
    return RuleType.CUSTOM;
  }

  @Override
  public boolean matches(RuleConditions conditions, RuleTarget target) {
    for (FieldCondition condition : ((FieldConditions) conditions).all()) {
      if (!matches(condition, target)) {
        return false;
      }
    }
    return true;
  }

  boolean matches(FieldCondition condition, RuleTarget target) {
    final String fieldValue = readField(condition, target);
    if (fieldValue == null) {
      // negate does not apply to a missing value
      return condition.operator() == ConditionOperator.NOT_EXISTS;
    }
    final boolean result = test(condition, fieldValue);
    return condition.negate() != result;
  }

  private boolean test(FieldCondition condition, String fieldValue) {
    final boolean caseSensitive = condition.caseSensitive();
    final String actual = fold(fieldValue, caseSensitive);
    final String expected =
        condition.value() == null ? null : fold(condition.value(), caseSensitive);
    return switch (condition.operator()) {
      case EQUALS -> actual.equals(expected);
      case NOT_EQUALS -> !actual.equals(expected);
      case CONTAINS -> actual.contains(expected);
      case NOT_CONTAINS -> !actual.contains(expected);
      case STARTS_WITH -> actual.startsWith(expected);
      case ENDS_WITH -> actual.endsWith(expected);
      case REGEX -> pattern(condition.value(), caseSensitive).matcher(fieldValue).find();
      case GREATER_THAN -> compare(fieldValue, condition.value(), result -> result > 0);
      case LESS_THAN -> compare(fieldValue, condition.value(), result -> result < 0);
      case GREATER_THAN_OR_EQUAL -> compare(fieldValue, condition.value(), result -> result >= 0);
      case LESS_THAN_OR_EQUAL -> compare(fieldValue, condition.value(), result -> result <= 0);
      case IN -> containsFolded(condition, actual);
      case NOT_IN -> !containsFolded(condition, actual);
      case EXISTS -> true;
      case NOT_EXISTS -> false;
    };
  }

  private String readField(FieldCondition condition, RuleTarget target) {
    return switch (condition.field()) {
      case APP_IDENTITY -> target.appIdentity();
      case SOURCE_ID -> target.sourceId();
      case TITLE -> target.title();
      case BODY -> target.body();
      case CATEGORY -> target.category().wireName();
      case PRIORITY -> String.valueOf(target.priority());
      case TIMESTAMP ->
          target.timestamp() == null ? null : String.valueOf(target.timestamp().toEpochMilli());
      case EXTRAS -> {
        final Object value = target.extras().get(condition.extrasKey());
        yield value == null ? null : value.toString();
      }
    };
  }

  private boolean containsFolded(FieldCondition condition, String actual) {
    for (String candidate : condition.values()) {
      if (fold(candidate, condition.caseSensitive()).equals(actual)) {
        return true;
      }
    }
    return false;
  }

  /** A non-numeric operand on either side never satisfies a comparison. */
  private boolean compare(String actual, String expected, IntPredicate accept) {
    final double left = toNumber(actual);
    final double right = toNumber(expected);
    if (Double.isNaN(left) || Double.isNaN(right)) {
      return false;
    }
    return accept.test(Double.compare(left, right));
  }

  private double toNumber(String value) {
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException ex) {
      try {
        return Instant.parse(value.trim()).toEpochMilli();
      } catch (DateTimeParseException ignored) {
        return Double.NaN;
      }
    }
  }

  private Pattern pattern(String regex, boolean caseSensitive) {
    final String key = (caseSensitive ? "s:" : "i:") + regex;
    return patternCache.computeIfAbsent(
        key,
        ignored -> Pattern.compile(regex, caseSensitive ? 0 : Pattern.CASE_INSENSITIVE));
  }

  private String fold(String value, boolean caseSensitive) {
    return caseSensitive ? value : value.toLowerCase(Locale.ROOT);
  }
}
