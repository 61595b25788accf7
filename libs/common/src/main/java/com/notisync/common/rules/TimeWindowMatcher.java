package com.notisync.common.rules;

import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/** Evaluates against the record timestamp, so replays of the same record are deterministic. */
public class TimeWindowMatcher implements ConditionMatcher {

  @Override
  public RuleType getSupportedRuleType() {
    return RuleType.TIME_BASED;
  }

  @Override
  public boolean matches(RuleConditions conditions, RuleTarget target) {
    final TimeBasedConditions window = (TimeBasedConditions) conditions;
    if (target.timestamp() == null) {
      return false;
    }
    final ZonedDateTime local =
        target.timestamp().atZone(window.timezone() == null ? ZoneOffset.UTC : window.timezone());
    if (!window.weekdays().isEmpty()) {
      final int weekday = local.getDayOfWeek().getValue() % 7;
      if (!window.weekdays().contains(weekday)) {
        return false;
      }
    }
    if (window.startTime() != null
        && !isWithin(local.toLocalTime().truncatedTo(ChronoUnit.MINUTES), window)) {
      return false;
    }
    return window.dateRanges().isEmpty() || window.dateRanges().contains(local.toLocalDate());
  }

  static boolean isWithin(LocalTime time, TimeBasedConditions window) {
    final LocalTime start = window.startTime();
    final LocalTime end = window.endTime();
    if (!start.isAfter(end)) {
      return !time.isBefore(start) && !time.isAfter(end);
    }
    // crosses midnight, e.g. 22:00-06:00
    return !time.isBefore(start) || !time.isAfter(end);
  }
}
