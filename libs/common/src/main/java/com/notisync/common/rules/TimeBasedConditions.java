package com.notisync.common.rules;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Time window evaluated against the record timestamp. {@code start > end} wraps past midnight.
 * Weekdays use 0 for Sunday through 6 for Saturday.
 */
public record TimeBasedConditions(
    LocalTime startTime,
    LocalTime endTime,
    List<Integer> weekdays,
    ZoneId timezone,
    List<LocalDate> dateRanges)
    implements RuleConditions {

  public TimeBasedConditions {
    weekdays = weekdays == null ? List.of() : List.copyOf(weekdays);
    dateRanges = dateRanges == null ? List.of() : List.copyOf(dateRanges);
    if ((startTime == null) != (endTime == null)) {
      throw new InvalidRuleException("time_based requires both start_time and end_time");
    }
    for (Integer weekday : weekdays) {
      if (weekday == null || weekday < 0 || weekday > 6) {
        throw new InvalidRuleException("weekday must be between 0 and 6: " + weekday);
      }
    }
    if (startTime == null && weekdays.isEmpty() && dateRanges.isEmpty()) {
      throw new InvalidRuleException("time_based requires a time window, weekdays or dates");
    }
  }

  public static LocalTime parseTime(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return LocalTime.parse(value.trim());
    } catch (DateTimeParseException ex) {
      throw new InvalidRuleException("time must be HH:MM: " + value, ex);
    }
  }

  public static ZoneId parseZone(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return ZoneId.of(value.trim());
    } catch (DateTimeException ex) {
      throw new InvalidRuleException("unknown timezone: " + value, ex);
    }
  }

  public static LocalDate parseDate(String value) {
    if (value == null) {
      throw new InvalidRuleException("date must be YYYY-MM-DD");
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException ex) {
      throw new InvalidRuleException("date must be YYYY-MM-DD: " + value, ex);
    }
  }

  @Override
  public RuleType ruleType() {
    return RuleType.TIME_BASED;
  }
}
