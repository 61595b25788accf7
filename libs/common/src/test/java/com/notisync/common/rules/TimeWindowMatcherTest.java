package com.notisync.common.rules;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TimeWindowMatcherTest {

  private final TimeWindowMatcher matcher = new TimeWindowMatcher();

  @Test
  void windowWrapsPastMidnight() {
    final TimeBasedConditions night =
        new TimeBasedConditions(
            LocalTime.of(22, 0), LocalTime.of(6, 0), List.of(), null, List.of());

    assertThat(matcher.matches(night, at("2026-01-17T23:30:00Z"))).isTrue();
    assertThat(matcher.matches(night, at("2026-01-17T05:59:00Z"))).isTrue();
    assertThat(matcher.matches(night, at("2026-01-17T06:00:00Z"))).isTrue();
    assertThat(matcher.matches(night, at("2026-01-17T12:00:00Z"))).isFalse();
  }

  @Test
  void weekdaysUseSundayAsZeroInRuleTimezone() {
    // 2026-01-17 is a Saturday; 20:00 UTC is already Sunday in Tokyo
    final TimeBasedConditions sunday =
        new TimeBasedConditions(null, null, List.of(0), ZoneId.of("Asia/Tokyo"), List.of());

    assertThat(matcher.matches(sunday, at("2026-01-17T20:00:00Z"))).isTrue();
    assertThat(matcher.matches(sunday, at("2026-01-17T10:00:00Z"))).isFalse();
  }

  @Test
  void dateRangesRestrictToListedDays() {
    final TimeBasedConditions holiday =
        new TimeBasedConditions(null, null, List.of(), null, List.of(LocalDate.of(2026, 1, 1)));

    assertThat(matcher.matches(holiday, at("2026-01-01T10:00:00Z"))).isTrue();
    assertThat(matcher.matches(holiday, at("2026-01-02T10:00:00Z"))).isFalse();
  }

  private RuleTarget at(String instant) {
    return new RuleTarget(
        "App", null, "t", "b", null, 1, Instant.parse(instant), Map.of(), List.of(), false, false);
  }
}
