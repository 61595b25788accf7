/*
 * Where: device capture pipeline
 * What: keyword and app heuristics for category and priority
 * Why: fills the gaps rules leave so every record ends up categorized and prioritized
 */
package com.notisync.device.service;

import com.notisync.common.model.NotificationCategory;
import com.notisync.common.model.Priorities;
import com.notisync.common.rules.DefaultRules;
import com.notisync.common.rules.TextHeuristics;
import com.notisync.device.config.ClassificationProperties;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class Classifier {

  static final List<String> WORK_KEYWORDS =
      List.of(
          "meeting", "calendar", "email", "slack", "teams", "zoom", "work", "office", "project",
          "deadline", "conference", "presentation", "document", "spreadsheet");

  static final List<String> WORK_APPS =
      List.of(
          "slack", "microsoft teams", "zoom", "gmail", "outlook", "google calendar", "trello",
          "asana", "jira", "confluence", "notion");

  static final List<String> JUNK_KEYWORDS =
      List.of(
          "offer", "discount", "sale", "promotion", "deal", "free", "win", "prize", "limited time",
          "act now", "exclusive", "special offer", "save money", "cashback", "reward", "gift card",
          "lottery", "congratulations");

  static final List<String> JUNK_APPS = List.of("shopping", "deals", "coupons", "ads", "marketing");

  static final List<String> HIGH_PRIORITY_KEYWORDS =
      List.of(
          "urgent", "emergency", "important", "asap", "critical", "alert", "otp",
          "verification code", "security", "login attempt", "password");

  static final List<String> HIGH_PRIORITY_APPS =
      List.of("banking", "security", "authenticator", "phone", "messages");

  static final List<String> LOW_PRIORITY_KEYWORDS =
      List.of("newsletter", "update available", "backup complete", "sync complete");

  private static final List<String> CODE_KEYWORDS = List.of("otp", "code", "verification");

  private final ClassificationProperties properties;

  /** Work signals win over junk ones; no signal means personal. */
  public NotificationCategory categorize(String appIdentity, String sourceId, String text) {
    final String lowerText = lower(text);
    final String lowerApp = lower(appIdentity);
    final String lowerSource = lower(sourceId);
    if (DefaultRules.WORK_PACKAGES.contains(lowerSource)
        || TextHeuristics.containsAny(lowerApp, WORK_APPS)
        || TextHeuristics.containsAny(lowerText, WORK_KEYWORDS)) {
      return NotificationCategory.WORK;
    }
    if (TextHeuristics.containsAny(lowerApp, JUNK_APPS)
        || TextHeuristics.containsAny(lowerText, JUNK_KEYWORDS)) {
      return NotificationCategory.JUNK;
    }
    return NotificationCategory.PERSONAL;
  }

  /**
   * Starts from {@code basePriority}. Urgency raises to 3, a 4-6 digit code next to a code
   * keyword forces 3, low-value keywords cap at 1, and night hours lower anything below 3 by one.
   */
  public int prioritize(int basePriority, String appIdentity, String text, Instant at) {
    int priority = Priorities.clamp(basePriority);
    final String lowerText = lower(text);
    final String lowerApp = lower(appIdentity);
    if (TextHeuristics.containsAny(lowerText, HIGH_PRIORITY_KEYWORDS)
        || TextHeuristics.containsAny(lowerApp, HIGH_PRIORITY_APPS)) {
      priority = Priorities.MAX;
    }
    if (TextHeuristics.containsAny(lowerText, CODE_KEYWORDS)
        && TextHeuristics.containsNumericToken(lowerText, 4, 6, "")) {
      priority = Priorities.MAX;
    }
    if (TextHeuristics.containsAny(lowerText, LOW_PRIORITY_KEYWORDS)) {
      priority = Math.min(priority, 1);
    }
    if (priority < Priorities.MAX && isNightHour(at)) {
      priority = Math.max(Priorities.MIN, priority - 1);
    }
    return priority;
  }

  public boolean isNightHour(Instant at) {
    final int hour = at.atZone(properties.zone()).getHour();
    final int start = properties.nightStartHour();
    final int end = properties.nightEndHour();
    if (start <= end) {
      return hour >= start && hour < end;
    }
    return hour >= start || hour < end;
  }

  private static String lower(String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }
}
