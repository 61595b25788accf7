package com.notisync.common.rules;

import com.notisync.common.model.NotificationCategory;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

/** System rules seeded for a device or user that has no rules yet. */
public final class DefaultRules {

  public static final List<String> SYSTEM_PACKAGES =
      List.of("com.android.systemui", "android", "com.android.system", "com.google.android.gms");

  public static final List<String> WORK_PACKAGES =
      List.of(
          "com.slack.android",
          "com.microsoft.teams",
          "us.zoom.videomeetings",
          "com.google.android.gm",
          "com.microsoft.office.outlook",
          "com.trello",
          "com.asana.app");

  private DefaultRules() {}

  public static List<Rule> create(Instant now) {
    return List.of(
        new Rule(
            "default-system-block",
            "System Notifications Block",
            RuleType.CUSTOM,
            110,
            true,
            new FieldConditions(List.of(FieldCondition.in(RuleField.SOURCE_ID, SYSTEM_PACKAGES))),
            List.of(new RuleAction.Block()),
            now,
            now),
        new Rule(
            "default-otp-high-priority",
            "OTP High Priority",
            RuleType.OTP_ALWAYS,
            100,
            true,
            new OtpAlwaysConditions(),
            List.of(
                new RuleAction.SetPriority(3),
                new RuleAction.AddTag("otp"),
                new RuleAction.SetCategory(NotificationCategory.PERSONAL)),
            now,
            now),
        new Rule(
            "default-banking-security",
            "Banking Security Alerts",
            RuleType.CUSTOM,
            95,
            true,
            new FieldConditions(
                List.of(
                    FieldCondition.of(
                        RuleField.APP_IDENTITY,
                        ConditionOperator.REGEX,
                        "\\b(bank|banking|security|authenticator|wallet)\\b"),
                    FieldCondition.of(
                        RuleField.BODY,
                        ConditionOperator.REGEX,
                        "\\b(login|transaction|security|alert|suspicious)\\b"))),
            List.of(
                new RuleAction.SetPriority(3),
                new RuleAction.SetCategory(NotificationCategory.PERSONAL),
                new RuleAction.AddTag("security")),
            now,
            now),
        new Rule(
            "default-work-apps",
            "Work Apps",
            RuleType.CUSTOM,
            90,
            true,
            new FieldConditions(List.of(FieldCondition.in(RuleField.SOURCE_ID, WORK_PACKAGES))),
            List.of(
                new RuleAction.SetCategory(NotificationCategory.WORK),
                new RuleAction.AddTag("work")),
            now,
            now),
        new Rule(
            "default-promotional",
            "Promotional Content Filter",
            RuleType.CUSTOM,
            80,
            true,
            new FieldConditions(
                List.of(
                    FieldCondition.of(
                        RuleField.BODY,
                        ConditionOperator.REGEX,
                        "\\b(offer|discount|sale|deal|free|win|prize|limited time|exclusive)\\b"))),
            List.of(
                new RuleAction.SetCategory(NotificationCategory.JUNK),
                new RuleAction.SetPriority(0),
                new RuleAction.AddTag("promotional")),
            now,
            now),
        new Rule(
            "default-night-mode",
            "Night Mode Priority Reduction",
            RuleType.TIME_BASED,
            70,
            false,
            new TimeBasedConditions(
                LocalTime.of(22, 0), LocalTime.of(6, 0), List.of(), null, List.of()),
            List.of(new RuleAction.SetPriority(0), new RuleAction.AddTag("night-mode")),
            now,
            now));
  }
}
