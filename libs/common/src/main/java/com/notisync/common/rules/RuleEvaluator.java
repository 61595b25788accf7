package com.notisync.common.rules;

import com.notisync.common.model.NotificationCategory;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single rule engine used by the device pipeline and the server authority.
 *
 * <p>Enabled rules run in descending priority (stable, so ties keep insertion order). Matching
 * rules apply their actions cumulatively; a scalar field assigned by an earlier rule is not
 * overwritten by a later one, tags accumulate, and the first rule with a {@code block} action
 * ends the evaluation.
 */
public class RuleEvaluator {

  private static final Logger logger = LoggerFactory.getLogger(RuleEvaluator.class);

  private final Map<RuleType, ConditionMatcher> matchers;

  public RuleEvaluator(List<ConditionMatcher> conditionMatchers) {
    this.matchers = new EnumMap<>(RuleType.class);
    for (ConditionMatcher matcher : conditionMatchers) {
      matchers.put(matcher.getSupportedRuleType(), matcher);
    }
  }

  public static RuleEvaluator withDefaultMatchers() {
    return new RuleEvaluator(
        List.of(
            new AppFilterMatcher(),
            new KeywordFilterMatcher(),
            new TimeWindowMatcher(),
            new OtpMatcher(),
            new PromoMatcher(),
            new FieldConditionMatcher()));
  }

  public RuleEvaluation evaluate(RuleTarget target, List<Rule> rules) {
    final List<Rule> ordered = new ArrayList<>();
    for (Rule rule : rules) {
      if (rule.enabled()) {
        ordered.add(rule);
      }
    }
    ordered.sort(Comparator.comparingInt(Rule::priority).reversed());

    final WorkingCopy working = new WorkingCopy(target);
    final List<RuleApplication> matched = new ArrayList<>();
    boolean blocked = false;
    for (Rule rule : ordered) {
      if (!matches(rule, working.snapshot())) {
        continue;
      }
      working.beginRule();
      for (RuleAction action : rule.actions()) {
        if (action instanceof RuleAction.Block) {
          blocked = true;
        } else {
          working.apply(action);
        }
      }
      working.endRule();
      matched.add(new RuleApplication(rule.id(), rule.name(), rule.priority(), rule.actions()));
      if (blocked) {
        break;
      }
    }
    return new RuleEvaluation(working.snapshot(), matched, blocked, working.locked);
  }

  private boolean matches(Rule rule, RuleTarget target) {
    final ConditionMatcher matcher = matchers.get(rule.type());
    if (matcher == null) {
      logger.warn("no matcher registered ruleId={} type={}", rule.id(), rule.type());
      return false;
    }
    try {
      return matcher.matches(rule.conditions(), target);
    } catch (RuntimeException ex) {
      logger.warn("rule evaluation failed; treated as not matched ruleId={}", rule.id(), ex);
      return false;
    }
  }

  private static final class WorkingCopy {

    private final RuleTarget original;
    private final Set<MutableField> locked = EnumSet.noneOf(MutableField.class);
    private final Set<MutableField> assignedByCurrentRule = EnumSet.noneOf(MutableField.class);
    private final Set<String> originalTags;
    private final LinkedHashSet<String> tags;
    private String title;
    private String body;
    private NotificationCategory category;
    private int priority;
    private boolean read;
    private boolean dismissed;

    private WorkingCopy(RuleTarget target) {
      this.original = target;
      this.originalTags = Set.copyOf(target.tags());
      this.tags = new LinkedHashSet<>(target.tags());
      this.title = target.title();
      this.body = target.body();
      this.category = target.category();
      this.priority = target.priority();
      this.read = target.read();
      this.dismissed = target.dismissed();
    }

    void beginRule() {
      assignedByCurrentRule.clear();
    }

    void endRule() {
      locked.addAll(assignedByCurrentRule);
    }

    void apply(RuleAction action) {
      if (action instanceof RuleAction.SetCategory setCategory) {
        if (claim(MutableField.CATEGORY)) {
          category = setCategory.category();
        }
      } else if (action instanceof RuleAction.SetPriority setPriority) {
        if (claim(MutableField.PRIORITY)) {
          priority = setPriority.priority();
        }
      } else if (action instanceof RuleAction.SetRead setRead) {
        if (claim(MutableField.READ)) {
          read = setRead.read();
        }
      } else if (action instanceof RuleAction.SetDismissed setDismissed) {
        if (claim(MutableField.DISMISSED)) {
          dismissed = setDismissed.dismissed();
        }
      } else if (action instanceof RuleAction.Transform transform) {
        if (transform.title() != null && claim(MutableField.TITLE)) {
          title = transform.title();
        }
        if (transform.body() != null && claim(MutableField.BODY)) {
          body = transform.body();
        }
      } else if (action instanceof RuleAction.AddTag addTag) {
        tags.add(addTag.tag());
      } else if (action instanceof RuleAction.RemoveTag removeTag) {
        // tags added during this evaluation belong to higher-priority rules
        if (originalTags.contains(removeTag.tag())) {
          tags.remove(removeTag.tag());
        }
      }
    }

    private boolean claim(MutableField field) {
      if (locked.contains(field)) {
        return false;
      }
      assignedByCurrentRule.add(field);
      return true;
    }

    RuleTarget snapshot() {
      final Map<String, Object> extras = new LinkedHashMap<>(original.extras());
      if (!tags.isEmpty()) {
        extras.put("tags", List.copyOf(tags));
      } else {
        extras.remove("tags");
      }
      return new RuleTarget(
          original.appIdentity(),
          original.sourceId(),
          title,
          body,
          category,
          priority,
          original.timestamp(),
          extras,
          List.copyOf(tags),
          read,
          dismissed);
    }
  }
}
