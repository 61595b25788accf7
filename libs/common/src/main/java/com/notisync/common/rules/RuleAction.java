package com.notisync.common.rules;

import com.notisync.common.model.NotificationCategory;
import com.notisync.common.model.Priorities;

/** Mutation applied to the working copy when a rule matches. */
public sealed interface RuleAction {

  String wireName();

  record Block() implements RuleAction {
    @Override
    public String wireName() {
      return "block";
    }
  }

  record Allow() implements RuleAction {
    @Override
    public String wireName() {
      return "allow";
    }
  }

  record SetCategory(NotificationCategory category) implements RuleAction {
    public SetCategory {
      if (category == null) {
        throw new InvalidRuleException("setCategory requires a category");
      }
    }

    @Override
    public String wireName() {
      return "setCategory";
    }
  }

  record SetPriority(int priority) implements RuleAction {
    public SetPriority {
      priority = Priorities.clamp(priority);
    }

    @Override
    public String wireName() {
      return "setPriority";
    }
  }

  record AddTag(String tag) implements RuleAction {
    public AddTag {
      if (tag == null || tag.isBlank()) {
        throw new InvalidRuleException("addTag requires a tag");
      }
    }

    @Override
    public String wireName() {
      return "addTag";
    }
  }

  record RemoveTag(String tag) implements RuleAction {
    public RemoveTag {
      if (tag == null || tag.isBlank()) {
        throw new InvalidRuleException("removeTag requires a tag");
      }
    }

    @Override
    public String wireName() {
      return "removeTag";
    }
  }

  record SetRead(boolean read) implements RuleAction {
    @Override
    public String wireName() {
      return "setRead";
    }
  }

  record SetDismissed(boolean dismissed) implements RuleAction {
    @Override
    public String wireName() {
      return "setDismissed";
    }
  }

  /** Null parts are left unchanged. */
  record Transform(String title, String body) implements RuleAction {
    public Transform {
      if (title == null && body == null) {
        throw new InvalidRuleException("transform requires title or body");
      }
    }

    @Override
    public String wireName() {
      return "transform";
    }
  }
}
