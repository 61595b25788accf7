package com.notisync.common.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.notisync.common.model.NotificationCategory;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Converts between {@link Rule} and {@link RuleDocument}, upgrading older documents first. */
public class RuleCodec {

  private static final int DEFAULT_PRIORITY = 5;

  private final ObjectMapper objectMapper;
  private final RuleSchemaMigrator migrator;

  public RuleCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.migrator = new RuleSchemaMigrator(objectMapper);
  }

  public Rule decode(RuleDocument source) {
    final RuleDocument document = migrator.upgrade(source);
    final RuleType type = RuleType.fromWireName(document.type());
    final Instant createdAt = document.createdAt();
    return new Rule(
        document.id(),
        document.name(),
        type,
        document.priority() == null ? DEFAULT_PRIORITY : document.priority(),
        document.enabled() == null || document.enabled(),
        decodeConditions(type, document.conditions()),
        decodeActions(document.actions()),
        createdAt,
        document.updatedAt() == null ? createdAt : document.updatedAt());
  }

  public RuleDocument encode(Rule rule) {
    return new RuleDocument(
        rule.id(),
        rule.name(),
        rule.type().wireName(),
        rule.priority(),
        rule.enabled(),
        encodeConditions(rule.conditions()),
        encodeActions(rule.actions()),
        RuleSchemaMigrator.CURRENT_VERSION,
        rule.createdAt(),
        rule.updatedAt());
  }

  public RuleConditions decodeConditions(RuleType type, JsonNode node) {
    final JsonNode conditions = node == null ? objectMapper.createObjectNode() : node;
    return switch (type) {
      case APP_FILTER ->
          new AppFilterConditions(
              strings(conditions.path("app_names")), strings(conditions.path("exclude_apps")));
      case KEYWORD_FILTER ->
          new KeywordFilterConditions(
              strings(conditions.path("keywords")),
              strings(conditions.path("exclude_keywords")),
              conditions.path("case_sensitive").asBoolean(false),
              conditions.path("match_title").asBoolean(true),
              conditions.path("match_body").asBoolean(true));
      case TIME_BASED -> decodeTimeBased(conditions);
      case OTP_ALWAYS -> new OtpAlwaysConditions();
      case PROMO_MUTE -> new PromoMuteConditions(strings(conditions.path("keywords")));
      case CUSTOM -> decodeFieldConditions(conditions.path("all"));
    };
  }

  public List<RuleAction> decodeActions(JsonNode node) {
    if (node == null || !node.isArray()) {
      throw new InvalidRuleException("actions must be a list");
    }
    final List<RuleAction> actions = new ArrayList<>();
    for (JsonNode action : node) {
      actions.add(decodeAction(action));
    }
    return actions;
  }

  public JsonNode encodeConditions(RuleConditions conditions) {
    final ObjectNode node = objectMapper.createObjectNode();
    if (conditions instanceof AppFilterConditions appFilter) {
      node.set("app_names", array(appFilter.appNames()));
      node.set("exclude_apps", array(appFilter.excludeApps()));
    } else if (conditions instanceof KeywordFilterConditions keywordFilter) {
      node.set("keywords", array(keywordFilter.keywords()));
      node.set("exclude_keywords", array(keywordFilter.excludeKeywords()));
      node.put("case_sensitive", keywordFilter.caseSensitive());
      node.put("match_title", keywordFilter.matchTitle());
      node.put("match_body", keywordFilter.matchBody());
    } else if (conditions instanceof TimeBasedConditions window) {
      if (window.startTime() != null) {
        node.put("start_time", window.startTime().toString());
        node.put("end_time", window.endTime().toString());
      }
      final ArrayNode weekdays = node.putArray("weekdays");
      window.weekdays().forEach(weekdays::add);
      if (window.timezone() != null) {
        node.put("timezone", window.timezone().getId());
      }
      node.set(
          "date_ranges",
          array(window.dateRanges().stream().map(LocalDate::toString).toList()));
    } else if (conditions instanceof PromoMuteConditions promo) {
      node.set("keywords", array(promo.keywords()));
    } else if (conditions instanceof FieldConditions fieldConditions) {
      final ArrayNode all = node.putArray("all");
      for (FieldCondition condition : fieldConditions.all()) {
        all.add(encodeFieldCondition(condition));
      }
    }
    return node;
  }

  public JsonNode encodeActions(List<RuleAction> actions) {
    final ArrayNode array = objectMapper.createArrayNode();
    for (RuleAction action : actions) {
      final ObjectNode node = array.addObject().put("type", action.wireName());
      if (action instanceof RuleAction.SetCategory setCategory) {
        node.put("value", setCategory.category().wireName());
      } else if (action instanceof RuleAction.SetPriority setPriority) {
        node.put("value", setPriority.priority());
      } else if (action instanceof RuleAction.AddTag addTag) {
        node.put("value", addTag.tag());
      } else if (action instanceof RuleAction.RemoveTag removeTag) {
        node.put("value", removeTag.tag());
      } else if (action instanceof RuleAction.SetRead setRead) {
        node.put("value", setRead.read());
      } else if (action instanceof RuleAction.SetDismissed setDismissed) {
        node.put("value", setDismissed.dismissed());
      } else if (action instanceof RuleAction.Transform transform) {
        final ObjectNode value = node.putObject("value");
        if (transform.title() != null) {
          value.put("title", transform.title());
        }
        if (transform.body() != null) {
          value.put("body", transform.body());
        }
      }
    }
    return array;
  }

  public String toJson(JsonNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize rule json", ex);
    }
  }

  public JsonNode fromJson(String json) {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new InvalidRuleException("stored rule json is unreadable", ex);
    }
  }

  private TimeBasedConditions decodeTimeBased(JsonNode conditions) {
    final List<Integer> weekdays = new ArrayList<>();
    for (JsonNode weekday : conditions.path("weekdays")) {
      if (!weekday.canConvertToInt()) {
        throw new InvalidRuleException("weekday must be an integer: " + weekday);
      }
      weekdays.add(weekday.asInt());
    }
    final List<LocalDate> dates =
        strings(conditions.path("date_ranges")).stream()
            .map(TimeBasedConditions::parseDate)
            .toList();
    return new TimeBasedConditions(
        TimeBasedConditions.parseTime(textOrNull(conditions, "start_time")),
        TimeBasedConditions.parseTime(textOrNull(conditions, "end_time")),
        weekdays,
        TimeBasedConditions.parseZone(textOrNull(conditions, "timezone")),
        dates);
  }

  private FieldConditions decodeFieldConditions(JsonNode all) {
    final List<FieldCondition> conditions = new ArrayList<>();
    for (JsonNode condition : all) {
      conditions.add(
          new FieldCondition(
              RuleField.fromWireName(condition.path("field").asText()),
              textOrNull(condition, "extras_key"),
              ConditionOperator.fromWireName(condition.path("operator").asText()),
              textOrNull(condition, "value"),
              strings(condition.path("values")),
              condition.path("case_sensitive").asBoolean(false),
              condition.path("negate").asBoolean(false)));
    }
    return new FieldConditions(conditions);
  }

  private ObjectNode encodeFieldCondition(FieldCondition condition) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put("field", condition.field().wireName());
    if (condition.extrasKey() != null) {
      node.put("extras_key", condition.extrasKey());
    }
    node.put("operator", condition.operator().wireName());
    if (condition.value() != null) {
      node.put("value", condition.value());
    }
    if (!condition.values().isEmpty()) {
      node.set("values", array(condition.values()));
    }
    node.put("case_sensitive", condition.caseSensitive());
    node.put("negate", condition.negate());
    return node;
  }

  private RuleAction decodeAction(JsonNode action) {
    final String type = action.path("type").asText("");
    final JsonNode value = action.path("value");
    return switch (type) {
      case "block" -> new RuleAction.Block();
      case "allow" -> new RuleAction.Allow();
      case "setCategory" -> new RuleAction.SetCategory(category(value));
      case "setPriority" -> {
        if (!value.canConvertToInt()) {
          throw new InvalidRuleException("setPriority requires an integer value");
        }
        yield new RuleAction.SetPriority(value.asInt());
      }
      case "addTag" -> new RuleAction.AddTag(textOrNull(action, "value"));
      case "removeTag" -> new RuleAction.RemoveTag(textOrNull(action, "value"));
      case "setRead" -> new RuleAction.SetRead(value.asBoolean(true));
      case "setDismissed" -> new RuleAction.SetDismissed(value.asBoolean(true));
      case "transform" ->
          new RuleAction.Transform(textOrNull(value, "title"), textOrNull(value, "body"));
      default -> throw new InvalidRuleException("unknown action type: " + type);
    };
  }

  private NotificationCategory category(JsonNode value) {
    try {
      return NotificationCategory.fromWireName(value.isTextual() ? value.asText() : null);
    } catch (IllegalArgumentException ex) {
      throw new InvalidRuleException(ex.getMessage(), ex);
    }
  }

  private List<String> strings(JsonNode node) {
    final List<String> values = new ArrayList<>();
    if (node == null || node.isMissingNode() || node.isNull()) {
      return values;
    }
    if (!node.isArray()) {
      throw new InvalidRuleException("expected a list but got: " + node);
    }
    node.forEach(item -> values.add(item.asText()));
    return values;
  }

  private String textOrNull(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private ArrayNode array(List<String> values) {
    final ArrayNode array = objectMapper.createArrayNode();
    values.forEach(array::add);
    return array;
  }
}
