package com.notisync.common.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Upgrades stored rule documents one schema version at a time.
 *
 * <p>Version 1 held either a single action object ({@code {"action": "mute", ...}}) or a list of
 * camelCase field conditions; version 2 is what {@link RuleCodec} reads.
 */
public class RuleSchemaMigrator {

  public static final int CURRENT_VERSION = 2;

  private static final int LEGACY_HIGHLIGHT_PRIORITY = 3;

  private final ObjectMapper objectMapper;

  public RuleSchemaMigrator(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public RuleDocument upgrade(RuleDocument document) {
    final int version = document.schemaVersion() == null ? 1 : document.schemaVersion();
    if (version > CURRENT_VERSION) {
      throw new InvalidRuleException(
          "rule " + document.id() + " has unsupported schema version " + version);
    }
    RuleDocument current = document;
    if (version < 2) {
      current = upgradeToV2(current);
    }
    return current;
  }

  private RuleDocument upgradeToV2(RuleDocument document) {
    final RuleType type = RuleType.fromWireName(document.type());
    return document.withBody(
        upgradeConditions(type, document.conditions()), upgradeActions(document.actions()), 2);
  }

  private JsonNode upgradeConditions(RuleType type, JsonNode conditions) {
    if (type == RuleType.CUSTOM && conditions != null && conditions.isArray()) {
      final ArrayNode all = objectMapper.createArrayNode();
      for (JsonNode legacy : conditions) {
        all.add(upgradeFieldCondition(legacy));
      }
      final ObjectNode upgraded = objectMapper.createObjectNode();
      upgraded.set("all", all);
      return upgraded;
    }
    if (type == RuleType.KEYWORD_FILTER && conditions instanceof ObjectNode object) {
      final ObjectNode upgraded = object.deepCopy();
      if (!upgraded.has("match_title")) {
        upgraded.put("match_title", true);
      }
      if (!upgraded.has("match_body")) {
        upgraded.put("match_body", true);
      }
      return upgraded;
    }
    return conditions;
  }

  private ObjectNode upgradeFieldCondition(JsonNode legacy) {
    final ObjectNode upgraded = objectMapper.createObjectNode();
    final Iterator<Map.Entry<String, JsonNode>> fields = legacy.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> entry = fields.next();
      switch (entry.getKey()) {
        case "caseSensitive" -> upgraded.set("case_sensitive", entry.getValue());
        case "extrasKey" -> upgraded.set("extras_key", entry.getValue());
        case "value" -> {
          if (entry.getValue().isArray()) {
            final ArrayNode values = objectMapper.createArrayNode();
            entry.getValue().forEach(value -> values.add(value.asText()));
            upgraded.set("values", values);
          } else if (!entry.getValue().isNull()) {
            upgraded.put("value", entry.getValue().asText());
          }
        }
        default -> upgraded.set(entry.getKey(), entry.getValue());
      }
    }
    return upgraded;
  }

  private JsonNode upgradeActions(JsonNode actions) {
    if (actions == null || actions.isArray()) {
      return actions;
    }
    final ArrayNode upgraded = objectMapper.createArrayNode();
    final String legacyAction = actions.path("action").asText("").toLowerCase(Locale.ROOT);
    switch (legacyAction) {
      case "mute" -> upgraded.add(action("setDismissed").put("value", true));
      case "highlight" ->
          upgraded.add(action("setPriority").put("value", LEGACY_HIGHLIGHT_PRIORITY));
      case "categorize" ->
          upgraded.add(action("setCategory").put("value", actions.path("category").asText()));
      case "prioritize" ->
          upgraded.add(action("setPriority").put("value", actions.path("priority").asInt()));
      case "allow" -> upgraded.add(action("allow"));
      default -> throw new InvalidRuleException("unknown legacy action: " + legacyAction);
    }
    return upgraded;
  }

  private ObjectNode action(String type) {
    return objectMapper.createObjectNode().put("type", type);
  }
}
