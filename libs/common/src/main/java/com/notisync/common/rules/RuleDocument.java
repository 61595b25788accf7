package com.notisync.common.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** Stored and transmitted form of a rule; conditions and actions stay as tagged JSON. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RuleDocument(
    String id,
    String name,
    String type,
    Integer priority,
    Boolean enabled,
    JsonNode conditions,
    JsonNode actions,
    Integer schemaVersion,
    Instant createdAt,
    Instant updatedAt) {

  public RuleDocument withBody(JsonNode newConditions, JsonNode newActions, int newSchemaVersion) {
    return new RuleDocument(
        id,
        name,
        type,
        priority,
        enabled,
        newConditions,
        newActions,
        newSchemaVersion,
        createdAt,
        updatedAt);
  }
}
