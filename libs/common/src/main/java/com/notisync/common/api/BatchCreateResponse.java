package com.notisync.common.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

/** One result per submitted item, in submission order. */
public record BatchCreateResponse(List<ItemResult> results) {

  /** Exactly one of {@code id} and {@code error} is set. */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ItemResult(String clientId, String id, String error, Instant updatedAt) {

    public static ItemResult accepted(String clientId, String id, Instant updatedAt) {
      return new ItemResult(clientId, id, null, updatedAt);
    }

    public static ItemResult rejected(String clientId, String error) {
      return new ItemResult(clientId, null, error, null);
    }

    public boolean accepted() {
      return id != null && error == null;
    }
  }
}
