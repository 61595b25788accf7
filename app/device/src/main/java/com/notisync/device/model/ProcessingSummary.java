package com.notisync.device.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessingSummary(
    int processed, int accepted, int duplicates, int blocked, int failed) {

  public static ProcessingSummary empty() {
    return new ProcessingSummary(0, 0, 0, 0, 0);
  }
}
