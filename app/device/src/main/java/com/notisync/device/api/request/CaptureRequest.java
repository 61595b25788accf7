package com.notisync.device.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notisync.device.model.RawCaptureEvent;
import java.time.Instant;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CaptureRequest(
    String sourceId,
    String appIdentity,
    String title,
    String body,
    Instant timestamp,
    Integer priority,
    Map<String, Object> extras) {

  public RawCaptureEvent toEvent() {
    return new RawCaptureEvent(sourceId, appIdentity, title, body, timestamp, priority, extras);
  }
}
