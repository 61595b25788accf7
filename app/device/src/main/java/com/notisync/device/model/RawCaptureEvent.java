package com.notisync.device.model;

import java.time.Instant;
import java.util.Map;

/** As delivered by the platform listener; every field except appIdentity may be missing. */
public record RawCaptureEvent(
    String sourceId,
    String appIdentity,
    String title,
    String body,
    Instant timestamp,
    Integer rawPriority,
    Map<String, Object> extras) {}
