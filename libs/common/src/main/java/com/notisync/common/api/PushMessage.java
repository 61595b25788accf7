package com.notisync.common.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Envelope on the push channel; {@code data} is a {@link ServerNotification} for notification
 * messages.
 */
public record PushMessage(PushMessageType type, JsonNode data, Instant timestamp) {}
