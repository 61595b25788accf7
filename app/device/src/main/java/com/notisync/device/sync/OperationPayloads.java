package com.notisync.device.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notisync.common.api.NotificationPayload;
import com.notisync.common.model.StatusAction;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.SyncOperation;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** JSON bodies stored with queued operations and the wire payloads built from records. */
@Component
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ObjectMapper is a shared Spring bean")
public class OperationPayloads {

  private static final String ACTION_FIELD = "action";

  private final ObjectMapper objectMapper;

  public NotificationPayload toPayload(NotificationRecord record) {
    return new NotificationPayload(
        record.id(),
        record.appIdentity(),
        record.title(),
        record.body(),
        record.category(),
        record.priority(),
        record.timestamp(),
        record.sourceId(),
        record.extras(),
        record.read(),
        record.dismissed());
  }

  public String createPayload(NotificationRecord record) {
    return write(toPayload(record));
  }

  public String actionPayload(StatusAction action) {
    return write(objectMapper.createObjectNode().put(ACTION_FIELD, action.wireName()));
  }

  /** Falls back to {@code fallback} when the stored payload carries no readable action. */
  public StatusAction actionOf(SyncOperation operation, StatusAction fallback) {
    if (operation.payloadJson() == null) {
      return fallback;
    }
    try {
      final JsonNode action = objectMapper.readTree(operation.payloadJson()).get(ACTION_FIELD);
      return action == null || !action.isTextual()
          ? fallback
          : StatusAction.fromWireName(action.asText());
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      return fallback;
    }
  }

  public NotificationPayload readCreatePayload(SyncOperation operation) {
    try {
      return objectMapper.readValue(operation.payloadJson(), NotificationPayload.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("queued create payload is unreadable: " + operation.id(), ex);
    }
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("payload is not serializable", ex);
    }
  }
}
