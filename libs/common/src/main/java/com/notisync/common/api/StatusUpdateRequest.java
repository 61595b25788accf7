package com.notisync.common.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notisync.common.model.StatusAction;
import java.time.Instant;

/**
 * {@code clientUpdatedAt} is the last time the device saw the server copy; a newer server copy is
 * reported as a conflict.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatusUpdateRequest(StatusAction action, Instant clientUpdatedAt) {}
