package com.notisync.common.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Sent with 200 on success and with 409 when the server copy diverged. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatusUpdateResponse(ServerNotification serverVersion) {}
