package com.notisync.common.api;

import java.util.List;

public record BatchCreateRequest(List<NotificationPayload> notifications) {}
