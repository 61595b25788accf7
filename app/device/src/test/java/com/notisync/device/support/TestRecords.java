package com.notisync.device.support;

import com.notisync.common.api.ServerNotification;
import com.notisync.common.model.NotificationCategory;
import com.notisync.device.model.NotificationRecord;
import java.time.Instant;
import java.util.Map;

public final class TestRecords {

  private TestRecords() {}

  public static NotificationRecord unsynced(
      String id, String app, String title, String body, Instant at) {
    return new NotificationRecord(
        id, null, app, title, body, NotificationCategory.PERSONAL, 1, at, null, Map.of(), false, 0,
        null, false, false, at, null);
  }

  public static NotificationRecord synced(
      String id, String serverId, Instant updatedAt, Instant serverUpdatedAt) {
    return new NotificationRecord(
        id, serverId, "Messages", "Hello", "See you at 5", NotificationCategory.PERSONAL, 1,
        updatedAt, null, Map.of(), true, 0, null, false, false, updatedAt, serverUpdatedAt);
  }

  public static ServerNotification server(
      String serverId, String clientId, boolean read, boolean dismissed, Instant updatedAt) {
    return new ServerNotification(
        serverId, clientId, "other-device", "Messages", null, "Hello (edited)", "See you at 6",
        NotificationCategory.WORK, 2, updatedAt, Map.of(), read, dismissed, updatedAt);
  }
}
