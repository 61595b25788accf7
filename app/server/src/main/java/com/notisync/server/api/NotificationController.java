/*
 * Where: server API
 * What: notification create, batch create, status update and listing endpoints
 * Why: this is the surface the device sync engine talks to
 */
package com.notisync.server.api;

import static com.notisync.server.config.RequestMdcInterceptor.DEVICE_ID_HEADER;
import static com.notisync.server.config.RequestMdcInterceptor.USER_ID_HEADER;

import com.notisync.common.api.BatchCreateRequest;
import com.notisync.common.api.BatchCreateResponse;
import com.notisync.common.api.CreateNotificationResponse;
import com.notisync.common.api.NotificationPayload;
import com.notisync.common.api.ServerNotification;
import com.notisync.common.api.StatusUpdateRequest;
import com.notisync.common.api.StatusUpdateResponse;
import com.notisync.server.model.CreateOutcome;
import com.notisync.server.model.StatusUpdateOutcome;
import com.notisync.server.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private final NotificationService notificationService;

  /** 201 for a new notification, 200 when the client id was already stored. */
  @PostMapping
  public ResponseEntity<CreateNotificationResponse> create(
      @RequestHeader(USER_ID_HEADER) String userId,
      @RequestHeader(value = DEVICE_ID_HEADER, required = false) String deviceId,
      @RequestBody NotificationPayload payload) {
    final CreateOutcome outcome =
        notificationService.create(requireUserId(userId), deviceId, payload);
    final ServerNotification stored = outcome.notification();
    return ResponseEntity.status(outcome.created() ? HttpStatus.CREATED : HttpStatus.OK)
        .body(new CreateNotificationResponse(stored.id(), stored.clientId(), stored.updatedAt()));
  }

  @PostMapping("/batch")
  public ResponseEntity<BatchCreateResponse> createBatch(
      @RequestHeader(USER_ID_HEADER) String userId,
      @RequestHeader(value = DEVICE_ID_HEADER, required = false) String deviceId,
      @RequestBody BatchCreateRequest request) {
    return ResponseEntity.ok(
        notificationService.createBatch(requireUserId(userId), deviceId, request.notifications()));
  }

  @PutMapping("/{id}")
  public ResponseEntity<StatusUpdateResponse> updateStatus(
      @RequestHeader(USER_ID_HEADER) String userId,
      @PathVariable("id") String id,
      @RequestBody StatusUpdateRequest request) {
    final StatusUpdateOutcome outcome =
        notificationService.updateStatus(requireUserId(userId), id, request);
    return ResponseEntity.status(outcome.conflicted() ? HttpStatus.CONFLICT : HttpStatus.OK)
        .body(new StatusUpdateResponse(outcome.notification()));
  }

  @GetMapping
  public NotificationsResponse list(@RequestHeader(USER_ID_HEADER) String userId) {
    final String resolved = requireUserId(userId);
    return new NotificationsResponse(resolved, notificationService.list(resolved));
  }

  static String requireUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException(USER_ID_HEADER + " is required");
    }
    return userId.trim();
  }
}
