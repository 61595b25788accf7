package com.notisync.device.api;

import com.notisync.device.model.NotificationRecord;
import com.notisync.device.service.LocalMutationService;
import com.notisync.device.service.NotificationQueryService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Local notification store; every action is applied at once and queued for the server. */
@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private final NotificationQueryService queryService;
  private final LocalMutationService mutationService;

  @GetMapping
  public ResponseEntity<List<NotificationRecord>> list(
      @RequestParam(name = "limit", defaultValue = "50") int limit,
      @RequestParam(name = "offset", defaultValue = "0") int offset) {
    return ResponseEntity.ok(queryService.list(limit, offset));
  }

  @GetMapping("/{id}")
  public ResponseEntity<NotificationRecord> get(@PathVariable("id") String id) {
    return ResponseEntity.ok(queryService.get(id));
  }

  @PostMapping("/{id}/read")
  public ResponseEntity<NotificationRecord> markRead(@PathVariable("id") String id) {
    return ResponseEntity.ok(mutationService.markRead(id));
  }

  @PostMapping("/{id}/dismiss")
  public ResponseEntity<NotificationRecord> markDismissed(@PathVariable("id") String id) {
    return ResponseEntity.ok(mutationService.markDismissed(id));
  }

  @PostMapping("/{id}/click")
  public ResponseEntity<NotificationRecord> markClicked(@PathVariable("id") String id) {
    return ResponseEntity.ok(mutationService.markClicked(id));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") String id) {
    mutationService.delete(id);
    return ResponseEntity.accepted().build();
  }
}
