package com.notisync.device.api;

import com.notisync.device.model.ConflictResolution;
import com.notisync.device.model.SyncPassResult;
import com.notisync.device.model.SyncStatus;
import com.notisync.device.sync.SyncEngine;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/sync")
@RequiredArgsConstructor
public class SyncController {

  private final SyncEngine syncEngine;

  @GetMapping("/status")
  public ResponseEntity<SyncStatus> status() {
    return ResponseEntity.ok(syncEngine.status());
  }

  /** Runs a pass on the request thread; a pass already in flight yields ALREADY_SYNCING. */
  @PostMapping
  public ResponseEntity<SyncPassResult> sync() {
    return ResponseEntity.ok(syncEngine.performSync());
  }

  @PostMapping("/retry")
  public ResponseEntity<SyncPassResult> retry() {
    return ResponseEntity.ok(syncEngine.retryFailedOperations());
  }

  @GetMapping("/conflicts")
  public ResponseEntity<List<ConflictResolution>> conflicts() {
    return ResponseEntity.ok(syncEngine.recentConflicts());
  }
}
