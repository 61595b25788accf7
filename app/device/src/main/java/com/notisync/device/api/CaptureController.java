/*
 * Where: device API
 * What: entry point for captured notifications and the processing error log
 * Why: the platform listener hands captures over without waiting for the pipeline
 */
package com.notisync.device.api;

import com.notisync.device.api.request.CaptureRequest;
import com.notisync.device.api.response.CaptureAcceptedResponse;
import com.notisync.device.model.ProcessingError;
import com.notisync.device.model.ProcessingSummary;
import com.notisync.device.service.CaptureProcessor;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class CaptureController {

  private final CaptureProcessor captureProcessor;

  @PostMapping("/v1/captures")
  public ResponseEntity<CaptureAcceptedResponse> capture(@RequestBody CaptureRequest request) {
    final String id = captureProcessor.submit(request.toEvent());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new CaptureAcceptedResponse(id, captureProcessor.queueSize()));
  }

  @PostMapping("/v1/captures/process")
  public ResponseEntity<ProcessingSummary> process() {
    return ResponseEntity.ok(captureProcessor.processPending());
  }

  @GetMapping("/v1/processing/errors")
  public ResponseEntity<List<ProcessingError>> errors() {
    return ResponseEntity.ok(captureProcessor.recentErrors());
  }
}
