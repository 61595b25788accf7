package com.notisync.device.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notisync.retention.enabled", havingValue = "true")
public class RetentionWorker {

  private final RetentionService retentionService;

  @Scheduled(fixedDelayString = "${notisync.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
