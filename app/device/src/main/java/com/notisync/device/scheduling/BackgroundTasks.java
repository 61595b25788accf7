/*
 * Where: device scheduling
 * What: registers the processing, sync, retry and network ticks and the reconnect trigger
 * Why: all background work runs on timers; stopping unregisters them and leaves queued work durable
 */
package com.notisync.device.scheduling;

import com.notisync.device.config.NetworkProperties;
import com.notisync.device.config.ProcessingProperties;
import com.notisync.device.config.SyncProperties;
import com.notisync.device.network.NetworkMonitor;
import com.notisync.device.service.CaptureProcessor;
import com.notisync.device.sync.SyncEngine;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notisync.background.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class BackgroundTasks {

  static final String PROCESSING_TICK = "capture-processing";
  static final String SYNC_TICK = "sync";
  static final String RETRY_TICK = "sync-retry";
  static final String NETWORK_TICK = "network-probe";
  static final String RECONNECT_TASK = "sync-on-reconnect";

  private static final Logger logger = LoggerFactory.getLogger(BackgroundTasks.class);

  private final TickScheduler scheduler;
  private final CaptureProcessor captureProcessor;
  private final SyncEngine syncEngine;
  private final NetworkMonitor networkMonitor;
  private final ProcessingProperties processingProperties;
  private final SyncProperties syncProperties;
  private final NetworkProperties networkProperties;
  private final AtomicBoolean started = new AtomicBoolean(false);

  public BackgroundTasks(
      TickScheduler scheduler,
      CaptureProcessor captureProcessor,
      SyncEngine syncEngine,
      NetworkMonitor networkMonitor,
      ProcessingProperties processingProperties,
      SyncProperties syncProperties,
      NetworkProperties networkProperties) {
    this.scheduler = scheduler;
    this.captureProcessor = captureProcessor;
    this.syncEngine = syncEngine;
    this.networkMonitor = networkMonitor;
    this.processingProperties = processingProperties;
    this.syncProperties = syncProperties;
    this.networkProperties = networkProperties;
    networkMonitor.addReconnectListener(
        () -> {
          if (started.get() && syncProperties.enabled()) {
            scheduler.runNow(RECONNECT_TASK, syncEngine::onNetworkRestored);
          }
        });
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    if (processingProperties.enabled()) {
      scheduler.runEvery(
          PROCESSING_TICK, processingProperties.interval(), captureProcessor::processPending);
    }
    if (syncProperties.enabled()) {
      scheduler.runEvery(SYNC_TICK, syncProperties.syncInterval(), syncEngine::performSync);
      scheduler.runEvery(
          RETRY_TICK, syncProperties.retryInterval(), syncEngine::retryFailedOperations);
    }
    scheduler.runEvery(NETWORK_TICK, networkProperties.probeInterval(), networkMonitor::probe);
    logger.info(
        "background tasks started processing={} sync={}",
        processingProperties.enabled(),
        syncProperties.enabled());
  }

  @PreDestroy
  public void stop() {
    if (!started.compareAndSet(true, false)) {
      return;
    }
    scheduler.cancelAll();
    logger.info("background tasks stopped");
  }
}
