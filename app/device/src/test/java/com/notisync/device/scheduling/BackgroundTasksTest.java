package com.notisync.device.scheduling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.notisync.device.config.NetworkProperties;
import com.notisync.device.config.ProcessingProperties;
import com.notisync.device.config.SyncProperties;
import com.notisync.device.network.ServerHealthNetworkMonitor;
import com.notisync.device.service.CaptureProcessor;
import com.notisync.device.support.ManualTickScheduler;
import com.notisync.device.sync.NotificationServerClient;
import com.notisync.device.sync.SyncEngine;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackgroundTasksTest {

  private final ManualTickScheduler scheduler = new ManualTickScheduler();
  private final CaptureProcessor captureProcessor = mock(CaptureProcessor.class);
  private final SyncEngine syncEngine = mock(SyncEngine.class);
  private final NotificationServerClient serverClient = mock(NotificationServerClient.class);
  private final ServerHealthNetworkMonitor networkMonitor =
      new ServerHealthNetworkMonitor(serverClient);

  @Test
  void startRegistersEveryTickWithConfiguredPeriods() {
    final BackgroundTasks tasks = tasks(SyncProperties.defaults());

    tasks.start();

    assertThat(scheduler.registered())
        .containsEntry(BackgroundTasks.PROCESSING_TICK, Duration.ofSeconds(5))
        .containsEntry(BackgroundTasks.SYNC_TICK, Duration.ofSeconds(30))
        .containsEntry(BackgroundTasks.RETRY_TICK, Duration.ofSeconds(60))
        .containsEntry(BackgroundTasks.NETWORK_TICK, Duration.ofSeconds(15));
  }

  @Test
  void ticksDriveProcessingAndSync() {
    tasks(SyncProperties.defaults()).start();

    scheduler.fire(BackgroundTasks.PROCESSING_TICK);
    scheduler.fire(BackgroundTasks.SYNC_TICK);
    scheduler.fire(BackgroundTasks.RETRY_TICK);

    verify(captureProcessor).processPending();
    verify(syncEngine).performSync();
    verify(syncEngine).retryFailedOperations();
  }

  @Test
  void reconnectTriggersImmediateSync() {
    tasks(SyncProperties.defaults()).start();
    when(serverClient.isReachable()).thenReturn(true);

    scheduler.fire(BackgroundTasks.NETWORK_TICK);
    scheduler.fire(BackgroundTasks.NETWORK_TICK);

    assertThat(scheduler.immediateRuns()).containsExactly(BackgroundTasks.RECONNECT_TASK);
    verify(syncEngine).onNetworkRestored();
  }

  @Test
  void disabledSyncRegistersNoSyncTicks() {
    final SyncProperties disabled =
        new SyncProperties(
            false, null, null, null, null, null, null, null, null, null, null, null, null, null,
            null, null);

    tasks(disabled).start();

    assertThat(scheduler.registered())
        .containsKeys(BackgroundTasks.PROCESSING_TICK, BackgroundTasks.NETWORK_TICK)
        .doesNotContainKeys(BackgroundTasks.SYNC_TICK, BackgroundTasks.RETRY_TICK);
  }

  @Test
  void stopUnregistersTicksAndIgnoresReconnects() {
    final BackgroundTasks tasks = tasks(SyncProperties.defaults());
    tasks.start();

    tasks.stop();
    when(serverClient.isReachable()).thenReturn(true);
    networkMonitor.probe();

    assertThat(scheduler.registered()).isEmpty();
    verify(syncEngine, never()).onNetworkRestored();
  }

  private BackgroundTasks tasks(SyncProperties syncProperties) {
    return new BackgroundTasks(
        scheduler,
        captureProcessor,
        syncEngine,
        networkMonitor,
        ProcessingProperties.defaults(),
        syncProperties,
        new NetworkProperties(null, null));
  }
}
