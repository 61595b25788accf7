/*
 * Where: device network layer
 * What: tracks reachability of the server of record by probing its health endpoint
 * Why: the sync engine skips passes while offline and syncs as soon as the link returns
 */
package com.notisync.device.network;

import com.notisync.device.sync.NotificationServerClient;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ServerHealthNetworkMonitor implements NetworkMonitor {

  private static final Logger logger = LoggerFactory.getLogger(ServerHealthNetworkMonitor.class);

  private final NotificationServerClient serverClient;
  private final AtomicBoolean online = new AtomicBoolean(false);
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

  @Override
  public boolean isOnline() {
    return online.get();
  }

  @Override
  public void addReconnectListener(Runnable listener) {
    listeners.add(listener);
  }

  @Override
  public boolean probe() {
    final boolean reachable = serverClient.isReachable();
    final boolean previous = online.getAndSet(reachable);
    if (reachable && !previous) {
      logger.info("server reachable; notifying reconnect listeners count={}", listeners.size());
      for (Runnable listener : listeners) {
        try {
          listener.run();
        } catch (RuntimeException ex) {
          logger.warn("reconnect listener failed", ex);
        }
      }
    } else if (!reachable && previous) {
      logger.warn("server unreachable; sync paused");
    }
    return reachable;
  }
}
