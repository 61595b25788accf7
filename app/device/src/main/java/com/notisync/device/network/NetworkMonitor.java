package com.notisync.device.network;

public interface NetworkMonitor {

  boolean isOnline();

  /** Checks reachability once and returns the new state. */
  boolean probe();

  /** {@code listener} runs on every offline to online transition. */
  void addReconnectListener(Runnable listener);
}
