package com.notisync.device.scheduling;

import java.time.Duration;

/**
 * Timer primitives for the background ticks. Implementations isolate task failures so one
 * failing tick never cancels its schedule.
 */
public interface TickScheduler {

  void runNow(String name, Runnable task);

  /** Replaces any schedule already registered under {@code name}. */
  void runEvery(String name, Duration period, Runnable task);

  void cancel(String name);

  void cancelAll();
}
