package com.notisync.device.support;

import com.notisync.device.scheduling.TickScheduler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Records registrations; ticks run only when a test fires them. */
public class ManualTickScheduler implements TickScheduler {

  private final Map<String, Duration> periods = new LinkedHashMap<>();
  private final Map<String, Runnable> ticks = new LinkedHashMap<>();
  private final List<String> immediateRuns = new ArrayList<>();

  @Override
  public void runNow(String name, Runnable task) {
    immediateRuns.add(name);
    task.run();
  }

  @Override
  public void runEvery(String name, Duration period, Runnable task) {
    periods.put(name, period);
    ticks.put(name, task);
  }

  @Override
  public void cancel(String name) {
    periods.remove(name);
    ticks.remove(name);
  }

  @Override
  public void cancelAll() {
    periods.clear();
    ticks.clear();
  }

  public void fire(String name) {
    final Runnable task = ticks.get(name);
    if (task == null) {
      throw new IllegalStateException("no tick registered: " + name);
    }
    task.run();
  }

  public Map<String, Duration> registered() {
    return Map.copyOf(periods);
  }

  public List<String> immediateRuns() {
    return List.copyOf(immediateRuns);
  }
}
