package com.notisync.device.scheduling;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/** Fixed-delay ticks on Spring's task scheduler, so a slow tick never overlaps itself. */
@Component
public class SpringTickScheduler implements TickScheduler {

  private static final Logger logger = LoggerFactory.getLogger(SpringTickScheduler.class);

  private final TaskScheduler taskScheduler;
  private final Map<String, ScheduledFuture<?>> schedules = new ConcurrentHashMap<>();

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "TaskScheduler is a shared Spring bean")
  public SpringTickScheduler(TaskScheduler taskScheduler) {
    this.taskScheduler = taskScheduler;
  }

  @Override
  public void runNow(String name, Runnable task) {
    taskScheduler.schedule(guarded(name, task), Instant.now());
  }

  @Override
  public void runEvery(String name, Duration period, Runnable task) {
    final ScheduledFuture<?> previous =
        schedules.put(name, taskScheduler.scheduleWithFixedDelay(guarded(name, task), period));
    if (previous != null) {
      previous.cancel(false);
    }
    logger.info("tick registered name={} period={}", name, period);
  }

  @Override
  public void cancel(String name) {
    final ScheduledFuture<?> future = schedules.remove(name);
    if (future != null) {
      future.cancel(false);
    }
  }

  @Override
  public void cancelAll() {
    schedules.keySet().forEach(this::cancel);
  }

  private Runnable guarded(String name, Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException ex) {
        logger.error("tick failed name={}", name, ex);
      }
    };
  }
}
