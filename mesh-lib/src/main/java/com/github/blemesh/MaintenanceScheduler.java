// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

import static com.github.blemesh.MeshLogger.LOGGER;

/// Independent repeating background tasks, each cancellable by name. A task that throws is logged and keeps its
/// schedule.
public class MaintenanceScheduler implements AutoCloseable {
  private static final AtomicInteger INSTANCES = new AtomicInteger();

  private final String name;
  private final ScheduledExecutorService executor;
  private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

  public MaintenanceScheduler(String name) {
    this.name = name;
    final int instance = INSTANCES.incrementAndGet();
    this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "mesh-maintenance-" + name + "-" + instance);
      thread.setDaemon(true);
      return thread;
    });
  }

  public void schedule(String task, Duration interval, Runnable action) {
    cancel(task);
    LOGGER.fine(() -> name + " scheduling " + task + " every " + interval);
    ScheduledFuture<?> future = executor.scheduleWithFixedDelay(() -> {
      try {
        action.run();
      } catch (RuntimeException e) {
        LOGGER.log(Level.SEVERE, name + " maintenance task " + task + " failed", e);
      }
    }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    tasks.put(task, future);
  }

  public boolean cancel(String task) {
    ScheduledFuture<?> future = tasks.remove(task);
    if (future != null) {
      LOGGER.fine(() -> name + " cancelling " + task);
      future.cancel(false);
      return true;
    }
    return false;
  }

  public void cancelAll() {
    for (String task : tasks.keySet()) {
      cancel(task);
    }
  }

  public boolean isScheduled(String task) {
    return tasks.containsKey(task);
  }

  @Override
  public void close() {
    cancelAll();
    executor.shutdownNow();
  }
}
