// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static com.github.blemesh.MeshLogger.LOGGER;

/// Bounded outbound queue for one category of events, drained by the application. Publishing never blocks: when the
/// consumer falls behind the oldest event is dropped. Each stream preserves publication order.
public class EventStream<T> {
  private final String name;
  private final BlockingQueue<T> queue;
  private final AtomicLong dropped = new AtomicLong();

  public EventStream(String name, int capacity) {
    this.name = name;
    this.queue = new ArrayBlockingQueue<>(capacity);
  }

  public void publish(T event) {
    synchronized (queue) {
      while (!queue.offer(event)) {
        T discarded = queue.poll();
        if (discarded != null) {
          long total = dropped.incrementAndGet();
          LOGGER.fine(() -> name + " stream full, dropped oldest event (" + total + " dropped so far)");
        }
      }
    }
  }

  public Optional<T> poll() {
    return Optional.ofNullable(queue.poll());
  }

  public Optional<T> poll(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  public T take() throws InterruptedException {
    return queue.take();
  }

  public List<T> drain() {
    List<T> events = new ArrayList<>();
    queue.drainTo(events);
    return events;
  }

  public int size() {
    return queue.size();
  }

  public long droppedCount() {
    return dropped.get();
  }

  public String name() {
    return name;
  }
}
