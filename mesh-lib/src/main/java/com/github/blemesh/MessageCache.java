// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh;

import com.github.blemesh.msg.SenderId;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static com.github.blemesh.MeshLogger.LOGGER;

/// Bounded, time expiring record of `(senderId, messageId)` pairs already processed. Eviction is strict FIFO by
/// insertion order: lookups never refresh an entry, so memory is bounded by capacity whatever the query pattern.
/// Expired entries are purged lazily on lookup as well as by [#purgeExpired()].
///
/// All methods hold the instance monitor so that one forwarding thread per link can share a single cache.
public class MessageCache {

  public record CacheKey(SenderId senderId, long messageId) {
    public CacheKey {
      Objects.requireNonNull(senderId, "senderId cannot be null");
    }
  }

  public record CacheStats(int size, int capacity, long hits, long misses, Duration oldestEntryAge,
                           Duration expiration) {
  }

  private final int capacity;
  private final Duration expiration;
  private final Clock clock;

  /// Insertion ordered; the first entry is always the oldest insertion.
  private final LinkedHashMap<CacheKey, Instant> entries = new LinkedHashMap<>();

  private long hits;
  private long misses;

  public MessageCache(int capacity, Duration expiration, Clock clock) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive, got " + capacity);
    }
    if (expiration.isNegative() || expiration.isZero()) {
      throw new IllegalArgumentException("expiration must be positive, got " + expiration);
    }
    this.capacity = capacity;
    this.expiration = expiration;
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
  }

  public MessageCache(MeshConfig config, Clock clock) {
    this(config.cacheCapacity(), config.cacheExpiration(), clock);
  }

  public synchronized boolean contains(SenderId senderId, long messageId) {
    CacheKey key = new CacheKey(senderId, messageId);
    Instant insertedAt = entries.get(key);
    if (insertedAt == null) {
      return false;
    }
    if (isExpired(insertedAt, clock.instant())) {
      entries.remove(key);
      return false;
    }
    return true;
  }

  /// Insert if absent. Returns false, leaving the cache untouched, when an unexpired entry already exists.
  /// Otherwise evicts the oldest insertion when at capacity and returns true.
  public synchronized boolean insert(SenderId senderId, long messageId) {
    CacheKey key = new CacheKey(senderId, messageId);
    Instant now = clock.instant();
    Instant insertedAt = entries.get(key);
    if (insertedAt != null) {
      if (!isExpired(insertedAt, now)) {
        hits++;
        return false;
      }
      entries.remove(key);
    }
    misses++;
    while (entries.size() >= capacity) {
      Iterator<CacheKey> eldest = entries.keySet().iterator();
      CacheKey evicted = eldest.next();
      eldest.remove();
      LOGGER.finest(() -> "Evicted " + evicted + " from message cache at capacity " + capacity);
    }
    entries.put(key, now);
    return true;
  }

  /// Removes every expired entry and returns how many were removed.
  public synchronized int purgeExpired() {
    Instant now = clock.instant();
    int removed = 0;
    Iterator<Map.Entry<CacheKey, Instant>> iterator = entries.entrySet().iterator();
    while (iterator.hasNext()) {
      if (isExpired(iterator.next().getValue(), now)) {
        iterator.remove();
        removed++;
      }
    }
    if (removed > 0) {
      final int count = removed;
      LOGGER.finer(() -> "Purged " + count + " expired message cache entries");
    }
    return removed;
  }

  public synchronized void clear() {
    entries.clear();
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized CacheStats stats() {
    Duration oldest = entries.isEmpty()
        ? Duration.ZERO
        : Duration.between(entries.values().iterator().next(), clock.instant());
    return new CacheStats(entries.size(), capacity, hits, misses, oldest, expiration);
  }

  public int capacity() {
    return capacity;
  }

  public Duration expiration() {
    return expiration;
  }

  private boolean isExpired(Instant insertedAt, Instant now) {
    return now.isAfter(insertedAt.plus(expiration));
  }
}
