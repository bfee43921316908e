// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/// Tunables for one mesh node. [#defaults()] matches the deployed radio constants; [#fromProperties(Properties)]
/// reads `blemesh.*` keys and falls back to the defaults for anything absent.
public record MeshConfig(
    int defaultTtl,
    int maxConnections,
    int cacheCapacity,
    Duration cacheExpiration,
    Duration cacheSweepInterval,
    Duration stalePeerTimeout,
    Duration stalePeerSweepInterval,
    Duration connectionTimeout,
    Duration connectionTimeoutCheckInterval,
    Duration metricsInterval,
    Duration sessionMaxAge,
    long sessionMaxUses,
    int peerKeyCapacity,
    Duration peerKeyExpiration,
    boolean autoConnect,
    int eventQueueCapacity,
    String nickname,
    int argon2MemoryKiB,
    int argon2Iterations,
    int argon2Parallelism) {

  public static final String PREFIX = "blemesh.";

  public MeshConfig {
    Objects.requireNonNull(nickname, "nickname cannot be null");
    requireRange("defaultTtl", defaultTtl, 1, 255);
    requireRange("maxConnections", maxConnections, 1, 255);
    requireRange("cacheCapacity", cacheCapacity, 1, Integer.MAX_VALUE);
    requireRange("eventQueueCapacity", eventQueueCapacity, 1, Integer.MAX_VALUE);
    requireRange("peerKeyCapacity", peerKeyCapacity, 1, Integer.MAX_VALUE);
    requireRange("argon2MemoryKiB", argon2MemoryKiB, 8, Integer.MAX_VALUE);
    requireRange("argon2Iterations", argon2Iterations, 1, Integer.MAX_VALUE);
    requireRange("argon2Parallelism", argon2Parallelism, 1, 255);
    if (sessionMaxUses < 1) {
      throw new IllegalArgumentException("sessionMaxUses must be positive, got " + sessionMaxUses);
    }
    requirePositive("cacheExpiration", cacheExpiration);
    requirePositive("cacheSweepInterval", cacheSweepInterval);
    requirePositive("stalePeerTimeout", stalePeerTimeout);
    requirePositive("stalePeerSweepInterval", stalePeerSweepInterval);
    requirePositive("connectionTimeout", connectionTimeout);
    requirePositive("connectionTimeoutCheckInterval", connectionTimeoutCheckInterval);
    requirePositive("metricsInterval", metricsInterval);
    requirePositive("sessionMaxAge", sessionMaxAge);
    requirePositive("peerKeyExpiration", peerKeyExpiration);
  }

  public static MeshConfig defaults() {
    return new MeshConfig(
        7,
        7,
        1000,
        Duration.ofMinutes(5),
        Duration.ofSeconds(60),
        Duration.ofSeconds(60),
        Duration.ofSeconds(30),
        Duration.ofSeconds(30),
        Duration.ofSeconds(5),
        Duration.ofSeconds(60),
        Duration.ofHours(24),
        10_000,
        1000,
        Duration.ofHours(24),
        false,
        1000,
        "Unknown",
        65536,
        3,
        2);
  }

  /// Durations are ISO-8601 (`PT30S`) or plain milliseconds.
  public static MeshConfig fromProperties(Properties properties) {
    MeshConfig d = defaults();
    return new MeshConfig(
        intValue(properties, "defaultTtl", d.defaultTtl),
        intValue(properties, "maxConnections", d.maxConnections),
        intValue(properties, "cacheCapacity", d.cacheCapacity),
        durationValue(properties, "cacheExpiration", d.cacheExpiration),
        durationValue(properties, "cacheSweepInterval", d.cacheSweepInterval),
        durationValue(properties, "stalePeerTimeout", d.stalePeerTimeout),
        durationValue(properties, "stalePeerSweepInterval", d.stalePeerSweepInterval),
        durationValue(properties, "connectionTimeout", d.connectionTimeout),
        durationValue(properties, "connectionTimeoutCheckInterval", d.connectionTimeoutCheckInterval),
        durationValue(properties, "metricsInterval", d.metricsInterval),
        durationValue(properties, "sessionMaxAge", d.sessionMaxAge),
        longValue(properties, "sessionMaxUses", d.sessionMaxUses),
        intValue(properties, "peerKeyCapacity", d.peerKeyCapacity),
        durationValue(properties, "peerKeyExpiration", d.peerKeyExpiration),
        booleanValue(properties, "autoConnect", d.autoConnect),
        intValue(properties, "eventQueueCapacity", d.eventQueueCapacity),
        properties.getProperty(PREFIX + "nickname", d.nickname),
        intValue(properties, "argon2.memoryKiB", d.argon2MemoryKiB),
        intValue(properties, "argon2.iterations", d.argon2Iterations),
        intValue(properties, "argon2.parallelism", d.argon2Parallelism));
  }

  public MeshConfig withNickname(String nickname) {
    return new MeshConfig(defaultTtl, maxConnections, cacheCapacity, cacheExpiration, cacheSweepInterval,
        stalePeerTimeout, stalePeerSweepInterval, connectionTimeout, connectionTimeoutCheckInterval, metricsInterval,
        sessionMaxAge, sessionMaxUses, peerKeyCapacity, peerKeyExpiration, autoConnect, eventQueueCapacity, nickname,
        argon2MemoryKiB, argon2Iterations, argon2Parallelism);
  }

  public MeshConfig withDefaultTtl(int defaultTtl) {
    return new MeshConfig(defaultTtl, maxConnections, cacheCapacity, cacheExpiration, cacheSweepInterval,
        stalePeerTimeout, stalePeerSweepInterval, connectionTimeout, connectionTimeoutCheckInterval, metricsInterval,
        sessionMaxAge, sessionMaxUses, peerKeyCapacity, peerKeyExpiration, autoConnect, eventQueueCapacity, nickname,
        argon2MemoryKiB, argon2Iterations, argon2Parallelism);
  }

  public MeshConfig withMaxConnections(int maxConnections) {
    return new MeshConfig(defaultTtl, maxConnections, cacheCapacity, cacheExpiration, cacheSweepInterval,
        stalePeerTimeout, stalePeerSweepInterval, connectionTimeout, connectionTimeoutCheckInterval, metricsInterval,
        sessionMaxAge, sessionMaxUses, peerKeyCapacity, peerKeyExpiration, autoConnect, eventQueueCapacity, nickname,
        argon2MemoryKiB, argon2Iterations, argon2Parallelism);
  }

  public MeshConfig withPeerKeyLimits(int peerKeyCapacity, Duration peerKeyExpiration) {
    return new MeshConfig(defaultTtl, maxConnections, cacheCapacity, cacheExpiration, cacheSweepInterval,
        stalePeerTimeout, stalePeerSweepInterval, connectionTimeout, connectionTimeoutCheckInterval, metricsInterval,
        sessionMaxAge, sessionMaxUses, peerKeyCapacity, peerKeyExpiration, autoConnect, eventQueueCapacity, nickname,
        argon2MemoryKiB, argon2Iterations, argon2Parallelism);
  }

  public MeshConfig withAutoConnect(boolean autoConnect) {
    return new MeshConfig(defaultTtl, maxConnections, cacheCapacity, cacheExpiration, cacheSweepInterval,
        stalePeerTimeout, stalePeerSweepInterval, connectionTimeout, connectionTimeoutCheckInterval, metricsInterval,
        sessionMaxAge, sessionMaxUses, peerKeyCapacity, peerKeyExpiration, autoConnect, eventQueueCapacity, nickname,
        argon2MemoryKiB, argon2Iterations, argon2Parallelism);
  }

  public MeshConfig withSessionLimits(Duration sessionMaxAge, long sessionMaxUses) {
    return new MeshConfig(defaultTtl, maxConnections, cacheCapacity, cacheExpiration, cacheSweepInterval,
        stalePeerTimeout, stalePeerSweepInterval, connectionTimeout, connectionTimeoutCheckInterval, metricsInterval,
        sessionMaxAge, sessionMaxUses, peerKeyCapacity, peerKeyExpiration, autoConnect, eventQueueCapacity, nickname,
        argon2MemoryKiB, argon2Iterations, argon2Parallelism);
  }

  /// Cheap Argon2id settings. Channel keys derived with different parameters are not interchangeable.
  public MeshConfig withArgon2(int memoryKiB, int iterations, int parallelism) {
    return new MeshConfig(defaultTtl, maxConnections, cacheCapacity, cacheExpiration, cacheSweepInterval,
        stalePeerTimeout, stalePeerSweepInterval, connectionTimeout, connectionTimeoutCheckInterval, metricsInterval,
        sessionMaxAge, sessionMaxUses, peerKeyCapacity, peerKeyExpiration, autoConnect, eventQueueCapacity, nickname,
        memoryKiB, iterations, parallelism);
  }

  private static void requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(name + " must be between " + min + " and " + max + ", got " + value);
    }
  }

  private static void requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name + " cannot be null");
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive, got " + value);
    }
  }

  private static int intValue(Properties properties, String key, int fallback) {
    String value = properties.getProperty(PREFIX + key);
    if (value == null) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
    }
  }

  private static long longValue(Properties properties, String key, long fallback) {
    String value = properties.getProperty(PREFIX + key);
    if (value == null) {
      return fallback;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid long for " + PREFIX + key + ": " + value, e);
    }
  }

  private static boolean booleanValue(Properties properties, String key, boolean fallback) {
    String value = properties.getProperty(PREFIX + key);
    if (value == null) {
      return fallback;
    }
    String trimmed = value.trim();
    if (trimmed.equalsIgnoreCase("true")) return true;
    if (trimmed.equalsIgnoreCase("false")) return false;
    throw new IllegalArgumentException("Invalid boolean for " + PREFIX + key + ": " + value);
  }

  private static Duration durationValue(Properties properties, String key, Duration fallback) {
    String value = properties.getProperty(PREFIX + key);
    if (value == null) {
      return fallback;
    }
    String trimmed = value.trim();
    try {
      return trimmed.startsWith("P") || trimmed.startsWith("p")
          ? Duration.parse(trimmed)
          : Duration.ofMillis(Long.parseLong(trimmed));
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Invalid duration for " + PREFIX + key + ": " + value, e);
    }
  }
}
