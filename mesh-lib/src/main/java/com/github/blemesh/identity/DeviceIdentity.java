// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.identity;

import com.github.blemesh.msg.SenderId;

import java.util.Objects;
import java.util.UUID;

import static com.github.blemesh.MeshLogger.LOGGER;

/// The durable device id. Generated once as a random UUID and persisted; its first 6 bytes are the compact
/// [SenderId] written into every header this device originates.
public class DeviceIdentity {
  private final IdentityStore store;
  private UUID deviceId;

  public DeviceIdentity(IdentityStore store) {
    this.store = Objects.requireNonNull(store, "store cannot be null");
  }

  public synchronized UUID getOrCreateDeviceId() {
    if (deviceId == null) {
      deviceId = store.loadDeviceId().orElseGet(() -> {
        UUID created = UUID.randomUUID();
        store.saveDeviceId(created);
        LOGGER.info(() -> "Generated new device id " + SenderId.fromUuid(created));
        return created;
      });
    }
    return deviceId;
  }

  public SenderId compactId() {
    return SenderId.fromUuid(getOrCreateDeviceId());
  }

  /// `AA:BB:CC:DD:EE:FF`
  public String compactIdString() {
    return compactId().toString();
  }

  /// Discards the current id and persists a fresh one. Peers will see this device as a stranger.
  public synchronized UUID resetDeviceId() {
    store.clearDeviceId();
    deviceId = null;
    UUID fresh = getOrCreateDeviceId();
    LOGGER.info(() -> "Device id reset to " + SenderId.fromUuid(fresh));
    return fresh;
  }

  public static SenderId parseCompactId(String compactId) {
    return SenderId.parse(compactId);
  }
}
