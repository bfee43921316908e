// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.identity;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

final class InMemoryIdentityStore implements IdentityStore {
  private final AtomicReference<UUID> deviceId = new AtomicReference<>();
  private final AtomicReference<IdentityKeyMaterial> keys = new AtomicReference<>();

  @Override
  public Optional<UUID> loadDeviceId() {
    return Optional.ofNullable(deviceId.get());
  }

  @Override
  public void saveDeviceId(UUID id) {
    deviceId.set(id);
  }

  @Override
  public void clearDeviceId() {
    deviceId.set(null);
  }

  @Override
  public Optional<IdentityKeyMaterial> loadIdentityKeys() {
    return Optional.ofNullable(keys.get());
  }

  @Override
  public void saveIdentityKeys(IdentityKeyMaterial material) {
    keys.set(material);
  }

  @Override
  public void clearIdentityKeys() {
    keys.set(null);
  }
}
