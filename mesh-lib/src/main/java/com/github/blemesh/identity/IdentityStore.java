// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.identity;

import java.util.Optional;
import java.util.UUID;

/// Durable storage for the device id and the identity key material. The platform owns the format.
public interface IdentityStore {

  Optional<UUID> loadDeviceId();

  void saveDeviceId(UUID deviceId);

  void clearDeviceId();

  Optional<IdentityKeyMaterial> loadIdentityKeys();

  void saveIdentityKeys(IdentityKeyMaterial keys);

  void clearIdentityKeys();

  /// Volatile store for tests and for devices that do not want a stable identity.
  static IdentityStore inMemory() {
    return new InMemoryIdentityStore();
  }
}
