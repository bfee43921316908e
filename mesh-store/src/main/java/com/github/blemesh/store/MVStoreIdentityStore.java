// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.store;

import com.github.blemesh.identity.IdentityKeyMaterial;
import com.github.blemesh.identity.IdentityStore;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.util.Optional;
import java.util.UUID;

import static com.github.blemesh.MeshLogger.LOGGER;

/// Device id and identity keys in an H2 MVStore. Every write is committed immediately.
public class MVStoreIdentityStore implements IdentityStore {
  static final String DEVICE_ID = "device_id";
  static final String SIGNING_SEED = "signing_seed";
  static final String AGREEMENT_KEY = "agreement_key";

  private final MVStore store;
  private final MVMap<String, String> identity;
  private final MVMap<String, byte[]> keys;

  public MVStoreIdentityStore(MVStore store) {
    this.store = store;
    this.identity = store.openMap("com.github.blemesh.store#identity");
    this.keys = store.openMap("com.github.blemesh.store#identity_keys");
  }

  @Override
  public Optional<UUID> loadDeviceId() {
    String value = identity.get(DEVICE_ID);
    if (value == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(UUID.fromString(value));
    } catch (IllegalArgumentException e) {
      LOGGER.warning(() -> "Discarding corrupt stored device id " + value);
      return Optional.empty();
    }
  }

  @Override
  public void saveDeviceId(UUID deviceId) {
    identity.put(DEVICE_ID, deviceId.toString());
    store.commit();
  }

  @Override
  public void clearDeviceId() {
    identity.remove(DEVICE_ID);
    store.commit();
  }

  @Override
  public Optional<IdentityKeyMaterial> loadIdentityKeys() {
    byte[] seed = keys.get(SIGNING_SEED);
    byte[] agreement = keys.get(AGREEMENT_KEY);
    if (seed == null || agreement == null) {
      return Optional.empty();
    }
    return Optional.of(new IdentityKeyMaterial(seed, agreement));
  }

  @Override
  public void saveIdentityKeys(IdentityKeyMaterial material) {
    keys.put(SIGNING_SEED, material.signingSeed());
    keys.put(AGREEMENT_KEY, material.agreementPrivateKey());
    store.commit();
  }

  @Override
  public void clearIdentityKeys() {
    keys.remove(SIGNING_SEED);
    keys.remove(AGREEMENT_KEY);
    store.commit();
  }
}
