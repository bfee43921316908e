// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.store;

import com.github.blemesh.peer.BlocklistStore;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.time.Clock;
import java.util.Set;

/// Blocked sender ids in an H2 MVStore, keyed by id with the time of blocking as the value.
public class MVStoreBlocklistStore implements BlocklistStore {
  private final MVStore store;
  private final MVMap<String, Long> blocked;
  private final Clock clock;

  public MVStoreBlocklistStore(MVStore store) {
    this(store, Clock.systemUTC());
  }

  public MVStoreBlocklistStore(MVStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
    this.blocked = store.openMap("com.github.blemesh.store#blocklist");
  }

  @Override
  public Set<String> loadBlocked() {
    return Set.copyOf(blocked.keySet());
  }

  @Override
  public void add(String senderId) {
    blocked.putIfAbsent(senderId, clock.millis());
    store.commit();
  }

  @Override
  public void remove(String senderId) {
    blocked.remove(senderId);
    store.commit();
  }

  @Override
  public void clear() {
    blocked.clear();
    store.commit();
  }

  /// Epoch millis when the id was blocked, or null.
  public Long blockedAt(String senderId) {
    return blocked.get(senderId);
  }
}
