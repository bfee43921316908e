// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.peer;

import com.github.blemesh.msg.SenderId;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;

import static com.github.blemesh.MeshLogger.LOGGER;

/// Blocked sender ids, cached in memory and written through to a [BlocklistStore].
public class Blocklist {
  private final BlocklistStore store;
  private final Set<SenderId> blocked = ConcurrentHashMap.newKeySet();

  public Blocklist(BlocklistStore store) {
    this.store = Objects.requireNonNull(store, "store cannot be null");
    for (String id : store.loadBlocked()) {
      try {
        blocked.add(SenderId.parse(id));
      } catch (IllegalArgumentException e) {
        LOGGER.log(Level.WARNING, "Ignoring unparseable blocklist entry " + id, e);
      }
    }
  }

  /// Returns true when the id was not already blocked.
  public boolean block(SenderId senderId) {
    boolean added = blocked.add(Objects.requireNonNull(senderId, "senderId cannot be null"));
    if (added) {
      store.add(senderId.toString());
      LOGGER.info(() -> "Blocked " + senderId);
    }
    return added;
  }

  public boolean unblock(SenderId senderId) {
    boolean removed = blocked.remove(senderId);
    if (removed) {
      store.remove(senderId.toString());
      LOGGER.info(() -> "Unblocked " + senderId);
    }
    return removed;
  }

  public boolean isBlocked(SenderId senderId) {
    return senderId != null && blocked.contains(senderId);
  }

  public Set<SenderId> blockedPeers() {
    return Set.copyOf(blocked);
  }

  public int blockedCount() {
    return blocked.size();
  }

  public void clear() {
    blocked.clear();
    store.clear();
    LOGGER.info("Blocklist cleared");
  }
}
