// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.peer;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Durable set of blocked sender id strings in `AA:BB:CC:DD:EE:FF` form.
public interface BlocklistStore {

  Set<String> loadBlocked();

  void add(String senderId);

  void remove(String senderId);

  void clear();

  static BlocklistStore inMemory() {
    Set<String> blocked = ConcurrentHashMap.newKeySet();
    return new BlocklistStore() {
      @Override
      public Set<String> loadBlocked() {
        return Set.copyOf(blocked);
      }

      @Override
      public void add(String senderId) {
        blocked.add(senderId);
      }

      @Override
      public void remove(String senderId) {
        blocked.remove(senderId);
      }

      @Override
      public void clear() {
        blocked.clear();
      }
    };
  }
}
