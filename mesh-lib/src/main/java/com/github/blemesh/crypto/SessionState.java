// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.crypto;

import java.time.Duration;
import java.time.Instant;

/// Per peer session lifecycle. Transitions happen inside a single `ConcurrentHashMap.compute` so that concurrent
/// senders agree on one current session.
public sealed interface SessionState {

  enum NoSession implements SessionState {
    INSTANCE
  }

  record Active(SessionKeys keys, long uses) implements SessionState {
    Active used() {
      return new Active(keys, uses + 1);
    }

    /// Rotation is due once the age or the use count reaches its limit.
    public boolean shouldRotate(Instant now, Duration maxAge, long maxUses) {
      return uses >= maxUses || keys.isExpired(now, maxAge);
    }
  }

  /// Marked by a sweep; the next use derives a fresh session.
  record RotationPending(SessionKeys previous) implements SessionState {
  }
}
