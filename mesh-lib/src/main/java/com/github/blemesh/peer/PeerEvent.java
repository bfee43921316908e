// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.peer;

import java.time.Instant;

/// Peer lifecycle notification carrying the peer record as it was after the change.
public record PeerEvent(Type type, Peer peer, Instant at) {

  public enum Type {
    DISCOVERED,
    IDENTIFIED,
    CONNECTING,
    CONNECTED,
    DISCONNECTING,
    DISCONNECTED,
    CONNECTION_FAILED,
    BLOCKED,
    UNBLOCKED,
    REMOVED
  }
}
