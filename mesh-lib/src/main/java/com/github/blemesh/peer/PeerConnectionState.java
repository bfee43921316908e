// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.peer;

/// Link lifecycle of one peer.
///
/// ```
/// DISCOVERED -> CONNECTING -> CONNECTED -> DISCONNECTING -> DISCONNECTED
///                    |                                          |
///                    +------------> DISCONNECTED -> CONNECTING -+
/// ```
///
/// Inbound links may go straight from `DISCOVERED` or `DISCONNECTED` to `CONNECTED`, and a link lost without a
/// local disconnect goes from `CONNECTED` to `DISCONNECTED`.
public enum PeerConnectionState {
  DISCOVERED,
  CONNECTING,
  CONNECTED,
  DISCONNECTING,
  DISCONNECTED;

  public boolean canTransitionTo(PeerConnectionState next) {
    switch (this) {
      case DISCOVERED:
        return next == CONNECTING || next == CONNECTED || next == DISCONNECTED;
      case CONNECTING:
        return next == CONNECTED || next == DISCONNECTED || next == DISCONNECTING;
      case CONNECTED:
        return next == DISCONNECTING || next == DISCONNECTED;
      case DISCONNECTING:
        return next == DISCONNECTED;
      case DISCONNECTED:
        return next == CONNECTING || next == CONNECTED;
      default:
        return false;
    }
  }

  /// States from which a fresh outbound connection may be started.
  public boolean isConnectable() {
    return this == DISCOVERED || this == DISCONNECTED;
  }

  /// States that occupy one of the limited link slots. A closing link keeps its slot until the transport reports it
  /// down.
  public boolean occupiesSlot() {
    return this == CONNECTING || this == CONNECTED || this == DISCONNECTING;
  }

  /// Pending or established links, the ones a disconnect can still be started on.
  public boolean isLive() {
    return this == CONNECTING || this == CONNECTED;
  }
}
