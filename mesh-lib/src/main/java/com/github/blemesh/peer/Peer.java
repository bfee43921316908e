// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.peer;

import com.github.blemesh.msg.SenderId;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/// Immutable snapshot of a peer record. The registry replaces records rather than mutating them.
public record Peer(
    long handle,
    @Nullable SenderId senderId,
    String connectionId,
    String nickname,
    int rssi,
    Instant lastSeen,
    PeerConnectionState state,
    Instant stateChangedAt,
    boolean blocked,
    int hopCount,
    @Nullable Instant lastForwardTime) {

  public Peer {
    Objects.requireNonNull(connectionId, "connectionId cannot be null");
    Objects.requireNonNull(nickname, "nickname cannot be null");
    Objects.requireNonNull(lastSeen, "lastSeen cannot be null");
    Objects.requireNonNull(state, "state cannot be null");
    Objects.requireNonNull(stateChangedAt, "stateChangedAt cannot be null");
  }

  public Optional<SenderId> knownSenderId() {
    return Optional.ofNullable(senderId);
  }

  /// Not blocked, sender id known, and in a state a fresh connection may start from.
  public boolean canConnect() {
    return !blocked && senderId != null && state.isConnectable();
  }

  public boolean isConnected() {
    return state == PeerConnectionState.CONNECTED;
  }

  /// Sender id string when known, else the connection id.
  public String displayId() {
    return senderId != null ? senderId.toString() : connectionId;
  }

  Peer withState(PeerConnectionState next, Instant at) {
    return new Peer(handle, senderId, connectionId, nickname, rssi, lastSeen, next, at, blocked, hopCount,
        lastForwardTime);
  }

  Peer withSighting(int rssi, Instant at) {
    return new Peer(handle, senderId, connectionId, nickname, rssi, at, state, stateChangedAt, blocked, hopCount,
        lastForwardTime);
  }

  Peer withSeen(Instant at) {
    return new Peer(handle, senderId, connectionId, nickname, rssi, at, state, stateChangedAt, blocked, hopCount,
        lastForwardTime);
  }

  Peer withIdentity(SenderId senderId, String connectionId, String nickname) {
    return new Peer(handle, senderId, connectionId, nickname, rssi, lastSeen, state, stateChangedAt, blocked,
        hopCount, lastForwardTime);
  }

  Peer withBlocked(boolean blocked) {
    return new Peer(handle, senderId, connectionId, nickname, rssi, lastSeen, state, stateChangedAt, blocked,
        hopCount, lastForwardTime);
  }

  Peer withForward(int hopCount, Instant at) {
    return new Peer(handle, senderId, connectionId, nickname, rssi, lastSeen, state, stateChangedAt, blocked,
        hopCount, at);
  }
}
