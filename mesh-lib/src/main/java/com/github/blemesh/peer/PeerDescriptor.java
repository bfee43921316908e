// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.peer;

import com.github.blemesh.msg.SenderId;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/// One sighting reported by the transport. The sender id is present only when the advertisement carried it.
public record PeerDescriptor(String connectionId, @Nullable SenderId senderId, @Nullable String nickname, int rssi) {

  public PeerDescriptor {
    Objects.requireNonNull(connectionId, "connectionId cannot be null");
  }

  public static PeerDescriptor anonymous(String connectionId, int rssi) {
    return new PeerDescriptor(connectionId, null, null, rssi);
  }

  public Optional<SenderId> knownSenderId() {
    return Optional.ofNullable(senderId);
  }
}
