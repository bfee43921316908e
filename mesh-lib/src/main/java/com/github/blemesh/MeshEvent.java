// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh;

import com.github.blemesh.msg.SenderId;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/// Operational event. `peer` names the remote device or link involved where there is one; `stats` is set only on
/// [Type#FORWARDING_METRICS].
public record MeshEvent(Type type, Instant at, String detail, @Nullable String peer,
                        ForwardingStats.@Nullable Snapshot stats) {

  public enum Type {
    MESH_STARTED,
    MESH_STOPPED,
    MALFORMED_MESSAGE,
    CRYPTO_FAILURE,
    SEND_FAILED,
    CONNECTION_TIMEOUT,
    FORWARDING_METRICS,
    ERROR
  }

  public MeshEvent {
    Objects.requireNonNull(type, "type cannot be null");
    Objects.requireNonNull(at, "at cannot be null");
    Objects.requireNonNull(detail, "detail cannot be null");
  }

  static MeshEvent of(Type type, Instant at, String detail) {
    return new MeshEvent(type, at, detail, null, null);
  }

  static MeshEvent about(Type type, Instant at, String detail, String peer) {
    return new MeshEvent(type, at, detail, peer, null);
  }

  static MeshEvent about(Type type, Instant at, String detail, SenderId peer) {
    return new MeshEvent(type, at, detail, peer.toString(), null);
  }

  static MeshEvent metrics(Instant at, ForwardingStats.Snapshot stats) {
    return new MeshEvent(Type.FORWARDING_METRICS, at, stats.toString(), null, stats);
  }
}
