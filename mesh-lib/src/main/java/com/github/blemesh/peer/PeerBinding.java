// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.peer;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Outcome of tying a sender id to a link. When the device already held another link to us that link is `displaced`:
/// it has been moved to `DISCONNECTING` and the caller must close it.
public record PeerBinding(Peer peer, @Nullable Peer displaced) {

  public Optional<Peer> displacedPeer() {
    return Optional.ofNullable(displaced);
  }

  /// Links the caller must close: the displaced duplicate, and the bound link itself if binding revealed a blocked
  /// sender.
  public List<String> linksToClose() {
    List<String> links = new ArrayList<>(2);
    if (peer.state() == PeerConnectionState.DISCONNECTING) {
      links.add(peer.connectionId());
    }
    if (displaced != null) {
      links.add(displaced.connectionId());
    }
    return links;
  }
}
