// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.network;

import java.util.concurrent.CompletableFuture;

/// The radio layer as seen by the mesh. Implementations must not block the caller: each method hands the work off
/// and reports failure through the returned future.
public interface MeshTransport {

  /// Registers the single listener that receives bytes and link events.
  void bind(TransportListener listener);

  CompletableFuture<Void> sendBytes(String connectionId, byte[] bytes);

  /// Completes when the link is up; [TransportListener#onPeerConnected(String)] is also called.
  CompletableFuture<Void> connect(String connectionId);

  void disconnect(String connectionId);
}
