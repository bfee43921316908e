// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.network;

import com.github.blemesh.peer.PeerDescriptor;

/// Callbacks from the radio layer. Each link may call in on its own thread.
public interface TransportListener {

  void onBytesReceived(String connectionId, byte[] bytes);

  void onPeerDiscovered(PeerDescriptor descriptor);

  void onPeerConnected(String connectionId);

  void onPeerDisconnected(String connectionId);
}
