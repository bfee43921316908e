// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.crypto;

import com.github.blemesh.msg.SenderId;

/// Notified after a peer key agreement public key is stored. Receives its own copy of the key.
@FunctionalInterface
public interface PeerKeyListener {
  void onPeerKeyStored(SenderId peerId, byte[] publicKey);
}
