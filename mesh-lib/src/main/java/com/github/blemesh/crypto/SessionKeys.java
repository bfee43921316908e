// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.crypto;

import com.github.blemesh.msg.SenderId;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/// Key agreement result for one peer: our ephemeral X25519 public key (sent in each envelope), the peer identity key
/// it was agreed against, and the derived 32 byte message key. Replaced wholesale on rotation, never mutated.
public final class SessionKeys {
  private final SenderId peerId;
  private final byte[] peerPublicKey;
  private final byte[] ephemeralPublicKey;
  private final byte[] messageKey;
  private final Instant createdAt;

  SessionKeys(SenderId peerId, byte[] peerPublicKey, byte[] ephemeralPublicKey, byte[] messageKey, Instant createdAt) {
    this.peerId = peerId;
    this.peerPublicKey = peerPublicKey.clone();
    this.ephemeralPublicKey = ephemeralPublicKey.clone();
    this.messageKey = messageKey.clone();
    this.createdAt = createdAt;
  }

  public SenderId peerId() {
    return peerId;
  }

  public byte[] peerPublicKey() {
    return peerPublicKey.clone();
  }

  public byte[] ephemeralPublicKey() {
    return ephemeralPublicKey.clone();
  }

  byte[] messageKey() {
    return messageKey;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public boolean isExpired(Instant now, Duration maxAge) {
    return !now.isBefore(createdAt.plus(maxAge));
  }

  boolean agreedWith(byte[] publicKey) {
    return Arrays.equals(peerPublicKey, publicKey);
  }

  @Override
  public String toString() {
    return "SessionKeys[peer=" + peerId + ", createdAt=" + createdAt + "]";
  }
}
