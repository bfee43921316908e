// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.msg;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/// Payload of a `PEER_ANNOUNCEMENT` frame. Layout: nickname length (1 byte), UTF-8 nickname, 32 byte key agreement
/// public key, 32 byte signing public key, 64 byte signature over [#signedContent].
public record PeerAnnouncement(String nickname, byte[] agreementKey, byte[] signingKey, byte[] signature) {
  public static final int KEY_SIZE = 32;
  public static final int SIGNATURE_SIZE = 64;
  static final int MAX_NICKNAME_BYTES = 255;

  public PeerAnnouncement {
    Objects.requireNonNull(nickname, "nickname cannot be null");
    if (nickname.getBytes(StandardCharsets.UTF_8).length > MAX_NICKNAME_BYTES) {
      throw new IllegalArgumentException("nickname longer than " + MAX_NICKNAME_BYTES + " UTF-8 bytes");
    }
    requireLength(agreementKey, KEY_SIZE, "agreementKey");
    requireLength(signingKey, KEY_SIZE, "signingKey");
    requireLength(signature, SIGNATURE_SIZE, "signature");
    agreementKey = agreementKey.clone();
    signingKey = signingKey.clone();
    signature = signature.clone();
  }

  /// The bytes the announcing device signs: its sender id, nickname and both public keys.
  public static byte[] signedContent(SenderId senderId, String nickname, byte[] agreementKey, byte[] signingKey) {
    byte[] name = nickname.getBytes(StandardCharsets.UTF_8);
    return ByteBuffer.allocate(SenderId.SIZE + name.length + agreementKey.length + signingKey.length)
        .put(senderId.toBytes())
        .put(name)
        .put(agreementKey)
        .put(signingKey)
        .array();
  }

  public byte[] signedContent(SenderId senderId) {
    return signedContent(senderId, nickname, agreementKey, signingKey);
  }

  public byte[] toBytes() {
    byte[] name = nickname.getBytes(StandardCharsets.UTF_8);
    return ByteBuffer.allocate(1 + name.length + KEY_SIZE * 2 + SIGNATURE_SIZE)
        .put((byte) name.length)
        .put(name)
        .put(agreementKey)
        .put(signingKey)
        .put(signature)
        .array();
  }

  public static PeerAnnouncement fromBytes(byte[] bytes) {
    try {
      ByteBuffer buffer = ByteBuffer.wrap(bytes);
      byte[] name = new byte[buffer.get() & 0xFF];
      buffer.get(name);
      byte[] agreementKey = new byte[KEY_SIZE];
      buffer.get(agreementKey);
      byte[] signingKey = new byte[KEY_SIZE];
      buffer.get(signingKey);
      byte[] signature = new byte[SIGNATURE_SIZE];
      buffer.get(signature);
      return new PeerAnnouncement(new String(name, StandardCharsets.UTF_8), agreementKey, signingKey, signature);
    } catch (BufferUnderflowException e) {
      throw new MalformedWireException(MalformedWireException.Kind.BAD_PAYLOAD,
          "Peer announcement truncated at " + bytes.length + " bytes", e);
    } catch (IllegalArgumentException e) {
      // undecodable nickname bytes can grow past the limit once replaced
      throw new MalformedWireException(MalformedWireException.Kind.BAD_PAYLOAD,
          "Peer announcement rejected: " + e.getMessage(), e);
    }
  }

  /// Drops trailing code points until the nickname fits the one byte length prefix.
  public static String fitNickname(String nickname) {
    String fitted = nickname;
    while (fitted.getBytes(StandardCharsets.UTF_8).length > MAX_NICKNAME_BYTES) {
      fitted = fitted.substring(0, fitted.offsetByCodePoints(fitted.length(), -1));
    }
    return fitted;
  }

  private static void requireLength(byte[] bytes, int length, String name) {
    Objects.requireNonNull(bytes, name + " cannot be null");
    if (bytes.length != length) {
      throw new IllegalArgumentException(name + " must be " + length + " bytes, got " + bytes.length);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PeerAnnouncement that)) return false;
    return nickname.equals(that.nickname)
        && Arrays.equals(agreementKey, that.agreementKey)
        && Arrays.equals(signingKey, that.signingKey)
        && Arrays.equals(signature, that.signature);
  }

  @Override
  public int hashCode() {
    int result = nickname.hashCode();
    result = 31 * result + Arrays.hashCode(agreementKey);
    result = 31 * result + Arrays.hashCode(signingKey);
    return 31 * result + Arrays.hashCode(signature);
  }

  @Override
  public String toString() {
    return "PeerAnnouncement[nickname=" + nickname + "]";
  }
}
