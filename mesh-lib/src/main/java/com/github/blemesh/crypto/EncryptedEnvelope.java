// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.crypto;

import org.jetbrains.annotations.Nullable;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/// Output of the encryption service. Serialized as three length prefixed mandatory fields (ciphertext, nonce, tag)
/// followed by three optional fields (ephemeral key, signature, signing key), each a presence byte then, when
/// present, a length prefixed value. Lengths are big-endian `int32`.
public record EncryptedEnvelope(byte[] ciphertext,
                                byte[] nonce,
                                byte[] tag,
                                byte @Nullable [] ephemeralPublicKey,
                                byte @Nullable [] signature,
                                byte @Nullable [] signingPublicKey) {

  public EncryptedEnvelope {
    Objects.requireNonNull(ciphertext, "ciphertext cannot be null");
    Objects.requireNonNull(nonce, "nonce cannot be null");
    Objects.requireNonNull(tag, "tag cannot be null");
    ciphertext = ciphertext.clone();
    nonce = nonce.clone();
    tag = tag.clone();
    ephemeralPublicKey = ephemeralPublicKey == null ? null : ephemeralPublicKey.clone();
    signature = signature == null ? null : signature.clone();
    signingPublicKey = signingPublicKey == null ? null : signingPublicKey.clone();
  }

  /// The bytes covered by the detached signature: ciphertext, nonce and tag concatenated.
  public byte[] signedContent() {
    return ByteBuffer.allocate(ciphertext.length + nonce.length + tag.length)
        .put(ciphertext)
        .put(nonce)
        .put(tag)
        .array();
  }

  public Optional<byte[]> ephemeralKey() {
    return Optional.ofNullable(ephemeralPublicKey).map(byte[]::clone);
  }

  EncryptedEnvelope withSignature(byte[] signature, byte[] signingPublicKey) {
    return new EncryptedEnvelope(ciphertext, nonce, tag, ephemeralPublicKey, signature, signingPublicKey);
  }

  public byte[] toBytes() {
    int size = 12 + ciphertext.length + nonce.length + tag.length
        + optionalSize(ephemeralPublicKey) + optionalSize(signature) + optionalSize(signingPublicKey);
    ByteBuffer buffer = ByteBuffer.allocate(size);
    putField(buffer, ciphertext);
    putField(buffer, nonce);
    putField(buffer, tag);
    putOptional(buffer, ephemeralPublicKey);
    putOptional(buffer, signature);
    putOptional(buffer, signingPublicKey);
    return buffer.array();
  }

  public static EncryptedEnvelope fromBytes(byte[] bytes) {
    try {
      ByteBuffer buffer = ByteBuffer.wrap(bytes);
      byte[] ciphertext = getField(buffer);
      byte[] nonce = getField(buffer);
      byte[] tag = getField(buffer);
      byte[] ephemeral = getOptional(buffer);
      byte[] signature = getOptional(buffer);
      byte[] signingKey = getOptional(buffer);
      return new EncryptedEnvelope(ciphertext, nonce, tag, ephemeral, signature, signingKey);
    } catch (BufferUnderflowException e) {
      throw new CryptoFailureException(CryptoFailureException.Reason.MALFORMED_ENVELOPE,
          "Envelope truncated at " + bytes.length + " bytes", e);
    }
  }

  private static int optionalSize(byte[] value) {
    return value == null ? 1 : 5 + value.length;
  }

  private static void putField(ByteBuffer buffer, byte[] value) {
    buffer.putInt(value.length);
    buffer.put(value);
  }

  private static void putOptional(ByteBuffer buffer, byte[] value) {
    if (value == null) {
      buffer.put((byte) 0);
    } else {
      buffer.put((byte) 1);
      putField(buffer, value);
    }
  }

  private static byte[] getField(ByteBuffer buffer) {
    int length = buffer.getInt();
    if (length < 0 || length > buffer.remaining()) {
      throw new CryptoFailureException(CryptoFailureException.Reason.MALFORMED_ENVELOPE,
          "Envelope field length " + length + " exceeds remaining " + buffer.remaining());
    }
    byte[] value = new byte[length];
    buffer.get(value);
    return value;
  }

  private static byte[] getOptional(ByteBuffer buffer) {
    byte present = buffer.get();
    if (present == 0) {
      return null;
    }
    if (present != 1) {
      throw new CryptoFailureException(CryptoFailureException.Reason.MALFORMED_ENVELOPE,
          "Bad presence flag " + present);
    }
    return getField(buffer);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EncryptedEnvelope that)) return false;
    return Arrays.equals(ciphertext, that.ciphertext)
        && Arrays.equals(nonce, that.nonce)
        && Arrays.equals(tag, that.tag)
        && Arrays.equals(ephemeralPublicKey, that.ephemeralPublicKey)
        && Arrays.equals(signature, that.signature)
        && Arrays.equals(signingPublicKey, that.signingPublicKey);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(ciphertext);
    result = 31 * result + Arrays.hashCode(nonce);
    result = 31 * result + Arrays.hashCode(tag);
    result = 31 * result + Arrays.hashCode(ephemeralPublicKey);
    result = 31 * result + Arrays.hashCode(signature);
    return 31 * result + Arrays.hashCode(signingPublicKey);
  }

  @Override
  public String toString() {
    return "EncryptedEnvelope[ciphertext=" + ciphertext.length + " bytes"
        + ", ephemeralKey=" + (ephemeralPublicKey != null)
        + ", signed=" + (signature != null) + "]";
  }
}
