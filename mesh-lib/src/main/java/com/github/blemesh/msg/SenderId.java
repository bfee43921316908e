// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.msg;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import java.util.UUID;

/// The compact 6 byte device identifier written into every header. It is the first 6 bytes of the durable device
/// UUID and is rendered as `AA:BB:CC:DD:EE:FF`.
public final class SenderId implements Comparable<SenderId> {
  public static final int SIZE = 6;

  private static final HexFormat HEX = HexFormat.ofDelimiter(":").withUpperCase();

  private final byte[] bytes;

  private SenderId(byte[] bytes) {
    this.bytes = bytes;
  }

  public static SenderId of(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes cannot be null");
    if (bytes.length != SIZE) {
      throw new IllegalArgumentException("Compact ID must be exactly " + SIZE + " bytes, got " + bytes.length);
    }
    return new SenderId(bytes.clone());
  }

  public static SenderId fromUuid(UUID uuid) {
    Objects.requireNonNull(uuid, "uuid cannot be null");
    byte[] full = ByteBuffer.allocate(16)
        .putLong(uuid.getMostSignificantBits())
        .putLong(uuid.getLeastSignificantBits())
        .array();
    return new SenderId(Arrays.copyOf(full, SIZE));
  }

  /// Accepts `:` or `-` separated hex pairs in either case.
  public static SenderId parse(String compactId) {
    Objects.requireNonNull(compactId, "compactId cannot be null");
    String[] parts = compactId.split("[:-]", -1);
    if (parts.length != SIZE) {
      throw new IllegalArgumentException("Invalid compact ID format: " + compactId + " (expected XX:XX:XX:XX:XX:XX)");
    }
    byte[] bytes = new byte[SIZE];
    for (int i = 0; i < SIZE; i++) {
      String part = parts[i];
      // exactly two hex digits; no sign or padding
      if (part.length() != 2 || !HexFormat.isHexDigit(part.charAt(0)) || !HexFormat.isHexDigit(part.charAt(1))) {
        throw new IllegalArgumentException("Invalid compact ID format: " + compactId);
      }
      bytes[i] = (byte) HexFormat.fromHexDigits(part);
    }
    return new SenderId(bytes);
  }

  public byte[] toBytes() {
    return bytes.clone();
  }

  void writeTo(ByteBuffer buffer) {
    buffer.put(bytes);
  }

  static SenderId readFrom(ByteBuffer buffer) {
    byte[] bytes = new byte[SIZE];
    buffer.get(bytes);
    return new SenderId(bytes);
  }

  @Override
  public int compareTo(SenderId other) {
    return Arrays.compareUnsigned(bytes, other.bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SenderId that)) return false;
    return Arrays.equals(bytes, that.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return HEX.formatHex(bytes);
  }
}
