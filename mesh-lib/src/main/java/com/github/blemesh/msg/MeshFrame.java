// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.msg;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/// A header plus exactly `payloadLength` bytes of payload. Trailing bytes after the payload are ignored.
public record MeshFrame(MessageHeader header, byte[] payload) {

  public MeshFrame {
    Objects.requireNonNull(header, "header cannot be null");
    Objects.requireNonNull(payload, "payload cannot be null");
    if (payload.length != header.payloadLength()) {
      throw new IllegalArgumentException("payload length " + payload.length
          + " does not match header payloadLength " + header.payloadLength());
    }
  }

  public static MeshFrame originate(MessageType type, int ttl, SenderId senderId, long messageId, byte[] payload) {
    if (payload.length > MessageHeader.MAX_PAYLOAD_LENGTH) {
      throw new IllegalArgumentException("Payload too large: " + payload.length + " > " + MessageHeader.MAX_PAYLOAD_LENGTH);
    }
    return new MeshFrame(MessageHeader.originate(type, ttl, messageId, senderId, payload.length), payload);
  }

  public MeshFrame forwarded() {
    return new MeshFrame(header.forwarded(), payload);
  }

  public byte[] toBytes() {
    ByteBuffer buffer = ByteBuffer.allocate(MessageHeaderCodec.HEADER_SIZE + payload.length);
    MessageHeaderCodec.encode(header, buffer);
    buffer.put(payload);
    return buffer.array();
  }

  public static MeshFrame fromBytes(byte[] bytes) {
    MessageHeader header = MessageHeaderCodec.decode(bytes);
    int available = bytes.length - MessageHeaderCodec.HEADER_SIZE;
    if (available < header.payloadLength()) {
      throw new MalformedWireException(MalformedWireException.Kind.PAYLOAD_TRUNCATED,
          "Payload truncated: expected " + header.payloadLength() + " bytes but only " + available + " available");
    }
    byte[] payload = Arrays.copyOfRange(bytes, MessageHeaderCodec.HEADER_SIZE,
        MessageHeaderCodec.HEADER_SIZE + header.payloadLength());
    return new MeshFrame(header, payload);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MeshFrame that)) return false;
    return header.equals(that.header) && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return 31 * header.hashCode() + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "MeshFrame[" + header + ", payload=" + payload.length + " bytes]";
  }
}
