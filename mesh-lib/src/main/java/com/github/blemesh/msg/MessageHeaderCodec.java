// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.msg;

import java.nio.ByteBuffer;
import java.security.SecureRandom;

/// Big-endian header layout:
///
/// | offset | size | field          |
/// |--------|------|----------------|
/// | 0      | 1    | version        |
/// | 1      | 1    | type           |
/// | 2      | 1    | ttl            |
/// | 3      | 1    | hop count      |
/// | 4      | 8    | message id     |
/// | 12     | 6    | sender id      |
/// | 18     | 2    | payload length |
///
/// Only the version is validated here. Types, ttl and hop counts are interpreted by the engine.
public final class MessageHeaderCodec {
  public static final int HEADER_SIZE = 20;
  public static final byte PROTOCOL_VERSION = 0x01;

  private static final ThreadLocal<SecureRandom> RANDOM = ThreadLocal.withInitial(SecureRandom::new);

  private MessageHeaderCodec() {
  }

  public static byte[] encode(MessageHeader header) {
    ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE);
    encode(header, buffer);
    return buffer.array();
  }

  public static void encode(MessageHeader header, ByteBuffer buffer) {
    buffer.put(header.version());
    buffer.put(header.type());
    buffer.put((byte) header.ttl());
    buffer.put((byte) header.hopCount());
    buffer.putLong(header.messageId());
    header.senderId().writeTo(buffer);
    buffer.putShort((short) header.payloadLength());
  }

  public static MessageHeader decode(byte[] bytes) {
    if (bytes == null || bytes.length < HEADER_SIZE) {
      throw tooSmall(bytes == null ? 0 : bytes.length);
    }
    return decode(ByteBuffer.wrap(bytes));
  }

  /// Reads a header from the current position, advancing it by [#HEADER_SIZE] bytes.
  public static MessageHeader decode(ByteBuffer buffer) {
    if (buffer.remaining() < HEADER_SIZE) {
      throw tooSmall(buffer.remaining());
    }
    byte version = buffer.get();
    if (version != PROTOCOL_VERSION) {
      throw new MalformedWireException(MalformedWireException.Kind.UNSUPPORTED_VERSION,
          "Unsupported protocol version: " + (version & 0xFF));
    }
    byte type = buffer.get();
    int ttl = buffer.get() & 0xFF;
    int hopCount = buffer.get() & 0xFF;
    long messageId = buffer.getLong();
    SenderId senderId = SenderId.readFrom(buffer);
    int payloadLength = buffer.getShort() & 0xFFFF;
    return new MessageHeader(version, type, ttl, hopCount, messageId, senderId, payloadLength);
  }

  /// 64 random bits. Collisions are negligible at mesh message volumes; ordering is not implied.
  public static long generateMessageId() {
    return RANDOM.get().nextLong();
  }

  private static MalformedWireException tooSmall(int length) {
    return new MalformedWireException(MalformedWireException.Kind.DATA_TOO_SMALL,
        "Data too small for header: " + length + " < " + HEADER_SIZE);
  }
}
