// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.msg;

import java.util.Objects;
import java.util.Optional;

/// The fixed 20 byte header. `messageId` and `senderId` never change across hops, which is what makes the pair a
/// global deduplication key. `ttl` and `hopCount` only change through [#forwarded()].
///
/// @param version       protocol version byte
/// @param type          raw type byte, see [MessageType]
/// @param ttl           remaining forward budget 0-255
/// @param hopCount      forwards already performed 0-255
/// @param messageId     origin assigned id
/// @param senderId      compact id of the originating device
/// @param payloadLength length of the trailing payload 0-65535
public record MessageHeader(byte version,
                            byte type,
                            int ttl,
                            int hopCount,
                            long messageId,
                            SenderId senderId,
                            int payloadLength) {
  public static final int MAX_TTL = 255;
  public static final int MAX_PAYLOAD_LENGTH = 0xFFFF;

  public MessageHeader {
    Objects.requireNonNull(senderId, "senderId cannot be null");
    if (ttl < 0 || ttl > MAX_TTL) {
      throw new IllegalArgumentException("ttl must be between 0 and 255, got " + ttl);
    }
    if (hopCount < 0 || hopCount > MAX_TTL) {
      throw new IllegalArgumentException("hopCount must be between 0 and 255, got " + hopCount);
    }
    if (payloadLength < 0 || payloadLength > MAX_PAYLOAD_LENGTH) {
      throw new IllegalArgumentException("payloadLength must be between 0 and 65535, got " + payloadLength);
    }
  }

  /// A header for a message originating at this device.
  public static MessageHeader originate(MessageType type, int ttl, long messageId, SenderId senderId, int payloadLength) {
    return new MessageHeader(MessageHeaderCodec.PROTOCOL_VERSION, type.code(), ttl, 0, messageId, senderId, payloadLength);
  }

  public Optional<MessageType> messageType() {
    return MessageType.fromCode(type);
  }

  /// True when a forwarded copy would still carry a ttl of at least one.
  public boolean canForward() {
    return ttl > 1;
  }

  /// The copy sent on to the next hop: ttl decremented, hop count incremented, identity unchanged.
  public MessageHeader forwarded() {
    if (!canForward()) {
      throw new IllegalStateException("ttl " + ttl + " is exhausted for message " + messageId);
    }
    return new MessageHeader(version, type, ttl - 1, Math.min(hopCount + 1, MAX_TTL), messageId, senderId, payloadLength);
  }

  @Override
  public String toString() {
    return "MessageHeader[" +
        "type=" + MessageType.describe(type) +
        ", ttl=" + ttl +
        ", hopCount=" + hopCount +
        ", messageId=" + messageId +
        ", senderId=" + senderId +
        ", payloadLength=" + payloadLength +
        ']';
  }
}
