// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.msg;

import java.util.Optional;

/// The one byte message type carried in every header. The wire codec accepts any byte value; only the engine
/// interprets it.
public enum MessageType {
  PUBLIC((byte) 0x01),
  PRIVATE((byte) 0x02),
  CHANNEL((byte) 0x03),
  PEER_ANNOUNCEMENT((byte) 0x04),
  ACKNOWLEDGMENT((byte) 0x05),
  KEY_EXCHANGE((byte) 0x06),
  STORE_FORWARD((byte) 0x07),
  ROUTING_UPDATE((byte) 0x08);

  private final byte code;

  MessageType(byte code) {
    this.code = code;
  }

  public byte code() {
    return code;
  }

  public static Optional<MessageType> fromCode(byte code) {
    for (MessageType type : values()) {
      if (type.code == code) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  public static String describe(byte code) {
    return fromCode(code).map(Enum::name).orElse("UNKNOWN(" + code + ")");
  }
}
