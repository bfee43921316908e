// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.msg;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/// Payload of a `CHANNEL` frame: channel name length (1 byte), UTF-8 channel name, serialized envelope.
public record ChannelPayload(String channel, byte[] envelope) {
  public static final int MAX_CHANNEL_BYTES = 255;

  public ChannelPayload {
    Objects.requireNonNull(channel, "channel cannot be null");
    Objects.requireNonNull(envelope, "envelope cannot be null");
    if (channel.getBytes(StandardCharsets.UTF_8).length > MAX_CHANNEL_BYTES) {
      throw new IllegalArgumentException("Channel name longer than " + MAX_CHANNEL_BYTES + " bytes: " + channel);
    }
  }

  public byte[] toBytes() {
    byte[] name = channel.getBytes(StandardCharsets.UTF_8);
    return ByteBuffer.allocate(1 + name.length + envelope.length)
        .put((byte) name.length)
        .put(name)
        .put(envelope)
        .array();
  }

  public static ChannelPayload fromBytes(byte[] bytes) {
    try {
      ByteBuffer buffer = ByteBuffer.wrap(bytes);
      byte[] name = new byte[buffer.get() & 0xFF];
      buffer.get(name);
      byte[] envelope = new byte[buffer.remaining()];
      buffer.get(envelope);
      return new ChannelPayload(new String(name, StandardCharsets.UTF_8), envelope);
    } catch (BufferUnderflowException e) {
      throw new MalformedWireException(MalformedWireException.Kind.BAD_PAYLOAD,
          "Channel payload truncated at " + bytes.length + " bytes", e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ChannelPayload that)) return false;
    return channel.equals(that.channel) && Arrays.equals(envelope, that.envelope);
  }

  @Override
  public int hashCode() {
    return 31 * channel.hashCode() + Arrays.hashCode(envelope);
  }
}
