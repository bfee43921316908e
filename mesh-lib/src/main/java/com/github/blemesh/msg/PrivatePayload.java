// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.msg;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/// Payload of a `PRIVATE` frame: the 6 byte recipient id followed by the serialized envelope. Relays only need the
/// recipient to decide that the message is not for them.
public record PrivatePayload(SenderId recipient, byte[] envelope) {

  public PrivatePayload {
    Objects.requireNonNull(recipient, "recipient cannot be null");
    Objects.requireNonNull(envelope, "envelope cannot be null");
  }

  public byte[] toBytes() {
    return ByteBuffer.allocate(SenderId.SIZE + envelope.length)
        .put(recipient.toBytes())
        .put(envelope)
        .array();
  }

  public static PrivatePayload fromBytes(byte[] bytes) {
    if (bytes.length < SenderId.SIZE) {
      throw new MalformedWireException(MalformedWireException.Kind.BAD_PAYLOAD,
          "Private payload too small for recipient id: " + bytes.length);
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    SenderId recipient = SenderId.readFrom(buffer);
    byte[] envelope = new byte[buffer.remaining()];
    buffer.get(envelope);
    return new PrivatePayload(recipient, envelope);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PrivatePayload that)) return false;
    return recipient.equals(that.recipient) && Arrays.equals(envelope, that.envelope);
  }

  @Override
  public int hashCode() {
    return 31 * recipient.hashCode() + Arrays.hashCode(envelope);
  }
}
