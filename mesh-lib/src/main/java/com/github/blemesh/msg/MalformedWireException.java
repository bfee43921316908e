// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.msg;

/// Thrown when bytes from a link cannot be decoded. Fatal to the single frame only, never to the link.
public class MalformedWireException extends IllegalArgumentException {

  public enum Kind {
    DATA_TOO_SMALL,
    UNSUPPORTED_VERSION,
    PAYLOAD_TRUNCATED,
    BAD_SENDER_ID,
    BAD_PAYLOAD
  }

  private final Kind kind;

  public MalformedWireException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public MalformedWireException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
