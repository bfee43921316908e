// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.crypto;

/// A message that fails any cryptographic check is dropped whole. Nothing in it is trusted and it is never treated
/// as plaintext.
public class CryptoFailureException extends SecurityException {

  public enum Reason {
    INVALID_SIGNATURE,
    MISSING_SIGNATURE,
    SIGNING_KEY_MISMATCH,
    MISSING_EPHEMERAL_KEY,
    AUTHENTICATION_FAILED,
    WRONG_CHANNEL_PASSWORD,
    CHANNEL_NOT_JOINED,
    UNKNOWN_RECIPIENT_KEY,
    MALFORMED_ENVELOPE,
    KEY_AGREEMENT_FAILED
  }

  private final Reason reason;

  public CryptoFailureException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public CryptoFailureException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  /// True for the "wrong password / channel not joined" outcome of a channel decrypt.
  public boolean isChannelAccessFailure() {
    return reason == Reason.WRONG_CHANNEL_PASSWORD || reason == Reason.CHANNEL_NOT_JOINED;
  }
}
