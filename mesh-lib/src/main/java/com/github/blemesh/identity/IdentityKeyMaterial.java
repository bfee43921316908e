// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.identity;

import java.util.Arrays;
import java.util.Objects;

/// The private halves of the two long lived identity keys: a 32 byte Ed25519 seed and a 32 byte X25519 private key.
/// This only travels between the key manager and an [IdentityStore].
public record IdentityKeyMaterial(byte[] signingSeed, byte[] agreementPrivateKey) {
  public static final int KEY_SIZE = 32;

  public IdentityKeyMaterial {
    Objects.requireNonNull(signingSeed, "signingSeed cannot be null");
    Objects.requireNonNull(agreementPrivateKey, "agreementPrivateKey cannot be null");
    if (signingSeed.length != KEY_SIZE || agreementPrivateKey.length != KEY_SIZE) {
      throw new IllegalArgumentException("Identity keys must be " + KEY_SIZE + " bytes");
    }
    signingSeed = signingSeed.clone();
    agreementPrivateKey = agreementPrivateKey.clone();
  }

  @Override
  public byte[] signingSeed() {
    return signingSeed.clone();
  }

  @Override
  public byte[] agreementPrivateKey() {
    return agreementPrivateKey.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof IdentityKeyMaterial that)) return false;
    return Arrays.equals(signingSeed, that.signingSeed) && Arrays.equals(agreementPrivateKey, that.agreementPrivateKey);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(signingSeed) + Arrays.hashCode(agreementPrivateKey);
  }

  @Override
  public String toString() {
    return "IdentityKeyMaterial[redacted]";
  }
}
