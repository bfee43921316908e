// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;

/// RFC 5869 HKDF over HmacSHA256. JDK 17 has no KDF API so we carry this small implementation.
public final class SimpleHKDF {
  private static final String HMAC = "HmacSHA256";
  private static final int HASH_LENGTH = 32;

  private SimpleHKDF() {
  }

  public static byte[] extract(byte[] salt, byte[] ikm) throws GeneralSecurityException {
    if (salt == null || salt.length == 0) {
      salt = new byte[HASH_LENGTH];
    }
    Mac mac = Mac.getInstance(HMAC);
    mac.init(new SecretKeySpec(salt, HMAC));
    return mac.doFinal(ikm);
  }

  public static byte[] expand(byte[] prk, byte[] info, int length) throws GeneralSecurityException {
    if (length < 1 || length > 255 * HASH_LENGTH) {
      throw new IllegalArgumentException("HKDF output length out of range: " + length);
    }
    Mac mac = Mac.getInstance(HMAC);
    mac.init(new SecretKeySpec(prk, HMAC));

    byte[] result = new byte[length];
    byte[] t = new byte[0];
    int offset = 0;
    for (int i = 1; offset < length; i++) {
      mac.update(t);
      if (info != null) {
        mac.update(info);
      }
      mac.update((byte) i);
      t = mac.doFinal();
      int chunkLength = Math.min(t.length, length - offset);
      System.arraycopy(t, 0, result, offset, chunkLength);
      offset += chunkLength;
    }
    return result;
  }

  /// Extract with an all zero salt then expand.
  public static byte[] deriveKey(byte[] ikm, byte[] info, int length) throws GeneralSecurityException {
    return expand(extract(null, ikm), info, length);
  }
}
