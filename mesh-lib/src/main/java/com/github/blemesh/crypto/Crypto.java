// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/// AES-256-GCM with a fresh 12 byte nonce per call. The 16 byte tag is split off the JCE output so that the
/// envelope can carry ciphertext, nonce and tag as separate fields.
final class Crypto {
  static final int NONCE_LENGTH = 12;
  static final int TAG_LENGTH = 16;
  static final int KEY_LENGTH = 32;
  private static final int TAG_LENGTH_BITS = TAG_LENGTH * 8;

  private static final ThreadLocal<SecureRandom> RANDOM = ThreadLocal.withInitial(SecureRandom::new);
  private static final ThreadLocal<Cipher> CIPHER = ThreadLocal.withInitial(() -> {
    try {
      return Cipher.getInstance("AES/GCM/NoPadding");
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Required crypto algorithm unavailable", e);
    }
  });

  record Sealed(byte[] ciphertext, byte[] nonce, byte[] tag) {
  }

  private Crypto() {
  }

  static Sealed seal(byte[] key, byte[] plaintext, byte[] aad) {
    try {
      byte[] nonce = randomBytes(NONCE_LENGTH);
      Cipher cipher = CIPHER.get();
      cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
      if (aad != null) {
        cipher.updateAAD(aad);
      }
      byte[] output = cipher.doFinal(plaintext);
      int split = output.length - TAG_LENGTH;
      return new Sealed(Arrays.copyOfRange(output, 0, split), nonce, Arrays.copyOfRange(output, split, output.length));
    } catch (GeneralSecurityException e) {
      throw new SecurityException("Encryption failed", e);
    }
  }

  /// @param onTagMismatch reason reported when the tag does not verify, which differs for private and channel keys
  static byte[] open(byte[] key, byte[] ciphertext, byte[] nonce, byte[] tag, byte[] aad,
                     CryptoFailureException.Reason onTagMismatch) {
    if (nonce.length != NONCE_LENGTH || tag.length != TAG_LENGTH) {
      throw new CryptoFailureException(CryptoFailureException.Reason.MALFORMED_ENVELOPE,
          "Bad nonce or tag length: " + nonce.length + "/" + tag.length);
    }
    try {
      Cipher cipher = CIPHER.get();
      cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
      if (aad != null) {
        cipher.updateAAD(aad);
      }
      byte[] input = new byte[ciphertext.length + TAG_LENGTH];
      System.arraycopy(ciphertext, 0, input, 0, ciphertext.length);
      System.arraycopy(tag, 0, input, ciphertext.length, TAG_LENGTH);
      return cipher.doFinal(input);
    } catch (AEADBadTagException e) {
      throw new CryptoFailureException(onTagMismatch, "Authentication tag mismatch", e);
    } catch (GeneralSecurityException e) {
      throw new SecurityException("Decryption failed", e);
    }
  }

  static byte[] randomBytes(int length) {
    byte[] bytes = new byte[length];
    RANDOM.get().nextBytes(bytes);
    return bytes;
  }

  static SecureRandom random() {
    return RANDOM.get();
  }
}
