// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.crypto;

import com.github.blemesh.msg.SenderId;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

import static com.github.blemesh.MeshLogger.LOGGER;
import static com.github.blemesh.crypto.CryptoFailureException.Reason.*;

/// End to end encryption of private and channel messages.
///
/// Every envelope is signed over ciphertext, nonce and tag with the sender's Ed25519 identity key. Decryption checks
/// the signature before touching the ciphertext and never falls back to plaintext.
public class EncryptionService {
  private final KeyManager keyManager;

  public EncryptionService(KeyManager keyManager) {
    this.keyManager = Objects.requireNonNull(keyManager, "keyManager cannot be null");
  }

  public KeyManager keyManager() {
    return keyManager;
  }

  public EncryptedEnvelope encryptPrivateMessage(SenderId recipientId, byte[] recipientPublicKey, String content) {
    Objects.requireNonNull(content, "content cannot be null");
    SessionKeys session = keyManager.getSessionKeys(recipientId, recipientPublicKey);
    Crypto.Sealed sealed = Crypto.seal(session.messageKey(), content.getBytes(StandardCharsets.UTF_8), null);
    EncryptedEnvelope unsigned = new EncryptedEnvelope(sealed.ciphertext(), sealed.nonce(), sealed.tag(),
        session.ephemeralPublicKey(), null, null);
    LOGGER.finest(() -> "Encrypted private message for " + recipientId);
    return signed(unsigned);
  }

  /// @param senderPublicKey the sender's published key agreement key when known; the agreement itself uses the
  ///                        ephemeral key carried in the envelope
  public String decryptPrivateMessage(SenderId senderId, byte @Nullable [] senderPublicKey, EncryptedEnvelope envelope) {
    Objects.requireNonNull(senderId, "senderId cannot be null");
    Objects.requireNonNull(envelope, "envelope cannot be null");
    if (senderPublicKey != null && senderPublicKey.length != KeyManager.PUBLIC_KEY_SIZE) {
      throw new CryptoFailureException(MALFORMED_ENVELOPE, "Sender public key has wrong length " + senderPublicKey.length);
    }
    verifySignature(senderId, envelope);
    byte[] ephemeral = envelope.ephemeralKey()
        .orElseThrow(() -> new CryptoFailureException(MISSING_EPHEMERAL_KEY,
            "Private message from " + senderId + " carries no ephemeral key"));
    if (ephemeral.length != KeyManager.PUBLIC_KEY_SIZE) {
      throw new CryptoFailureException(MISSING_EPHEMERAL_KEY, "Ephemeral key has wrong length " + ephemeral.length);
    }
    byte[] shared = keyManager.deriveSharedSecretForDecryption(ephemeral);
    byte[] messageKey = KeyManager.messageKey(shared);
    try {
      byte[] plaintext = Crypto.open(messageKey, envelope.ciphertext(), envelope.nonce(), envelope.tag(), null,
          AUTHENTICATION_FAILED);
      return new String(plaintext, StandardCharsets.UTF_8);
    } finally {
      Arrays.fill(shared, (byte) 0);
      Arrays.fill(messageKey, (byte) 0);
    }
  }

  /// Channel name is bound in as associated data so that a ciphertext cannot be replayed into another channel
  /// sharing the same password.
  public EncryptedEnvelope encryptChannelMessage(String channelName, String content) {
    Objects.requireNonNull(content, "content cannot be null");
    byte[] key = requireChannelKey(channelName);
    Crypto.Sealed sealed = Crypto.seal(key, content.getBytes(StandardCharsets.UTF_8),
        channelName.getBytes(StandardCharsets.UTF_8));
    return signed(new EncryptedEnvelope(sealed.ciphertext(), sealed.nonce(), sealed.tag(), null, null, null));
  }

  public String decryptChannelMessage(String channelName, EncryptedEnvelope envelope) {
    return decryptChannelMessage(null, channelName, envelope);
  }

  /// As [#decryptChannelMessage(String, EncryptedEnvelope)] and also enforces the sender's pinned signing key.
  public String decryptChannelMessage(@Nullable SenderId senderId, String channelName, EncryptedEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope cannot be null");
    byte[] key = requireChannelKey(channelName);
    verifySignature(senderId, envelope);
    byte[] plaintext = Crypto.open(key, envelope.ciphertext(), envelope.nonce(), envelope.tag(),
        channelName.getBytes(StandardCharsets.UTF_8), WRONG_CHANNEL_PASSWORD);
    return new String(plaintext, StandardCharsets.UTF_8);
  }

  private byte[] requireChannelKey(String channelName) {
    Objects.requireNonNull(channelName, "channelName cannot be null");
    return keyManager.channelKey(channelName)
        .orElseThrow(() -> new CryptoFailureException(CHANNEL_NOT_JOINED, "Channel not joined: " + channelName));
  }

  private EncryptedEnvelope signed(EncryptedEnvelope unsigned) {
    byte[] signature = keyManager.sign(unsigned.signedContent());
    return unsigned.withSignature(signature, keyManager.signingPublicKey());
  }

  private void verifySignature(@Nullable SenderId senderId, EncryptedEnvelope envelope) {
    byte[] signature = envelope.signature();
    byte[] signingKey = envelope.signingPublicKey();
    if (signature == null || signingKey == null) {
      throw new CryptoFailureException(MISSING_SIGNATURE, "Envelope is not signed");
    }
    if (senderId != null) {
      Optional<byte[]> pinned = keyManager.getPeerSigningKey(senderId);
      if (pinned.isPresent() && !Arrays.equals(pinned.get(), signingKey)) {
        throw new CryptoFailureException(SIGNING_KEY_MISMATCH,
            "Envelope from " + senderId + " signed with an unexpected key");
      }
    }
    if (!keyManager.verify(envelope.signedContent(), signature, signingKey)) {
      throw new CryptoFailureException(INVALID_SIGNATURE, "Invalid envelope signature"
          + (senderId == null ? "" : " from " + senderId));
    }
  }
}
