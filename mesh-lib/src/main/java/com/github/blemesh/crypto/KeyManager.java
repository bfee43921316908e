// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.crypto;

import com.github.blemesh.MeshConfig;
import com.github.blemesh.identity.IdentityKeyMaterial;
import com.github.blemesh.identity.IdentityStore;
import com.github.blemesh.msg.SenderId;
import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

import static com.github.blemesh.MeshLogger.LOGGER;

/// Owns this device's identity keys and everything derived from them.
///
/// Two long lived identity keys are loaded from the [IdentityStore], or generated and saved on first run: an Ed25519
/// signing key and an X25519 key agreement key. Private key bytes never leave this class except towards the store.
///
/// Per peer session keys are held as a [SessionState] in a `ConcurrentHashMap` and only ever changed inside
/// `compute`, so when two senders both find a session due for rotation exactly one derives the new session and the
/// other uses it.
///
/// Peer keys and sessions are kept for at most `peerKeyCapacity` peers. Each peer is stamped whenever its keys are
/// stored or used; past the cap the least recently active peer is forgotten, and [#forgetInactivePeers(Duration)]
/// drops peers idle for longer than a given age.
public class KeyManager {
  public static final int PUBLIC_KEY_SIZE = 32;
  public static final int SIGNATURE_SIZE = 64;
  public static final int CHANNEL_KEY_SIZE = 32;
  static final byte[] PRIVATE_MESSAGE_INFO = "ble_mesh_private_message".getBytes(StandardCharsets.UTF_8);

  private final IdentityStore store;
  private final MeshConfig config;
  private final Clock clock;

  private final Ed25519PrivateKeyParameters signingKey;
  private final byte[] signingPublicKey;
  private final X25519PrivateKeyParameters agreementKey;
  private final byte[] agreementPublicKey;

  private final Map<SenderId, SessionState> sessions = new ConcurrentHashMap<>();
  private final Map<SenderId, byte[]> peerPublicKeys = new ConcurrentHashMap<>();
  private final Map<SenderId, byte[]> peerSigningKeys = new ConcurrentHashMap<>();
  private final Map<String, byte[]> joinedChannels = new ConcurrentHashMap<>();
  private final Map<String, byte[]> derivedChannelKeys = new ConcurrentHashMap<>();
  // least recently active first; guards changes to the peer key maps
  private final LinkedHashMap<SenderId, Instant> peerActivity = new LinkedHashMap<>();
  private final List<PeerKeyListener> listeners = new CopyOnWriteArrayList<>();

  public KeyManager(IdentityStore store, MeshConfig config, Clock clock) {
    this.store = Objects.requireNonNull(store, "store cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    IdentityKeyMaterial material = store.loadIdentityKeys().orElseGet(() -> {
      IdentityKeyMaterial created = new IdentityKeyMaterial(
          new Ed25519PrivateKeyParameters(Crypto.random()).getEncoded(),
          new X25519PrivateKeyParameters(Crypto.random()).getEncoded());
      store.saveIdentityKeys(created);
      LOGGER.info("Generated new identity keys");
      return created;
    });
    this.signingKey = new Ed25519PrivateKeyParameters(material.signingSeed(), 0);
    this.signingPublicKey = signingKey.generatePublicKey().getEncoded();
    this.agreementKey = new X25519PrivateKeyParameters(material.agreementPrivateKey(), 0);
    this.agreementPublicKey = agreementKey.generatePublicKey().getEncoded();
  }

  public byte[] signingPublicKey() {
    return signingPublicKey.clone();
  }

  public byte[] agreementPublicKey() {
    return agreementPublicKey.clone();
  }

  /// Returns the current session for the peer, deriving a new one when there is none, when rotation is due or
  /// pending, or when the peer has published a different key since the session was agreed.
  public SessionKeys getSessionKeys(SenderId peerId, byte[] peerPublicKey) {
    Objects.requireNonNull(peerId, "peerId cannot be null");
    requireKeyLength(peerPublicKey);
    final byte[] peerKey = peerPublicKey.clone();
    notePeerActivity(peerId);
    SessionState state = sessions.compute(peerId, (id, current) -> {
      Instant now = clock.instant();
      if (current instanceof SessionState.Active active
          && active.keys().agreedWith(peerKey)
          && !active.shouldRotate(now, config.sessionMaxAge(), config.sessionMaxUses())) {
        return active.used();
      }
      SessionKeys fresh = deriveSession(id, peerKey, now);
      LOGGER.fine(() -> "Derived session keys for " + id + (current == null ? "" : " replacing " + describe(current)));
      return new SessionState.Active(fresh, 1);
    });
    return ((SessionState.Active) state).keys();
  }

  public SessionState sessionState(SenderId peerId) {
    return sessions.getOrDefault(peerId, SessionState.NoSession.INSTANCE);
  }

  /// Marks every session that has reached its age or use limit as [SessionState.RotationPending]. Returns how many
  /// were marked. The new session is derived lazily on next use.
  public int rotateSessionKeys() {
    Instant now = clock.instant();
    AtomicInteger marked = new AtomicInteger();
    for (SenderId peerId : sessions.keySet()) {
      sessions.computeIfPresent(peerId, (id, current) -> {
        if (current instanceof SessionState.Active active
            && active.shouldRotate(now, config.sessionMaxAge(), config.sessionMaxUses())) {
          marked.incrementAndGet();
          return new SessionState.RotationPending(active.keys());
        }
        return current;
      });
    }
    if (marked.get() > 0) {
      LOGGER.fine(() -> "Marked " + marked.get() + " sessions for rotation");
    }
    return marked.get();
  }

  private SessionKeys deriveSession(SenderId peerId, byte[] peerPublicKey, Instant now) {
    X25519PrivateKeyParameters ephemeral = new X25519PrivateKeyParameters(Crypto.random());
    byte[] shared = agree(ephemeral, peerPublicKey);
    try {
      return new SessionKeys(peerId, peerPublicKey, ephemeral.generatePublicKey().getEncoded(),
          messageKey(shared), now);
    } finally {
      Arrays.fill(shared, (byte) 0);
    }
  }

  /// Recipient side of the agreement: our identity agreement key with the sender's ephemeral public key.
  byte[] deriveSharedSecretForDecryption(byte[] ephemeralPublicKey) {
    requireKeyLength(ephemeralPublicKey);
    return agree(agreementKey, ephemeralPublicKey);
  }

  static byte[] messageKey(byte[] sharedSecret) {
    try {
      return SimpleHKDF.deriveKey(sharedSecret, PRIVATE_MESSAGE_INFO, Crypto.KEY_LENGTH);
    } catch (GeneralSecurityException e) {
      throw new SecurityException("Key derivation failed", e);
    }
  }

  private static byte[] agree(X25519PrivateKeyParameters privateKey, byte[] publicKey) {
    X25519Agreement agreement = new X25519Agreement();
    agreement.init(privateKey);
    byte[] shared = new byte[agreement.getAgreementSize()];
    try {
      agreement.calculateAgreement(new X25519PublicKeyParameters(publicKey, 0), shared, 0);
    } catch (IllegalStateException e) {
      // low order public keys produce an all zero secret which BouncyCastle rejects
      throw new CryptoFailureException(CryptoFailureException.Reason.KEY_AGREEMENT_FAILED,
          "Key agreement failed", e);
    }
    return shared;
  }

  /// Argon2id over the password with SHA-256 of the channel name as salt. Same name and password always give the
  /// same key; results are memoised.
  public byte[] deriveChannelKey(String channelName, String password) {
    Objects.requireNonNull(channelName, "channelName cannot be null");
    Objects.requireNonNull(password, "password cannot be null");
    String memoKey = channelName + '\u0000' + Base64.getEncoder().encodeToString(sha256(password));
    return derivedChannelKeys.computeIfAbsent(memoKey, k -> argon2id(channelName, password)).clone();
  }

  private byte[] argon2id(String channelName, String password) {
    LOGGER.finer(() -> "Deriving channel key for " + channelName);
    Argon2Parameters parameters = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withIterations(config.argon2Iterations())
        .withMemoryAsKB(config.argon2MemoryKiB())
        .withParallelism(config.argon2Parallelism())
        .withSalt(sha256(channelName))
        .build();
    Argon2BytesGenerator generator = new Argon2BytesGenerator();
    generator.init(parameters);
    byte[] key = new byte[CHANNEL_KEY_SIZE];
    generator.generateBytes(password.getBytes(StandardCharsets.UTF_8), key);
    return key;
  }

  public void joinChannel(String channelName, String password) {
    joinedChannels.put(channelName, deriveChannelKey(channelName, password));
    LOGGER.info(() -> "Joined channel " + channelName);
  }

  public boolean leaveChannel(String channelName) {
    String memoPrefix = channelName + '\u0000';
    derivedChannelKeys.keySet().removeIf(k -> k.startsWith(memoPrefix));
    byte[] removed = joinedChannels.remove(channelName);
    if (removed != null) {
      LOGGER.info(() -> "Left channel " + channelName);
    }
    return removed != null;
  }

  int memoisedChannelKeyCount() {
    return derivedChannelKeys.size();
  }

  public boolean isJoined(String channelName) {
    return joinedChannels.containsKey(channelName);
  }

  public Set<String> joinedChannels() {
    return Set.copyOf(joinedChannels.keySet());
  }

  Optional<byte[]> channelKey(String channelName) {
    return Optional.ofNullable(joinedChannels.get(channelName));
  }

  public byte[] sign(byte[] data) {
    Ed25519Signer signer = new Ed25519Signer();
    signer.init(true, signingKey);
    signer.update(data, 0, data.length);
    return signer.generateSignature();
  }

  /// False for any malformed key or signature rather than throwing.
  public boolean verify(byte[] data, byte[] signature, byte[] publicKey) {
    if (data == null || signature == null || publicKey == null
        || signature.length != SIGNATURE_SIZE || publicKey.length != PUBLIC_KEY_SIZE) {
      return false;
    }
    try {
      Ed25519Signer verifier = new Ed25519Signer();
      verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
      verifier.update(data, 0, data.length);
      return verifier.verifySignature(signature);
    } catch (RuntimeException e) {
      LOGGER.log(Level.FINE, "Signature verification error", e);
      return false;
    }
  }

  /// Stores a copy of the peer key agreement public key and notifies listeners.
  public void storePeerPublicKey(SenderId peerId, byte[] publicKey) {
    Objects.requireNonNull(peerId, "peerId cannot be null");
    requireKeyLength(publicKey);
    byte[] copy = publicKey.clone();
    byte[] previous;
    synchronized (peerActivity) {
      previous = peerPublicKeys.put(peerId, copy);
      notePeerActivity(peerId);
    }
    if (previous == null || !Arrays.equals(previous, copy)) {
      LOGGER.fine(() -> "Stored public key for " + peerId);
    }
    for (PeerKeyListener listener : listeners) {
      try {
        listener.onPeerKeyStored(peerId, copy.clone());
      } catch (RuntimeException e) {
        LOGGER.log(Level.WARNING, "Peer key listener failed for " + peerId, e);
      }
    }
  }

  public Optional<byte[]> getPeerPublicKey(SenderId peerId) {
    return Optional.ofNullable(peerPublicKeys.get(peerId)).map(byte[]::clone);
  }

  public boolean removePeerPublicKey(SenderId peerId) {
    boolean removed = peerPublicKeys.remove(peerId) != null;
    sessions.remove(peerId);
    return removed;
  }

  public void addPeerKeyListener(PeerKeyListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
  }

  /// First signing key seen for a peer is pinned. Returns false when a different key is presented later.
  public boolean pinPeerSigningKey(SenderId peerId, byte[] signingKey) {
    requireKeyLength(signingKey);
    byte[] pinned;
    synchronized (peerActivity) {
      pinned = peerSigningKeys.putIfAbsent(peerId, signingKey.clone());
      if (pinned == null) {
        notePeerActivity(peerId);
      }
    }
    return pinned == null || Arrays.equals(pinned, signingKey);
  }

  /// Forgets keys, pins and sessions of peers not active within `maxIdle`. Returns the peers forgotten.
  public List<SenderId> forgetInactivePeers(Duration maxIdle) {
    Instant cutoff = clock.instant().minus(maxIdle);
    List<SenderId> forgotten = new ArrayList<>();
    synchronized (peerActivity) {
      Iterator<Map.Entry<SenderId, Instant>> eldest = peerActivity.entrySet().iterator();
      while (eldest.hasNext()) {
        Map.Entry<SenderId, Instant> entry = eldest.next();
        if (!entry.getValue().isBefore(cutoff)) {
          break;
        }
        eldest.remove();
        forget(entry.getKey());
        forgotten.add(entry.getKey());
      }
    }
    if (!forgotten.isEmpty()) {
      LOGGER.fine(() -> "Forgot keys of " + forgotten.size() + " inactive peers");
    }
    return forgotten;
  }

  /// Refreshes the activity stamp of a peer whose keys are held. Unknown peers are ignored.
  public void touchPeer(SenderId peerId) {
    synchronized (peerActivity) {
      if (peerActivity.containsKey(peerId)) {
        notePeerActivity(peerId);
      }
    }
  }

  /// Number of peers whose keys or sessions are held.
  public int knownPeerCount() {
    synchronized (peerActivity) {
      return peerActivity.size();
    }
  }

  /// Moves the peer to the most recent end and evicts from the eldest end beyond the cap.
  private void notePeerActivity(SenderId peerId) {
    synchronized (peerActivity) {
      peerActivity.remove(peerId);
      peerActivity.put(peerId, clock.instant());
      Iterator<SenderId> eldest = peerActivity.keySet().iterator();
      while (peerActivity.size() > config.peerKeyCapacity()) {
        SenderId evicted = eldest.next();
        eldest.remove();
        forget(evicted);
        LOGGER.fine(() -> "Evicted keys of " + evicted + " at capacity " + config.peerKeyCapacity());
      }
    }
  }

  private void forget(SenderId peerId) {
    peerPublicKeys.remove(peerId);
    peerSigningKeys.remove(peerId);
    sessions.remove(peerId);
  }

  public Optional<byte[]> getPeerSigningKey(SenderId peerId) {
    return Optional.ofNullable(peerSigningKeys.get(peerId)).map(byte[]::clone);
  }

  /// Forgets session keys, channel keys and every stored peer key. The identity keys are kept; call
  /// [#deleteIdentity()] to remove those from the store as well.
  public void clearAllKeys() {
    sessions.clear();
    joinedChannels.clear();
    derivedChannelKeys.clear();
    synchronized (peerActivity) {
      peerPublicKeys.clear();
      peerSigningKeys.clear();
      peerActivity.clear();
    }
    LOGGER.info("Cleared all derived and peer keys");
  }

  /// Removes the identity keys from the store. This instance keeps working with the old keys until discarded.
  public void deleteIdentity() {
    store.clearIdentityKeys();
    LOGGER.warning("Identity keys deleted from store");
  }

  private static void requireKeyLength(byte[] key) {
    Objects.requireNonNull(key, "key cannot be null");
    if (key.length != PUBLIC_KEY_SIZE) {
      throw new IllegalArgumentException("Key must be " + PUBLIC_KEY_SIZE + " bytes, got " + key.length);
    }
  }

  private static byte[] sha256(String value) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }

  private static String describe(SessionState state) {
    return state.getClass().getSimpleName();
  }
}
