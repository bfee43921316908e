// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh;

import com.github.blemesh.crypto.CryptoFailureException;
import com.github.blemesh.crypto.EncryptedEnvelope;
import com.github.blemesh.crypto.EncryptionService;
import com.github.blemesh.crypto.KeyManager;
import com.github.blemesh.identity.DeviceIdentity;
import com.github.blemesh.identity.IdentityStore;
import com.github.blemesh.msg.ChannelPayload;
import com.github.blemesh.msg.MalformedWireException;
import com.github.blemesh.msg.MeshFrame;
import com.github.blemesh.msg.MessageHeader;
import com.github.blemesh.msg.MessageHeaderCodec;
import com.github.blemesh.msg.MessageType;
import com.github.blemesh.msg.PeerAnnouncement;
import com.github.blemesh.msg.PrivatePayload;
import com.github.blemesh.msg.SenderId;
import com.github.blemesh.network.MeshTransport;
import com.github.blemesh.network.TransportListener;
import com.github.blemesh.peer.Blocklist;
import com.github.blemesh.peer.BlocklistStore;
import com.github.blemesh.peer.CapacityExceededException;
import com.github.blemesh.peer.Peer;
import com.github.blemesh.peer.PeerConnectionState;
import com.github.blemesh.peer.PeerDescriptor;
import com.github.blemesh.peer.PeerEvent;
import com.github.blemesh.peer.PeerRegistry;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.TestOnly;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;

import static com.github.blemesh.MeshLogger.LOGGER;

/// Flood forwarding mesh node.
///
/// Outbound messages get a fresh id, the configured ttl and hop count zero, are recorded in the [MessageCache] so
/// that echoes are ignored, and are handed to the transport for every connected link.
///
/// Inbound frames are decoded, checked against the blocklist, and claimed in the cache with an atomic insert. The
/// first claim surfaces the message once (decrypting if it is addressed to us) and, while `ttl > 1`, forwards a copy
/// with `ttl - 1` and `hopCount + 1` to every connected link except the one it arrived on. Later claims are dropped
/// silently. The cache entry is written before any forward is attempted so a message is never retried: delivery is
/// at most once and best effort.
///
/// Each link may call [#onBytesReceived(String, byte[])] on its own thread. Every frame is processed inside its own
/// guard so a failure on one link never reaches another.
public class MeshEngine implements TransportListener, AutoCloseable {
  static final String CACHE_SWEEP = "cache-sweep";
  static final String STALE_PEER_SWEEP = "stale-peer-sweep";
  static final String CONNECTION_TIMEOUTS = "connection-timeouts";
  static final String METRICS = "forwarding-metrics";

  private final MeshConfig config;
  private final MeshTransport transport;
  private final Clock clock;
  private final SenderId self;
  private final KeyManager keyManager;
  private final EncryptionService encryption;
  private final PeerRegistry registry;
  private final MessageCache cache;
  private final MaintenanceScheduler scheduler;
  private final ForwardingStats stats = new ForwardingStats();
  private final AtomicBoolean running = new AtomicBoolean(false);

  private final EventStream<InboundMessage> messages;
  private final EventStream<PeerEvent> peerEvents;
  private final EventStream<MeshEvent> meshEvents;

  private MeshEngine(Builder builder) {
    this.config = builder.config;
    this.transport = builder.transport;
    this.clock = builder.clock;
    DeviceIdentity identity = new DeviceIdentity(builder.identityStore);
    this.self = identity.compactId();
    this.keyManager = new KeyManager(builder.identityStore, config, clock);
    this.encryption = new EncryptionService(keyManager);
    this.messages = new EventStream<>("messages", config.eventQueueCapacity());
    this.peerEvents = new EventStream<>("peer-events", config.eventQueueCapacity());
    this.meshEvents = new EventStream<>("mesh-events", config.eventQueueCapacity());
    this.registry = new PeerRegistry(clock, new Blocklist(builder.blocklistStore), config.maxConnections(), peerEvents);
    this.cache = new MessageCache(config, clock);
    this.scheduler = new MaintenanceScheduler(self.toString());
    transport.bind(this);
  }

  public static Builder builder() {
    return new Builder();
  }

  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    scheduler.schedule(CACHE_SWEEP, config.cacheSweepInterval(), this::sweepCache);
    scheduler.schedule(STALE_PEER_SWEEP, config.stalePeerSweepInterval(), this::sweepStalePeers);
    scheduler.schedule(CONNECTION_TIMEOUTS, config.connectionTimeoutCheckInterval(), this::enforceConnectionTimeouts);
    scheduler.schedule(METRICS, config.metricsInterval(), this::publishMetrics);
    LOGGER.info(() -> "Mesh started as " + self + " (" + config.nickname() + ")");
    meshEvents.publish(MeshEvent.of(MeshEvent.Type.MESH_STARTED, clock.instant(), "Mesh started as " + self));
  }

  /// Cancels the background tasks and closes every live link.
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    scheduler.cancelAll();
    for (Peer peer : registry.connectedPeers()) {
      peer.knownSenderId().flatMap(this::beginDisconnectQuietly)
          .ifPresentOrElse(p -> closeLink(p.connectionId()), () -> closeLink(peer.connectionId()));
    }
    LOGGER.info(() -> "Mesh stopped " + self);
    meshEvents.publish(MeshEvent.of(MeshEvent.Type.MESH_STOPPED, clock.instant(), "Mesh stopped"));
  }

  @Override
  public void close() {
    stop();
    scheduler.close();
  }

  public boolean isRunning() {
    return running.get();
  }

  // ---------------------------------------------------------------- sending

  public long sendPublicMessage(String content) {
    Objects.requireNonNull(content, "content cannot be null");
    return originate(MessageType.PUBLIC, content.getBytes(StandardCharsets.UTF_8));
  }

  /// @throws CryptoFailureException with `UNKNOWN_RECIPIENT_KEY` when no announcement from the recipient has been
  ///                                seen
  public long sendPrivateMessage(SenderId recipient, String content) {
    Objects.requireNonNull(recipient, "recipient cannot be null");
    byte[] recipientKey = keyManager.getPeerPublicKey(recipient)
        .orElseThrow(() -> new CryptoFailureException(CryptoFailureException.Reason.UNKNOWN_RECIPIENT_KEY,
            "No public key known for " + recipient));
    EncryptedEnvelope envelope = encryption.encryptPrivateMessage(recipient, recipientKey, content);
    return originate(MessageType.PRIVATE, new PrivatePayload(recipient, envelope.toBytes()).toBytes());
  }

  /// @throws CryptoFailureException with `CHANNEL_NOT_JOINED` unless [#joinChannel(String, String)] was called
  public long sendChannelMessage(String channel, String content) {
    EncryptedEnvelope envelope = encryption.encryptChannelMessage(channel, content);
    return originate(MessageType.CHANNEL, new ChannelPayload(channel, envelope.toBytes()).toBytes());
  }

  public void joinChannel(String channel, String password) {
    keyManager.joinChannel(channel, password);
  }

  public boolean leaveChannel(String channel) {
    return keyManager.leaveChannel(channel);
  }

  public Set<String> joinedChannels() {
    return keyManager.joinedChannels();
  }

  private long originate(MessageType type, byte[] payload) {
    requireRunning();
    long messageId = MessageHeaderCodec.generateMessageId();
    MeshFrame frame = MeshFrame.originate(type, config.defaultTtl(), self, messageId, payload);
    cache.insert(self, messageId);
    byte[] bytes = frame.toBytes();
    List<String> links = registry.connectedConnectionIds();
    for (String link : links) {
      sendTo(link, bytes);
    }
    stats.sent.increment();
    LOGGER.finer(() -> "Sent " + frame.header() + " to " + links.size() + " links");
    return messageId;
  }

  private void sendAnnouncement(String connectionId) {
    String nickname = PeerAnnouncement.fitNickname(config.nickname());
    byte[] agreementKey = keyManager.agreementPublicKey();
    byte[] signingKey = keyManager.signingPublicKey();
    byte[] signature = keyManager.sign(PeerAnnouncement.signedContent(self, nickname, agreementKey, signingKey));
    byte[] payload = new PeerAnnouncement(nickname, agreementKey, signingKey, signature).toBytes();
    long messageId = MessageHeaderCodec.generateMessageId();
    MeshFrame frame = MeshFrame.originate(MessageType.PEER_ANNOUNCEMENT, config.defaultTtl(), self, messageId, payload);
    cache.insert(self, messageId);
    sendTo(connectionId, frame.toBytes());
    LOGGER.finer(() -> "Announced " + self + " on " + connectionId);
  }

  private void sendTo(String connectionId, byte[] bytes) {
    CompletableFuture<Void> handoff;
    try {
      handoff = transport.sendBytes(connectionId, bytes);
    } catch (RuntimeException e) {
      handoff = CompletableFuture.failedFuture(e);
    }
    handoff.whenComplete((ignored, error) -> {
      if (error != null) {
        stats.sendFailures.increment();
        LOGGER.warning(() -> "Send to " + connectionId + " failed: " + error.getMessage());
        meshEvents.publish(MeshEvent.about(MeshEvent.Type.SEND_FAILED, clock.instant(),
            String.valueOf(error.getMessage()), connectionId));
      }
    });
  }

  // ---------------------------------------------------------------- receiving

  @Override
  public void onBytesReceived(String connectionId, byte[] bytes) {
    if (!running.get()) {
      LOGGER.finest(() -> "Dropping " + bytes.length + " bytes from " + connectionId + " while stopped");
      return;
    }
    try {
      registry.touch(connectionId);
      MeshFrame frame;
      try {
        frame = MeshFrame.fromBytes(bytes);
      } catch (MalformedWireException e) {
        malformed(connectionId, e);
        return;
      }
      process(connectionId, frame);
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, "Failed processing frame from " + connectionId, e);
      meshEvents.publish(MeshEvent.about(MeshEvent.Type.ERROR, clock.instant(),
          String.valueOf(e.getMessage()), connectionId));
    }
  }

  private void process(String connectionId, MeshFrame frame) {
    MessageHeader header = frame.header();
    SenderId sender = header.senderId();
    stats.received.increment();
    if (sender.equals(self)) {
      LOGGER.finest(() -> "Ignoring echo of own message " + header.messageId());
      return;
    }
    if (registry.isBlocked(sender) || registry.isLinkBlocked(connectionId)) {
      stats.blocked.increment();
      LOGGER.fine(() -> "Dropping " + header + " from blocked peer via " + connectionId);
      if (header.hopCount() == 0) {
        registry.bindSenderId(connectionId, sender, null)
            .ifPresent(binding -> binding.linksToClose().forEach(this::closeLink));
      }
      return;
    }
    if (!cache.insert(sender, header.messageId())) {
      stats.duplicates.increment();
      LOGGER.finest(() -> "Duplicate " + header + " via " + connectionId);
      return;
    }
    stats.cacheMisses.increment();
    registry.recordTraffic(sender, header.hopCount());
    keyManager.touchPeer(sender);

    boolean relay;
    try {
      relay = deliver(connectionId, frame);
    } catch (CryptoFailureException e) {
      stats.cryptoFailures.increment();
      LOGGER.warning(() -> "Crypto failure " + e.reason() + " on " + header + ": " + e.getMessage());
      meshEvents.publish(new MeshEvent(MeshEvent.Type.CRYPTO_FAILURE, clock.instant(),
          e.reason() + ": " + e.getMessage(), sender.toString(), null));
      relay = header.type() == MessageType.CHANNEL.code();
    } catch (MalformedWireException e) {
      malformed(connectionId, e);
      relay = false;
    }
    if (relay) {
      forward(connectionId, frame);
    }
  }

  /// Surfaces the frame locally where appropriate. Returns whether it should still be relayed.
  private boolean deliver(String connectionId, MeshFrame frame) {
    MessageHeader header = frame.header();
    Optional<MessageType> type = header.messageType();
    if (type.isEmpty()) {
      LOGGER.fine(() -> "Relaying unknown message type " + MessageType.describe(header.type()));
      return true;
    }
    switch (type.get()) {
      case PUBLIC:
        surface(MessageType.PUBLIC, connectionId, header, new String(frame.payload(), StandardCharsets.UTF_8), null);
        return true;
      case PRIVATE:
        return deliverPrivate(connectionId, header, PrivatePayload.fromBytes(frame.payload()));
      case CHANNEL:
        deliverChannel(connectionId, header, ChannelPayload.fromBytes(frame.payload()));
        return true;
      case PEER_ANNOUNCEMENT:
        acceptAnnouncement(connectionId, header, PeerAnnouncement.fromBytes(frame.payload()));
        return true;
      default:
        return true;
    }
  }

  private boolean deliverPrivate(String connectionId, MessageHeader header, PrivatePayload payload) {
    if (!payload.recipient().equals(self)) {
      return true;
    }
    SenderId sender = header.senderId();
    EncryptedEnvelope envelope = EncryptedEnvelope.fromBytes(payload.envelope());
    String content = encryption.decryptPrivateMessage(sender, keyManager.getPeerPublicKey(sender).orElse(null),
        envelope);
    surface(MessageType.PRIVATE, connectionId, header, content, null);
    return false;
  }

  private void deliverChannel(String connectionId, MessageHeader header, ChannelPayload payload) {
    if (!keyManager.isJoined(payload.channel())) {
      return;
    }
    EncryptedEnvelope envelope = EncryptedEnvelope.fromBytes(payload.envelope());
    String content = encryption.decryptChannelMessage(header.senderId(), payload.channel(), envelope);
    surface(MessageType.CHANNEL, connectionId, header, content, payload.channel());
  }

  private void acceptAnnouncement(String connectionId, MessageHeader header, PeerAnnouncement announcement) {
    SenderId sender = header.senderId();
    if (!keyManager.verify(announcement.signedContent(sender), announcement.signature(), announcement.signingKey())) {
      throw new CryptoFailureException(CryptoFailureException.Reason.INVALID_SIGNATURE,
          "Announcement from " + sender + " has an invalid signature");
    }
    if (!keyManager.pinPeerSigningKey(sender, announcement.signingKey())) {
      throw new CryptoFailureException(CryptoFailureException.Reason.SIGNING_KEY_MISMATCH,
          "Announcement from " + sender + " uses a different signing key");
    }
    keyManager.storePeerPublicKey(sender, announcement.agreementKey());
    if (header.hopCount() == 0) {
      registry.bindSenderId(connectionId, sender, announcement.nickname())
          .ifPresent(binding -> binding.linksToClose().forEach(this::closeLink));
    }
    LOGGER.fine(() -> "Announcement from " + sender + " (" + announcement.nickname() + ") at hop "
        + header.hopCount());
  }

  private void surface(MessageType type, String connectionId, MessageHeader header, String content,
                       @Nullable String channel) {
    messages.publish(new InboundMessage(type, header.senderId(), header.messageId(), content, channel,
        header.hopCount(), header.ttl(), connectionId, clock.instant()));
    stats.delivered.increment();
  }

  /// Sends a copy with ttl - 1 and hop + 1 to every live link except the one the frame arrived on.
  private void forward(String origin, MeshFrame frame) {
    if (!frame.header().canForward()) {
      LOGGER.finest(() -> "TTL exhausted for " + frame.header());
      return;
    }
    MeshFrame forwarded = frame.forwarded();
    byte[] bytes = forwarded.toBytes();
    int targets = 0;
    for (String link : registry.connectedConnectionIds()) {
      if (link.equals(origin)) {
        continue;
      }
      sendTo(link, bytes);
      targets++;
    }
    if (targets > 0) {
      stats.forwarded.increment();
      final int count = targets;
      LOGGER.finer(() -> "Forwarded " + forwarded.header() + " to " + count + " links");
    }
  }

  private void malformed(String connectionId, MalformedWireException e) {
    stats.malformed.increment();
    LOGGER.fine(() -> "Malformed frame from " + connectionId + ": " + e.kind() + " " + e.getMessage());
    meshEvents.publish(MeshEvent.about(MeshEvent.Type.MALFORMED_MESSAGE, clock.instant(),
        e.kind() + ": " + e.getMessage(), connectionId));
  }

  // ---------------------------------------------------------------- links

  @Override
  public void onPeerDiscovered(PeerDescriptor descriptor) {
    Peer peer = registry.addOrUpdateDiscovered(descriptor);
    if (config.autoConnect() && running.get() && peer.canConnect() && registry.hasFreeSlot()) {
      try {
        connect(peer.senderId());
      } catch (IllegalStateException e) {
        LOGGER.fine(() -> "Auto connect to " + peer.displayId() + " skipped: " + e.getMessage());
      }
    }
  }

  @Override
  public void onPeerConnected(String connectionId) {
    if (registry.markConnected(connectionId)) {
      LOGGER.info(() -> "Link up " + connectionId);
      if (running.get()) {
        sendAnnouncement(connectionId);
      }
    } else {
      closeLink(connectionId);
    }
  }

  @Override
  public void onPeerDisconnected(String connectionId) {
    registry.markDisconnected(connectionId)
        .ifPresent(p -> LOGGER.info(() -> "Link down " + connectionId + " (" + p.displayId() + ")"));
  }

  /// Starts a connection to a known peer.
  ///
  /// @throws CapacityExceededException when every link slot is in use
  /// @throws IllegalStateException     when the peer is blocked or already connecting or connected
  public CompletableFuture<Void> connect(SenderId peerId) {
    Peer peer = registry.beginConnect(peerId);
    String connectionId = peer.connectionId();
    CompletableFuture<Void> attempt;
    try {
      attempt = transport.connect(connectionId);
    } catch (RuntimeException e) {
      attempt = CompletableFuture.failedFuture(e);
    }
    return attempt.whenComplete((ignored, error) -> {
      if (error != null) {
        LOGGER.warning(() -> "Connect to " + peerId + " failed: " + error.getMessage());
        registry.markDisconnected(connectionId);
      }
    });
  }

  public boolean disconnect(SenderId peerId) {
    Optional<Peer> peer = registry.beginDisconnect(peerId);
    peer.ifPresent(p -> closeLink(p.connectionId()));
    return peer.isPresent();
  }

  /// Blocks the peer persistently and closes any link to it.
  public void block(SenderId peerId) {
    registry.block(peerId).ifPresent(p -> closeLink(p.connectionId()));
  }

  public boolean unblock(SenderId peerId) {
    return registry.unblock(peerId);
  }

  public boolean isBlocked(SenderId peerId) {
    return registry.isBlocked(peerId);
  }

  public Set<SenderId> blockedPeers() {
    return registry.blocklist().blockedPeers();
  }

  private Optional<Peer> beginDisconnectQuietly(SenderId peerId) {
    try {
      return registry.beginDisconnect(peerId);
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  private void closeLink(String connectionId) {
    try {
      transport.disconnect(connectionId);
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, "Transport disconnect of " + connectionId + " failed", e);
    }
  }

  // ---------------------------------------------------------------- maintenance

  void sweepCache() {
    cache.purgeExpired();
  }

  void sweepStalePeers() {
    registry.removeStalePeers(config.stalePeerTimeout());
    keyManager.forgetInactivePeers(config.peerKeyExpiration());
  }

  void enforceConnectionTimeouts() {
    for (Peer peer : registry.expireConnectionAttempts(config.connectionTimeout())) {
      LOGGER.warning(() -> "Connection to " + peer.displayId() + " timed out");
      closeLink(peer.connectionId());
      meshEvents.publish(MeshEvent.about(MeshEvent.Type.CONNECTION_TIMEOUT, clock.instant(),
          "Connection attempt timed out after " + config.connectionTimeout(), peer.displayId()));
    }
  }

  void publishMetrics() {
    meshEvents.publish(MeshEvent.metrics(clock.instant(), stats()));
  }

  /// Marks aged sessions for rotation on next use.
  public int rotateSessionKeys() {
    return keyManager.rotateSessionKeys();
  }

  // ---------------------------------------------------------------- queries

  public SenderId senderId() {
    return self;
  }

  public String nickname() {
    return config.nickname();
  }

  public MeshConfig config() {
    return config;
  }

  public List<Peer> peers() {
    return registry.peers();
  }

  public List<Peer> connectedPeers() {
    return registry.connectedPeers();
  }

  public Optional<Peer> findPeer(SenderId peerId) {
    return registry.findBySenderId(peerId);
  }

  public Optional<PeerConnectionState> connectionState(SenderId peerId) {
    return registry.connectionState(peerId);
  }

  public EventStream<InboundMessage> messages() {
    return messages;
  }

  public EventStream<PeerEvent> peerEvents() {
    return peerEvents;
  }

  public EventStream<MeshEvent> meshEvents() {
    return meshEvents;
  }

  public ForwardingStats.Snapshot stats() {
    return stats.snapshot(cache.size());
  }

  public MessageCache.CacheStats cacheStats() {
    return cache.stats();
  }

  public KeyManager keyManager() {
    return keyManager;
  }

  @TestOnly
  MessageCache cache() {
    return cache;
  }

  @TestOnly
  boolean isScheduled(String task) {
    return scheduler.isScheduled(task);
  }

  public static final class Builder {
    private MeshConfig config = MeshConfig.defaults();
    private MeshTransport transport;
    private IdentityStore identityStore;
    private BlocklistStore blocklistStore;
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    public Builder config(MeshConfig config) {
      this.config = Objects.requireNonNull(config, "config cannot be null");
      return this;
    }

    public Builder transport(MeshTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport cannot be null");
      return this;
    }

    public Builder identityStore(IdentityStore identityStore) {
      this.identityStore = Objects.requireNonNull(identityStore, "identityStore cannot be null");
      return this;
    }

    public Builder blocklistStore(BlocklistStore blocklistStore) {
      this.blocklistStore = Objects.requireNonNull(blocklistStore, "blocklistStore cannot be null");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock cannot be null");
      return this;
    }

    /// Volatile stores are used where none were given.
    public MeshEngine build() {
      Objects.requireNonNull(transport, "transport must be set");
      if (identityStore == null) {
        identityStore = IdentityStore.inMemory();
      }
      if (blocklistStore == null) {
        blocklistStore = BlocklistStore.inMemory();
      }
      return new MeshEngine(this);
    }
  }

  private void requireRunning() {
    if (!running.get()) {
      throw new IllegalStateException("Mesh is not running");
    }
  }
}
