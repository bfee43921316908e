// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.peer;

import com.github.blemesh.EventStream;
import com.github.blemesh.msg.SenderId;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.github.blemesh.MeshLogger.LOGGER;

/// Every known peer and its link state.
///
/// Records live in one arena keyed by a stable handle. Two indexes point into it: by transport connection id and by
/// sender id. A peer first seen only by connection id gains a sender id entry when its announcement arrives, and any
/// older record for the same sender id is folded into it, so a device is never represented twice. A folded record
/// that still holds a link is not dropped: it moves to `DISCONNECTING` and stays addressable by its connection id
/// until the transport reports the link gone.
///
/// All methods hold the registry monitor, which gives each state change compare-and-transition semantics. Events are
/// published after each change while the monitor is held so every stream observes changes in the order they happen.
public class PeerRegistry {
  public static final String UNKNOWN_NICKNAME = "Unknown";

  private final Clock clock;
  private final Blocklist blocklist;
  private final int maxConnections;
  private final EventStream<PeerEvent> events;

  private final Map<Long, Peer> arena = new LinkedHashMap<>();
  private final Map<String, Long> byConnection = new HashMap<>();
  private final Map<SenderId, Long> bySender = new HashMap<>();
  private long nextHandle = 1;

  public PeerRegistry(Clock clock, Blocklist blocklist, int maxConnections, EventStream<PeerEvent> events) {
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    this.blocklist = Objects.requireNonNull(blocklist, "blocklist cannot be null");
    this.events = Objects.requireNonNull(events, "events cannot be null");
    if (maxConnections < 1) {
      throw new IllegalArgumentException("maxConnections must be positive, got " + maxConnections);
    }
    this.maxConnections = maxConnections;
  }

  /// Inserts an unseen peer as `DISCOVERED`, or refreshes the signal strength and last seen time of a known one
  /// without changing its identity or state.
  public synchronized Peer addOrUpdateDiscovered(PeerDescriptor descriptor) {
    Instant now = clock.instant();
    SenderId senderId = descriptor.senderId();
    Long handle = senderId != null ? bySender.get(senderId) : null;
    if (handle == null) {
      handle = byConnection.get(descriptor.connectionId());
    }
    if (handle == null) {
      long created = nextHandle++;
      Peer peer = new Peer(created, senderId, descriptor.connectionId(),
          descriptor.nickname() != null ? descriptor.nickname() : UNKNOWN_NICKNAME,
          descriptor.rssi(), now, PeerConnectionState.DISCOVERED, now,
          blocklist.isBlocked(senderId), 0, null);
      store(peer);
      LOGGER.fine(() -> "Discovered " + peer.displayId() + " on " + peer.connectionId() + " rssi " + peer.rssi());
      publish(PeerEvent.Type.DISCOVERED, peer, now);
      return peer;
    }
    Peer existing = arena.get(handle).withSighting(descriptor.rssi(), now);
    String nickname = descriptor.nickname() != null ? descriptor.nickname() : existing.nickname();
    if (senderId != null && existing.senderId() == null) {
      return identify(existing, senderId, nickname).peer();
    }
    String connectionId = existing.connectionId();
    if (!connectionId.equals(descriptor.connectionId()) && !existing.state().occupiesSlot()
        && !addressHeldByOther(descriptor.connectionId(), existing.handle())) {
      // the device is advertising from a new address and has no live link on the old one
      connectionId = descriptor.connectionId();
    }
    Peer updated = existing.withIdentity(existing.senderId(), connectionId, nickname);
    store(updated);
    return updated;
  }

  /// Associates a sender id with the peer on a live connection, merging away any separate record already holding
  /// that sender id. If that record holds its own link the binding reports it as displaced. Returns empty when the
  /// connection is unknown.
  public synchronized Optional<PeerBinding> bindSenderId(String connectionId, SenderId senderId,
                                                         @Nullable String nickname) {
    Long handle = byConnection.get(connectionId);
    if (handle == null) {
      return Optional.empty();
    }
    Peer peer = arena.get(handle);
    String name = nickname != null ? nickname : peer.nickname();
    if (senderId.equals(peer.senderId())) {
      if (!name.equals(peer.nickname())) {
        peer = peer.withIdentity(senderId, peer.connectionId(), name);
        store(peer);
      }
      return Optional.of(new PeerBinding(peer, null));
    }
    return Optional.of(identify(peer, senderId, name));
  }

  private PeerBinding identify(Peer peer, SenderId senderId, String nickname) {
    Instant now = clock.instant();
    Long other = bySender.get(senderId);
    Peer duplicate = other != null && other != peer.handle() ? arena.get(other) : null;
    if (duplicate != null && duplicate.state().isLive() && !peer.state().isLive()) {
      if (peer.state().occupiesSlot()) {
        // this link is already closing; the live record keeps the identity
        return new PeerBinding(peer, null);
      }
      // the record holding the link keeps the identity; this one has no link and is folded into it
      retire(peer);
      Peer kept = duplicate.withIdentity(senderId, duplicate.connectionId(), nickname);
      store(kept);
      LOGGER.fine(() -> "Folded linkless record " + peer.connectionId() + " into " + kept.connectionId());
      return new PeerBinding(kept, null);
    }
    if (peer.senderId() != null) {
      LOGGER.warning(() -> "Connection " + peer.connectionId() + " changed identity from " + peer.senderId()
          + " to " + senderId);
      bySender.remove(peer.senderId(), peer.handle());
    }
    Peer displaced = null;
    if (duplicate != null) {
      if (duplicate.state().isLive()) {
        // one device on two links; the older link is given up
        displaced = transition(duplicate, PeerConnectionState.DISCONNECTING, PeerEvent.Type.DISCONNECTING, now);
        bySender.remove(senderId, duplicate.handle());
        LOGGER.info(() -> senderId + " is linked on both " + duplicate.connectionId() + " and "
            + peer.connectionId() + ", closing " + duplicate.connectionId());
      } else if (duplicate.state().occupiesSlot()) {
        // already closing; dropped when its link goes down
        bySender.remove(senderId, duplicate.handle());
      } else {
        retire(duplicate);
        LOGGER.fine(() -> "Merged duplicate record for " + senderId + " from " + duplicate.connectionId()
            + " into " + peer.connectionId());
      }
    }
    Peer identified = peer.withIdentity(senderId, peer.connectionId(), nickname)
        .withBlocked(blocklist.isBlocked(senderId));
    store(identified);
    publish(PeerEvent.Type.IDENTIFIED, identified, now);
    if (identified.blocked() && identified.state().isLive()) {
      identified = transition(identified, PeerConnectionState.DISCONNECTING, PeerEvent.Type.DISCONNECTING, now);
    }
    return new PeerBinding(identified, displaced);
  }

  /// Starts an outbound connection. Fails fast when every slot is taken.
  ///
  /// @throws CapacityExceededException when connecting, connected and closing links already fill the cap
  /// @throws IllegalStateException     when the peer is blocked or not in a connectable state
  /// @throws IllegalArgumentException  when the sender id is unknown
  public synchronized Peer beginConnect(SenderId senderId) {
    Peer peer = requireBySender(senderId);
    if (peer.blocked()) {
      throw new IllegalStateException("Peer is blocked: " + senderId);
    }
    if (!peer.canConnect()) {
      throw new IllegalStateException("Cannot connect to " + senderId + " in state " + peer.state());
    }
    if (occupiedSlots() >= maxConnections) {
      throw new CapacityExceededException(maxConnections);
    }
    return transition(peer, PeerConnectionState.CONNECTING, PeerEvent.Type.CONNECTING, clock.instant());
  }

  /// Records a link coming up, whether we started it or the peer did. Returns false when the link must be refused:
  /// the peer is blocked, the state does not allow it, or an inbound link would exceed the cap.
  public synchronized boolean markConnected(String connectionId) {
    Instant now = clock.instant();
    Long handle = byConnection.get(connectionId);
    if (handle == null) {
      handle = nextHandle++;
      store(new Peer(handle, null, connectionId, UNKNOWN_NICKNAME, 0, now,
          PeerConnectionState.DISCOVERED, now, false, 0, null));
    }
    final Peer peer = arena.get(handle);
    if (peer.blocked()) {
      LOGGER.warning(() -> "Refusing link from blocked peer " + peer.displayId());
      return false;
    }
    if (peer.state() == PeerConnectionState.CONNECTED) {
      return true;
    }
    if (!peer.state().canTransitionTo(PeerConnectionState.CONNECTED)) {
      LOGGER.fine(() -> "Ignoring connect of " + peer.displayId() + " in state " + peer.state());
      return false;
    }
    if (peer.state() != PeerConnectionState.CONNECTING && occupiedSlots() >= maxConnections) {
      LOGGER.warning(() -> "Refusing inbound link from " + peer.displayId() + ": " + maxConnections
          + " connections in use");
      return false;
    }
    transition(peer.withSeen(now), PeerConnectionState.CONNECTED, PeerEvent.Type.CONNECTED, now);
    return true;
  }

  /// Records a link going down, or a connection attempt failing. A record displaced by a merge is dropped once its
  /// link is down.
  public synchronized Optional<Peer> markDisconnected(String connectionId) {
    Long handle = byConnection.get(connectionId);
    if (handle == null) {
      return Optional.empty();
    }
    Peer peer = arena.get(handle);
    if (peer.state() == PeerConnectionState.DISCONNECTED || peer.state() == PeerConnectionState.DISCOVERED) {
      return Optional.of(peer);
    }
    Instant now = clock.instant();
    PeerEvent.Type type = peer.state() == PeerConnectionState.CONNECTING
        ? PeerEvent.Type.CONNECTION_FAILED
        : PeerEvent.Type.DISCONNECTED;
    Peer down = transition(peer, PeerConnectionState.DISCONNECTED, type, now);
    if (down.senderId() != null && !Objects.equals(bySender.get(down.senderId()), down.handle())) {
      retire(down);
      publish(PeerEvent.Type.REMOVED, down, now);
    }
    return Optional.of(down);
  }

  /// Moves a live or pending link to `DISCONNECTING`. Returns the peer whose link the caller must close.
  public synchronized Optional<Peer> beginDisconnect(SenderId senderId) {
    Peer peer = requireBySender(senderId);
    if (!peer.state().isLive()) {
      return Optional.empty();
    }
    return Optional.of(transition(peer, PeerConnectionState.DISCONNECTING, PeerEvent.Type.DISCONNECTING,
        clock.instant()));
  }

  /// Transitions only if the peer is currently in `expected`.
  public synchronized boolean compareAndTransition(SenderId senderId, PeerConnectionState expected,
                                                   PeerConnectionState next) {
    Long handle = bySender.get(senderId);
    if (handle == null) {
      return false;
    }
    Peer peer = arena.get(handle);
    if (peer.state() != expected || !expected.canTransitionTo(next)) {
      return false;
    }
    transition(peer, next, eventFor(next), clock.instant());
    return true;
  }

  /// Persists the block and, if the peer holds a link, moves it to `DISCONNECTING`. Returns the peer whose link the
  /// caller must close.
  public synchronized Optional<Peer> block(SenderId senderId) {
    blocklist.block(senderId);
    Long handle = bySender.get(senderId);
    if (handle == null) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    Peer peer = arena.get(handle).withBlocked(true);
    store(peer);
    publish(PeerEvent.Type.BLOCKED, peer, now);
    if (peer.state().isLive()) {
      return Optional.of(transition(peer, PeerConnectionState.DISCONNECTING, PeerEvent.Type.DISCONNECTING, now));
    }
    return Optional.empty();
  }

  public synchronized boolean unblock(SenderId senderId) {
    boolean removed = blocklist.unblock(senderId);
    Long handle = bySender.get(senderId);
    if (handle != null) {
      Peer peer = arena.get(handle).withBlocked(false);
      store(peer);
      publish(PeerEvent.Type.UNBLOCKED, peer, clock.instant());
    }
    return removed;
  }

  public boolean isBlocked(SenderId senderId) {
    return blocklist.isBlocked(senderId);
  }

  /// True when the peer on this link is blocked.
  public synchronized boolean isLinkBlocked(String connectionId) {
    Long handle = byConnection.get(connectionId);
    return handle != null && arena.get(handle).blocked();
  }

  /// Evicts peers that are not connected and have not been seen within the timeout.
  public synchronized List<Peer> removeStalePeers(Duration timeout) {
    Instant cutoff = clock.instant().minus(timeout);
    List<Peer> removed = new ArrayList<>();
    for (Peer peer : List.copyOf(arena.values())) {
      if (peer.state() != PeerConnectionState.CONNECTED && peer.lastSeen().isBefore(cutoff)) {
        retire(peer);
        removed.add(peer);
        publish(PeerEvent.Type.REMOVED, peer, clock.instant());
      }
    }
    if (!removed.isEmpty()) {
      LOGGER.fine(() -> "Removed " + removed.size() + " stale peers");
    }
    return removed;
  }

  /// Forces `CONNECTING` peers that have waited longer than the timeout to `DISCONNECTED`.
  public synchronized List<Peer> expireConnectionAttempts(Duration timeout) {
    Instant now = clock.instant();
    Instant cutoff = now.minus(timeout);
    List<Peer> expired = new ArrayList<>();
    for (Peer peer : List.copyOf(arena.values())) {
      if (peer.state() == PeerConnectionState.CONNECTING && peer.stateChangedAt().isBefore(cutoff)) {
        expired.add(transition(peer, PeerConnectionState.DISCONNECTED, PeerEvent.Type.CONNECTION_FAILED, now));
      }
    }
    return expired;
  }

  /// Refreshes last seen for traffic on a link.
  public synchronized void touch(String connectionId) {
    Long handle = byConnection.get(connectionId);
    if (handle != null) {
      store(arena.get(handle).withSeen(clock.instant()));
    }
  }

  /// Notes how far a message from this sender travelled. Informational only.
  public synchronized void recordTraffic(SenderId senderId, int hopCount) {
    Long handle = bySender.get(senderId);
    if (handle != null) {
      store(arena.get(handle).withForward(hopCount, clock.instant()));
    }
  }

  public synchronized Optional<Peer> findBySenderId(SenderId senderId) {
    return Optional.ofNullable(bySender.get(senderId)).map(arena::get);
  }

  public synchronized Optional<Peer> findByConnectionId(String connectionId) {
    return Optional.ofNullable(byConnection.get(connectionId)).map(arena::get);
  }

  public synchronized Optional<PeerConnectionState> connectionState(SenderId senderId) {
    return findBySenderId(senderId).map(Peer::state);
  }

  public synchronized List<Peer> peers() {
    return List.copyOf(arena.values());
  }

  public synchronized List<Peer> connectedPeers() {
    return arena.values().stream().filter(Peer::isConnected).toList();
  }

  /// Live links, the set the flood is sent over.
  public synchronized List<String> connectedConnectionIds() {
    return arena.values().stream().filter(Peer::isConnected).map(Peer::connectionId).toList();
  }

  public synchronized int connectedCount() {
    return (int) arena.values().stream().filter(Peer::isConnected).count();
  }

  public synchronized int occupiedSlots() {
    return (int) arena.values().stream().filter(p -> p.state().occupiesSlot()).count();
  }

  public synchronized boolean hasFreeSlot() {
    return occupiedSlots() < maxConnections;
  }

  public int maxConnections() {
    return maxConnections;
  }

  public Blocklist blocklist() {
    return blocklist;
  }

  private Peer transition(Peer peer, PeerConnectionState next, PeerEvent.Type type, Instant now) {
    if (!peer.state().canTransitionTo(next)) {
      throw new IllegalStateException("Illegal transition " + peer.state() + " -> " + next + " for "
          + peer.displayId());
    }
    Peer updated = peer.withState(next, now);
    store(updated);
    LOGGER.fine(() -> peer.displayId() + " " + peer.state() + " -> " + next);
    publish(type, updated, now);
    return updated;
  }

  private Peer requireBySender(SenderId senderId) {
    Long handle = bySender.get(Objects.requireNonNull(senderId, "senderId cannot be null"));
    if (handle == null) {
      throw new IllegalArgumentException("Unknown peer: " + senderId);
    }
    return arena.get(handle);
  }

  /// The sender id index is only claimed when free; `identify` releases it before rebinding.
  private void store(Peer peer) {
    Long holder = byConnection.get(peer.connectionId());
    if (holder != null && holder != peer.handle()) {
      Peer folded = arena.get(holder);
      if (folded.state().occupiesSlot()) {
        throw new IllegalStateException("Connection " + peer.connectionId() + " is held by " + folded.displayId()
            + " in state " + folded.state());
      }
      // one record per address; the newer one wins
      retire(folded);
    }
    Peer previous = arena.put(peer.handle(), peer);
    if (previous != null && !previous.connectionId().equals(peer.connectionId())) {
      byConnection.remove(previous.connectionId(), peer.handle());
    }
    byConnection.put(peer.connectionId(), peer.handle());
    if (peer.senderId() != null) {
      bySender.putIfAbsent(peer.senderId(), peer.handle());
    }
  }

  private void retire(Peer peer) {
    arena.remove(peer.handle());
    byConnection.remove(peer.connectionId(), peer.handle());
    if (peer.senderId() != null) {
      bySender.remove(peer.senderId(), peer.handle());
    }
  }

  private boolean addressHeldByOther(String connectionId, long handle) {
    Long holder = byConnection.get(connectionId);
    return holder != null && holder != handle && arena.get(holder).state().occupiesSlot();
  }

  private void publish(PeerEvent.Type type, Peer peer, Instant at) {
    events.publish(new PeerEvent(type, peer, at));
  }

  private static PeerEvent.Type eventFor(PeerConnectionState state) {
    switch (state) {
      case CONNECTING:
        return PeerEvent.Type.CONNECTING;
      case CONNECTED:
        return PeerEvent.Type.CONNECTED;
      case DISCONNECTING:
        return PeerEvent.Type.DISCONNECTING;
      case DISCONNECTED:
        return PeerEvent.Type.DISCONNECTED;
      default:
        return PeerEvent.Type.DISCOVERED;
    }
  }
}
