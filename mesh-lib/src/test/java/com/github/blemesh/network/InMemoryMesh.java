// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.network;

import com.github.blemesh.msg.MeshFrame;
import com.github.blemesh.msg.MessageType;
import com.github.blemesh.msg.SenderId;
import com.github.blemesh.peer.PeerDescriptor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static com.github.blemesh.MeshLogger.LOGGER;

/// Radio simulation for several named nodes. Each node sees its neighbours under the neighbour's name as the
/// connection id. Sends are queued and only delivered by [#flush()], so a test controls exactly when traffic moves
/// and delivery is never re-entrant.
public class InMemoryMesh {

  public record Delivery(String from, String to, byte[] bytes) {
    public MeshFrame frame() {
      return MeshFrame.fromBytes(bytes);
    }
  }

  private final Map<String, Node> nodes = new HashMap<>();
  private final Set<Set<String>> links = new HashSet<>();
  private final Set<Set<String>> inRange = new HashSet<>();
  private final Deque<Delivery> inFlight = new ArrayDeque<>();
  private final List<Delivery> delivered = new ArrayList<>();
  private final Set<String> failingLinks = new HashSet<>();

  public synchronized MeshTransport node(String name) {
    return nodes.computeIfAbsent(name, Node::new);
  }

  /// Allows `connect` between the two nodes to succeed.
  public synchronized void inRange(String a, String b) {
    inRange.add(Set.of(a, b));
  }

  /// Brings a link up as if the radio connected it, notifying both ends.
  public void link(String a, String b) {
    synchronized (this) {
      inRange.add(Set.of(a, b));
      links.add(Set.of(a, b));
    }
    listener(a).onPeerConnected(b);
    listener(b).onPeerConnected(a);
  }

  /// Drops a link, notifying both ends.
  public void unlink(String a, String b) {
    boolean removed;
    synchronized (this) {
      removed = links.remove(Set.of(a, b));
    }
    if (removed) {
      listener(a).onPeerDisconnected(b);
      listener(b).onPeerDisconnected(a);
    }
  }

  /// Reports `seen` to `observer` as an advertisement carrying its sender id.
  public void advertise(String observer, String seen, SenderId senderId, int rssi) {
    listener(observer).onPeerDiscovered(new PeerDescriptor(seen, senderId, seen, rssi));
  }

  /// Makes every send from `from` to `to` fail.
  public synchronized void failSends(String from, String to) {
    failingLinks.add(from + "->" + to);
  }

  public synchronized boolean isLinked(String a, String b) {
    return links.contains(Set.of(a, b));
  }

  /// Delivers queued frames, including those sent while delivering, until nothing is in flight.
  public int flush() {
    int count = 0;
    while (true) {
      Delivery next;
      synchronized (this) {
        next = inFlight.pollFirst();
        if (next == null) {
          return count;
        }
        if (!links.contains(Set.of(next.from(), next.to()))) {
          continue;
        }
        delivered.add(next);
      }
      listener(next.to()).onBytesReceived(next.from(), next.bytes());
      count++;
    }
  }

  /// Frames of the given type delivered over the directed link.
  public synchronized List<MeshFrame> deliveredFrames(String from, String to, MessageType type) {
    return delivered.stream()
        .filter(d -> d.from().equals(from) && d.to().equals(to))
        .map(Delivery::frame)
        .filter(f -> f.header().type() == type.code())
        .toList();
  }

  public synchronized void clearHistory() {
    delivered.clear();
  }

  private synchronized TransportListener listener(String name) {
    Node node = nodes.get(name);
    if (node == null || node.listener == null) {
      throw new IllegalStateException("No listener bound for " + name);
    }
    return node.listener;
  }

  private final class Node implements MeshTransport {
    private final String name;
    private volatile TransportListener listener;

    private Node(String name) {
      this.name = name;
    }

    @Override
    public void bind(TransportListener listener) {
      this.listener = listener;
    }

    @Override
    public CompletableFuture<Void> sendBytes(String connectionId, byte[] bytes) {
      synchronized (InMemoryMesh.this) {
        if (failingLinks.contains(name + "->" + connectionId)) {
          return CompletableFuture.failedFuture(new IllegalStateException("Radio error to " + connectionId));
        }
        if (!links.contains(Set.of(name, connectionId))) {
          return CompletableFuture.failedFuture(new IllegalStateException("No link to " + connectionId));
        }
        inFlight.addLast(new Delivery(name, connectionId, bytes.clone()));
      }
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> connect(String connectionId) {
      boolean reachable;
      synchronized (InMemoryMesh.this) {
        reachable = inRange.contains(Set.of(name, connectionId)) && nodes.containsKey(connectionId);
      }
      if (!reachable) {
        LOGGER.fine(() -> name + " cannot reach " + connectionId);
        return CompletableFuture.failedFuture(new IllegalStateException(connectionId + " out of range"));
      }
      link(name, connectionId);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public void disconnect(String connectionId) {
      unlink(name, connectionId);
    }
  }
}
