// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh;

import com.github.blemesh.crypto.CryptoFailureException;
import com.github.blemesh.crypto.KeyManager;
import com.github.blemesh.identity.IdentityStore;
import com.github.blemesh.msg.MeshFrame;
import com.github.blemesh.msg.MessageType;
import com.github.blemesh.msg.PeerAnnouncement;
import com.github.blemesh.msg.SenderId;
import com.github.blemesh.network.InMemoryMesh;
import com.github.blemesh.network.MeshTransport;
import com.github.blemesh.network.TransportListener;
import com.github.blemesh.peer.BlocklistStore;
import com.github.blemesh.peer.CapacityExceededException;
import com.github.blemesh.peer.Peer;
import com.github.blemesh.peer.PeerConnectionState;
import com.github.blemesh.peer.PeerDescriptor;
import com.github.blemesh.peer.PeerEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.blemesh.MeshLogger.LOGGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MeshEngineTest {
  private static final MeshConfig CONFIG = MeshConfig.defaults().withArgon2(64, 1, 1);

  private final MutableClock clock = new MutableClock();
  private final InMemoryMesh mesh = new InMemoryMesh();
  private final Map<String, MeshEngine> engines = new LinkedHashMap<>();

  @BeforeAll
  static void setupLogging() {
    final var logLevel = System.getProperty("java.util.logging.ConsoleHandler.level", "WARNING");
    final Level level = Level.parse(logLevel);
    Logger[] loggers = {LOGGER, Logger.getLogger(MeshEngineTest.class.getName())};
    for (Logger logger : loggers) {
      logger.setLevel(level);
      ConsoleHandler handler = new ConsoleHandler();
      handler.setLevel(level);
      logger.addHandler(handler);
      logger.setUseParentHandlers(false);
    }
  }

  @AfterEach
  void tearDown() {
    engines.values().forEach(MeshEngine::close);
  }

  private MeshEngine engine(String name, MeshConfig config) {
    MeshEngine engine = MeshEngine.builder()
        .config(config.withNickname(name))
        .transport(mesh.node(name))
        .clock(clock)
        .build();
    engine.start();
    engines.put(name, engine);
    return engine;
  }

  private MeshEngine engine(String name) {
    return engine(name, CONFIG);
  }

  /// Builds the named nodes, links consecutive pairs, and lets the announcements settle.
  private void line(MeshConfig config, String... names) {
    for (String name : names) {
      engine(name, config);
    }
    for (int i = 1; i < names.length; i++) {
      mesh.link(names[i - 1], names[i]);
    }
    mesh.flush();
    mesh.clearHistory();
  }

  private static List<InboundMessage> received(MeshEngine engine) {
    return engine.messages().drain();
  }

  private static List<MeshEvent> meshEvents(MeshEngine engine, MeshEvent.Type type) {
    return engine.meshEvents().drain().stream().filter(e -> e.type() == type).toList();
  }

  @Test
  void floodStopsWhenTtlRunsOut() {
    line(CONFIG.withDefaultTtl(3), "A", "B", "C", "D");
    MeshEngine a = engines.get("A");

    long id = a.sendPublicMessage("hello mesh");
    mesh.flush();

    List<InboundMessage> atB = received(engines.get("B"));
    List<InboundMessage> atC = received(engines.get("C"));
    List<InboundMessage> atD = received(engines.get("D"));
    assertThat(atB).singleElement().satisfies(m -> {
      assertThat(m.content()).isEqualTo("hello mesh");
      assertThat(m.sender()).isEqualTo(a.senderId());
      assertThat(m.messageId()).isEqualTo(id);
      assertThat(m.hopCount()).isZero();
      assertThat(m.ttl()).isEqualTo(3);
      assertThat(m.viaLink()).isEqualTo("A");
    });
    assertThat(atC).singleElement().satisfies(m -> assertThat(m.hopCount()).isEqualTo(1));
    assertThat(atD).singleElement().satisfies(m -> {
      assertThat(m.hopCount()).isEqualTo(2);
      assertThat(m.ttl()).isEqualTo(1);
      assertThat(m.type()).isEqualTo(MessageType.PUBLIC);
    });
    assertThat(received(a)).isEmpty();

    assertThat(mesh.deliveredFrames("B", "A", MessageType.PUBLIC)).as("never back to the origin").isEmpty();
    assertThat(mesh.deliveredFrames("C", "B", MessageType.PUBLIC)).isEmpty();
    List<MeshFrame> toD = mesh.deliveredFrames("C", "D", MessageType.PUBLIC);
    assertThat(toD).singleElement().satisfies(f -> assertThat(f.header().canForward()).isFalse());
  }

  @Test
  void ttlOfOneReachesOnlyNeighbours() {
    line(CONFIG.withDefaultTtl(1), "A", "B", "C");
    engines.get("A").sendPublicMessage("local only");
    mesh.flush();
    assertThat(received(engines.get("B"))).hasSize(1);
    assertThat(received(engines.get("C"))).isEmpty();
    assertThat(mesh.deliveredFrames("B", "C", MessageType.PUBLIC)).isEmpty();
  }

  @Test
  void triangleDeliversOnceAndDropsDuplicates() {
    for (String name : List.of("A", "B", "C")) {
      engine(name);
    }
    mesh.link("A", "B");
    mesh.link("B", "C");
    mesh.link("A", "C");
    mesh.flush();
    long duplicatesBefore = engines.get("B").stats().duplicatesDropped()
        + engines.get("C").stats().duplicatesDropped();

    engines.get("A").sendPublicMessage("round and round");
    mesh.flush();

    assertThat(received(engines.get("A"))).isEmpty();
    assertThat(received(engines.get("B"))).hasSize(1);
    assertThat(received(engines.get("C"))).hasSize(1);
    long duplicatesAfter = engines.get("B").stats().duplicatesDropped()
        + engines.get("C").stats().duplicatesDropped();
    assertThat(duplicatesAfter - duplicatesBefore).isEqualTo(2);
  }

  @Test
  void announcementsSpreadKeysAndNames() {
    line(CONFIG, "A", "B", "C");
    MeshEngine a = engines.get("A");
    MeshEngine b = engines.get("B");
    MeshEngine c = engines.get("C");

    assertThat(a.keyManager().getPeerPublicKey(c.senderId())).hasValueSatisfying(
        key -> assertThat(key).isEqualTo(c.keyManager().agreementPublicKey()));
    assertThat(b.findPeer(a.senderId())).hasValueSatisfying(p -> {
      assertThat(p.nickname()).isEqualTo("A");
      assertThat(p.connectionId()).isEqualTo("A");
      assertThat(p.state()).isEqualTo(PeerConnectionState.CONNECTED);
    });
    assertThat(a.findPeer(c.senderId())).as("relayed announcements do not bind links").isEmpty();
    assertThat(b.connectedPeers()).hasSize(2);
  }

  @Test
  void privateMessageIsReadOnlyByRecipient() {
    line(CONFIG, "A", "B", "C", "D");
    MeshEngine a = engines.get("A");
    MeshEngine c = engines.get("C");

    a.sendPrivateMessage(c.senderId(), "for C only");
    mesh.flush();

    assertThat(received(c)).singleElement().satisfies(m -> {
      assertThat(m.isPrivate()).isTrue();
      assertThat(m.content()).isEqualTo("for C only");
      assertThat(m.sender()).isEqualTo(a.senderId());
      assertThat(m.hopCount()).isEqualTo(1);
    });
    assertThat(received(engines.get("B"))).isEmpty();
    assertThat(mesh.deliveredFrames("B", "C", MessageType.PRIVATE)).hasSize(1);
    assertThat(mesh.deliveredFrames("C", "D", MessageType.PRIVATE)).as("recipient does not relay").isEmpty();
    assertThat(received(engines.get("D"))).isEmpty();
  }

  @Test
  void privateMessageNeedsRecipientKey() {
    MeshEngine a = engine("A");
    SenderId stranger = SenderId.parse("12:34:56:78:9A:BC");
    assertThatThrownBy(() -> a.sendPrivateMessage(stranger, "hello?"))
        .isInstanceOfSatisfying(CryptoFailureException.class,
            e -> assertThat(e.reason()).isEqualTo(CryptoFailureException.Reason.UNKNOWN_RECIPIENT_KEY));
  }

  @Test
  void channelMessagesReachMembersThroughNonMembers() {
    line(CONFIG, "A", "B", "C");
    engines.get("A").joinChannel("#general", "open sesame");
    engines.get("C").joinChannel("#general", "open sesame");

    engines.get("A").sendChannelMessage("#general", "hi channel");
    mesh.flush();

    assertThat(received(engines.get("B"))).isEmpty();
    assertThat(received(engines.get("C"))).singleElement().satisfies(m -> {
      assertThat(m.type()).isEqualTo(MessageType.CHANNEL);
      assertThat(m.channelName()).contains("#general");
      assertThat(m.content()).isEqualTo("hi channel");
    });
  }

  @Test
  void wrongChannelPasswordIsReportedAndStillRelayed() {
    line(CONFIG, "A", "B", "C");
    engines.get("A").joinChannel("#general", "open sesame");
    engines.get("B").joinChannel("#general", "guess");
    engines.get("C").joinChannel("#general", "open sesame");
    engines.get("B").meshEvents().drain();

    engines.get("A").sendChannelMessage("#general", "hi channel");
    mesh.flush();

    MeshEngine b = engines.get("B");
    assertThat(received(b)).isEmpty();
    assertThat(meshEvents(b, MeshEvent.Type.CRYPTO_FAILURE)).singleElement()
        .satisfies(e -> assertThat(e.detail()).contains("WRONG_CHANNEL_PASSWORD"));
    assertThat(b.stats().cryptoFailures()).isEqualTo(1);
    assertThat(received(engines.get("C"))).hasSize(1);
  }

  @Test
  void sendingToUnjoinedChannelFails() {
    MeshEngine a = engine("A");
    assertThatThrownBy(() -> a.sendChannelMessage("#nope", "x"))
        .isInstanceOfSatisfying(CryptoFailureException.class,
            e -> assertThat(e.reason()).isEqualTo(CryptoFailureException.Reason.CHANNEL_NOT_JOINED));
  }

  @Test
  void blockingNeighbourClosesLinkAndPersists() {
    line(CONFIG, "A", "B");
    MeshEngine a = engines.get("A");
    MeshEngine b = engines.get("B");

    b.block(a.senderId());

    assertThat(mesh.isLinked("A", "B")).isFalse();
    assertThat(b.isBlocked(a.senderId())).isTrue();
    assertThat(b.blockedPeers()).containsExactly(a.senderId());
    assertThat(b.connectionState(a.senderId())).contains(PeerConnectionState.DISCONNECTED);
    assertThat(b.peerEvents().drain()).extracting(PeerEvent::type)
        .contains(PeerEvent.Type.BLOCKED, PeerEvent.Type.DISCONNECTING, PeerEvent.Type.DISCONNECTED);

    mesh.link("A", "B");
    assertThat(mesh.isLinked("A", "B")).as("blocked peer link refused").isFalse();
  }

  @Test
  void relayedMessagesFromBlockedSenderAreDropped() {
    line(CONFIG, "A", "B", "C");
    MeshEngine c = engines.get("C");
    c.block(engines.get("A").senderId());

    engines.get("A").sendPublicMessage("can you hear me");
    mesh.flush();

    assertThat(received(engines.get("B"))).hasSize(1);
    assertThat(received(c)).isEmpty();
    assertThat(c.stats().blockedDropped()).isEqualTo(1);

    c.unblock(engines.get("A").senderId());
    engines.get("A").sendPublicMessage("and now");
    mesh.flush();
    assertThat(received(c)).extracting(InboundMessage::content).containsExactly("and now");
  }

  @Test
  void malformedFrameRaisesEventAndLinkSurvives() {
    line(CONFIG, "A", "B");
    MeshEngine b = engines.get("B");
    b.meshEvents().drain();

    b.onBytesReceived("A", new byte[]{1, 2, 3});
    byte[] badVersion = MeshFrame.originate(MessageType.PUBLIC, 3, engines.get("A").senderId(), 42L,
        "x".getBytes(StandardCharsets.UTF_8)).toBytes();
    badVersion[0] = 9;
    b.onBytesReceived("A", badVersion);

    assertThat(meshEvents(b, MeshEvent.Type.MALFORMED_MESSAGE)).hasSize(2)
        .allSatisfy(e -> assertThat(e.peer()).isEqualTo("A"));
    assertThat(b.stats().malformedFrames()).isEqualTo(2);

    engines.get("A").sendPublicMessage("still here");
    mesh.flush();
    assertThat(received(b)).hasSize(1);
  }

  @Test
  void unknownTypesAreRelayedButNotSurfaced() {
    line(CONFIG, "A", "B", "C");
    MeshEngine b = engines.get("B");
    SenderId origin = SenderId.parse("0F:0E:0D:0C:0B:0A");
    byte[] frame = MeshFrame.originate(MessageType.PUBLIC, 4, origin, 7L, new byte[]{9}).toBytes();
    frame[1] = (byte) 0x7F;

    b.onBytesReceived("A", frame);
    mesh.flush();

    assertThat(received(b)).isEmpty();
    assertThat(received(engines.get("C"))).isEmpty();
    assertThat(engines.get("C").stats().cacheMisses()).isGreaterThanOrEqualTo(1);
    assertThat(b.stats().messagesForwarded()).isGreaterThanOrEqualTo(1);
  }

  @Test
  void connectRespectsCapacity() {
    MeshEngine a = engine("A", CONFIG.withMaxConnections(1));
    MeshEngine b = engine("B");
    MeshEngine c = engine("C");
    mesh.inRange("A", "B");
    mesh.inRange("A", "C");
    mesh.advertise("A", "B", b.senderId(), -40);
    mesh.advertise("A", "C", c.senderId(), -50);

    a.connect(b.senderId()).join();
    assertThat(mesh.isLinked("A", "B")).isTrue();
    assertThatThrownBy(() -> a.connect(c.senderId())).isInstanceOf(CapacityExceededException.class);
    assertThat(a.connectionState(c.senderId())).contains(PeerConnectionState.DISCOVERED);

    mesh.link("C", "A");
    assertThat(mesh.isLinked("A", "C")).as("inbound link over the cap is refused").isFalse();
  }

  @Test
  void autoConnectUsesFreeSlots() {
    MeshEngine a = engine("A", CONFIG.withAutoConnect(true));
    MeshEngine b = engine("B");
    mesh.inRange("A", "B");

    mesh.advertise("A", "B", b.senderId(), -40);
    mesh.flush();

    assertThat(mesh.isLinked("A", "B")).isTrue();
    assertThat(a.connectionState(b.senderId())).contains(PeerConnectionState.CONNECTED);
    assertThat(b.findPeer(a.senderId())).isPresent();
  }

  @Test
  void unreachablePeerFailsConnect() {
    MeshEngine a = engine("A");
    MeshEngine b = engine("B");
    mesh.advertise("A", "B", b.senderId(), -90);

    assertThat(a.connect(b.senderId())).isCompletedExceptionally();
    assertThat(a.connectionState(b.senderId())).contains(PeerConnectionState.DISCONNECTED);
    assertThat(a.peerEvents().drain()).extracting(PeerEvent::type)
        .containsExactly(PeerEvent.Type.DISCOVERED, PeerEvent.Type.CONNECTING, PeerEvent.Type.CONNECTION_FAILED);
  }

  @Test
  void stalledConnectionTimesOut() {
    RecordingTransport transport = new RecordingTransport();
    transport.pendingConnects = true;
    MeshEngine engine = MeshEngine.builder().config(CONFIG).transport(transport).clock(clock).build();
    engines.put("solo", engine);
    engine.start();
    SenderId peer = SenderId.parse("AB:CD:EF:01:23:45");
    engine.onPeerDiscovered(new PeerDescriptor("radio-1", peer, "slow", -70));
    CompletableFuture<Void> attempt = engine.connect(peer);

    clock.advance(CONFIG.connectionTimeout().minusSeconds(1));
    engine.enforceConnectionTimeouts();
    assertThat(engine.connectionState(peer)).contains(PeerConnectionState.CONNECTING);

    clock.advance(Duration.ofSeconds(2));
    engine.enforceConnectionTimeouts();

    assertThat(attempt).isNotDone();
    assertThat(engine.connectionState(peer)).contains(PeerConnectionState.DISCONNECTED);
    assertThat(transport.disconnects).containsExactly("radio-1");
    assertThat(meshEvents(engine, MeshEvent.Type.CONNECTION_TIMEOUT)).singleElement()
        .satisfies(e -> assertThat(e.peer()).isEqualTo(peer.toString()));
  }

  @Test
  void sendFailureIsReported() {
    line(CONFIG, "A", "B", "C");
    MeshEngine b = engines.get("B");
    b.meshEvents().drain();
    mesh.failSends("B", "C");

    b.sendPublicMessage("partly lost");
    mesh.flush();

    assertThat(meshEvents(b, MeshEvent.Type.SEND_FAILED)).singleElement()
        .satisfies(e -> assertThat(e.peer()).isEqualTo("C"));
    assertThat(b.stats().sendFailures()).isEqualTo(1);
    assertThat(received(engines.get("A"))).hasSize(1);
    assertThat(received(engines.get("C"))).isEmpty();
  }

  @Test
  void stoppedMeshRejectsSendsAndIgnoresFrames() {
    line(CONFIG, "A", "B");
    MeshEngine a = engines.get("A");
    MeshEngine b = engines.get("B");
    assertThat(b.isScheduled(MeshEngine.CACHE_SWEEP)).isTrue();
    assertThat(b.isScheduled(MeshEngine.METRICS)).isTrue();

    b.stop();

    assertThat(b.isRunning()).isFalse();
    assertThat(b.isScheduled(MeshEngine.CACHE_SWEEP)).isFalse();
    assertThat(mesh.isLinked("A", "B")).isFalse();
    assertThatThrownBy(() -> b.sendPublicMessage("x")).isInstanceOf(IllegalStateException.class)
        .hasMessage("Mesh is not running");
    b.onBytesReceived("A", MeshFrame.originate(MessageType.PUBLIC, 3, a.senderId(), 1L, new byte[0]).toBytes());
    assertThat(received(b)).isEmpty();
    assertThat(b.meshEvents().drain()).extracting(MeshEvent::type).endsWith(MeshEvent.Type.MESH_STOPPED);
  }

  @Test
  void maintenanceSweepsCacheAndPeersAndPublishesMetrics() {
    line(CONFIG, "A", "B");
    MeshEngine b = engines.get("B");
    b.onPeerDiscovered(new PeerDescriptor("far-away", SenderId.parse("11:11:11:11:11:11"), "far", -95));
    engines.get("A").sendPublicMessage("x");
    mesh.flush();
    assertThat(b.cacheStats().size()).isGreaterThan(0);

    clock.advance(CONFIG.cacheExpiration().plusSeconds(1));
    b.sweepCache();
    b.sweepStalePeers();
    b.publishMetrics();

    assertThat(b.cacheStats().size()).isZero();
    assertThat(b.findPeer(SenderId.parse("11:11:11:11:11:11"))).isEmpty();
    assertThat(b.connectedPeers()).hasSize(1);
    assertThat(meshEvents(b, MeshEvent.Type.FORWARDING_METRICS)).singleElement().satisfies(e -> {
      assertThat(e.stats()).isNotNull();
      assertThat(e.stats().messagesDelivered()).isEqualTo(1);
      assertThat(e.stats().cacheSize()).isZero();
    });
  }

  /// A signed announcement as the device behind `keys` would send it to a neighbour.
  private static byte[] announcement(KeyManager keys, SenderId sender, String nickname, long messageId, int ttl) {
    byte[] agreementKey = keys.agreementPublicKey();
    byte[] signingKey = keys.signingPublicKey();
    byte[] signature = keys.sign(PeerAnnouncement.signedContent(sender, nickname, agreementKey, signingKey));
    byte[] payload = new PeerAnnouncement(nickname, agreementKey, signingKey, signature).toBytes();
    return MeshFrame.originate(MessageType.PEER_ANNOUNCEMENT, ttl, sender, messageId, payload).toBytes();
  }

  @Test
  void secondLinkFromSameDeviceClosesTheFirst() {
    RecordingTransport transport = new RecordingTransport();
    MeshEngine hub = MeshEngine.builder().config(CONFIG.withMaxConnections(2)).transport(transport)
        .clock(clock).build();
    engines.put("hub", hub);
    hub.start();
    KeyManager aliceKeys = new KeyManager(IdentityStore.inMemory(), CONFIG, clock);
    SenderId alice = SenderId.parse("A1:1C:E0:00:00:01");

    hub.onPeerConnected("link-a");
    hub.onBytesReceived("link-a", announcement(aliceKeys, alice, "alice", 1L, 1));
    hub.onPeerConnected("link-b");
    hub.onBytesReceived("link-b", announcement(aliceKeys, alice, "alice", 2L, 1));

    assertThat(transport.disconnects).containsExactly("link-a");
    assertThat(hub.findPeer(alice).orElseThrow().connectionId()).isEqualTo("link-b");
    assertThat(hub.connectedPeers()).extracting(Peer::connectionId).containsExactly("link-b");

    hub.onPeerConnected("link-c");
    assertThat(transport.disconnects).as("closing link still holds its slot").containsExactly("link-a", "link-c");

    hub.onPeerDisconnected("link-a");
    assertThat(hub.peerEvents().drain()).extracting(PeerEvent::type)
        .contains(PeerEvent.Type.DISCONNECTING, PeerEvent.Type.DISCONNECTED, PeerEvent.Type.REMOVED);
    hub.onPeerConnected("link-d");
    assertThat(hub.connectedPeers()).extracting(Peer::connectionId).containsExactlyInAnyOrder("link-b", "link-d");

    transport.sent.clear();
    hub.sendPublicMessage("still reachable");
    assertThat(transport.sent).containsExactlyInAnyOrder("link-b", "link-d");
  }

  @Test
  void quietPeersKeysAreSweptWithStalePeers() {
    line(CONFIG, "A", "B");
    MeshEngine a = engines.get("A");
    MeshEngine b = engines.get("B");
    SenderId far = SenderId.parse("22:22:22:22:22:22");
    KeyManager farKeys = new KeyManager(IdentityStore.inMemory(), CONFIG, clock);
    // relayed, so it carries keys but does not describe the link it arrived on
    a.onBytesReceived("B", MeshFrame.fromBytes(announcement(farKeys, far, "far", 77L, 3)).forwarded().toBytes());
    assertThat(a.keyManager().getPeerPublicKey(far)).isPresent();

    clock.advance(CONFIG.peerKeyExpiration().minusMinutes(1));
    b.sendPublicMessage("keep-alive");
    mesh.flush();
    clock.advance(Duration.ofMinutes(2));
    a.sweepStalePeers();

    assertThat(a.keyManager().getPeerPublicKey(far)).isEmpty();
    assertThat(a.keyManager().getPeerPublicKey(b.senderId())).isPresent();
  }

  @Test
  void identityAndBlocklistComeFromStores() {
    IdentityStore identities = IdentityStore.inMemory();
    BlocklistStore blocklist = BlocklistStore.inMemory();
    SenderId blocked = SenderId.parse("DE:AD:BE:EF:00:01");
    MeshEngine first = MeshEngine.builder().config(CONFIG).transport(new RecordingTransport())
        .identityStore(identities).blocklistStore(blocklist).clock(clock).build();
    first.block(blocked);
    first.close();

    MeshEngine second = MeshEngine.builder().config(CONFIG).transport(new RecordingTransport())
        .identityStore(identities).blocklistStore(blocklist).clock(clock).build();
    engines.put("second", second);
    assertThat(second.senderId()).isEqualTo(first.senderId());
    assertThat(second.keyManager().signingPublicKey()).isEqualTo(first.keyManager().signingPublicKey());
    assertThat(second.isBlocked(blocked)).isTrue();
  }

  @Test
  void concurrentLinksDeliverEachMessageOnce() throws Exception {
    RecordingTransport transport = new RecordingTransport();
    MeshEngine engine = MeshEngine.builder().config(CONFIG.withMaxConnections(8)).transport(transport)
        .clock(clock).build();
    engines.put("hub", engine);
    engine.start();
    int links = 8;
    for (int i = 0; i < links; i++) {
      engine.onPeerConnected("link-" + i);
    }
    SenderId origin = SenderId.parse("CA:FE:BA:BE:00:01");
    int messageCount = 200;
    List<byte[]> frames = new ArrayList<>();
    for (int i = 0; i < messageCount; i++) {
      frames.add(MeshFrame.originate(MessageType.PUBLIC, 5, origin, 1000L + i,
          ("m" + i).getBytes(StandardCharsets.UTF_8)).toBytes());
    }

    ExecutorService executor = Executors.newFixedThreadPool(links);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> results = new ArrayList<>();
      for (int i = 0; i < links; i++) {
        final String link = "link-" + i;
        results.add(executor.submit(() -> {
          start.await();
          for (byte[] frame : frames) {
            engine.onBytesReceived(link, frame);
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> result : results) {
        result.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    List<InboundMessage> messages = engine.messages().drain();
    assertThat(messages).hasSize(messageCount);
    Set<Long> ids = new HashSet<>();
    messages.forEach(m -> ids.add(m.messageId()));
    assertThat(ids).hasSize(messageCount);
    ForwardingStats.Snapshot stats = engine.stats();
    assertThat(stats.duplicatesDropped()).isEqualTo((long) messageCount * (links - 1));
    assertThat(stats.messagesForwarded()).isEqualTo(messageCount);
    assertThat(transport.sent).hasSize(links + messageCount * (links - 1));
  }

  /// Transport stub for a single engine: records sends and disconnects, optionally leaving connects pending.
  static final class RecordingTransport implements MeshTransport {
    final ConcurrentLinkedQueue<String> sent = new ConcurrentLinkedQueue<>();
    final List<String> disconnects = new ArrayList<>();
    boolean pendingConnects;

    @Override
    public void bind(TransportListener listener) {
    }

    @Override
    public CompletableFuture<Void> sendBytes(String connectionId, byte[] bytes) {
      sent.add(connectionId);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> connect(String connectionId) {
      return pendingConnects ? new CompletableFuture<>() : CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized void disconnect(String connectionId) {
      disconnects.add(connectionId);
    }
  }
}
