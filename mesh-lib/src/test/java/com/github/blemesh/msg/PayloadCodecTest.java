// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.msg;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadCodecTest {
  private static final SenderId SENDER = SenderId.parse("AA:BB:CC:DD:EE:FF");

  private static byte[] filled(int size, int value) {
    byte[] bytes = new byte[size];
    Arrays.fill(bytes, (byte) value);
    return bytes;
  }

  @Test
  void announcementSurvivesTheWire() {
    PeerAnnouncement announcement = new PeerAnnouncement("Zoë's phone", filled(32, 1), filled(32, 2), filled(64, 3));
    assertThat(PeerAnnouncement.fromBytes(announcement.toBytes())).isEqualTo(announcement);
  }

  @Test
  void truncatedAnnouncementIsBadPayload() {
    byte[] bytes = new PeerAnnouncement("n", filled(32, 1), filled(32, 2), filled(64, 3)).toBytes();
    assertThatThrownBy(() -> PeerAnnouncement.fromBytes(Arrays.copyOf(bytes, bytes.length - 10)))
        .isInstanceOf(MalformedWireException.class)
        .satisfies(e -> assertThat(((MalformedWireException) e).kind())
            .isEqualTo(MalformedWireException.Kind.BAD_PAYLOAD));
  }

  @Test
  void undecodableNicknameIsBadPayload() {
    // 255 bytes of 0xFF each decode to a three byte replacement character
    byte[] bytes = new byte[1 + 255 + 32 + 32 + 64];
    bytes[0] = (byte) 255;
    Arrays.fill(bytes, 1, 256, (byte) 0xFF);
    assertThatThrownBy(() -> PeerAnnouncement.fromBytes(bytes))
        .isInstanceOf(MalformedWireException.class)
        .satisfies(e -> assertThat(((MalformedWireException) e).kind())
            .isEqualTo(MalformedWireException.Kind.BAD_PAYLOAD));
  }

  @Test
  void signedContentBindsTheSender() {
    PeerAnnouncement announcement = new PeerAnnouncement("n", filled(32, 1), filled(32, 2), filled(64, 3));
    assertThat(announcement.signedContent(SENDER))
        .isNotEqualTo(announcement.signedContent(SenderId.parse("00:00:00:00:00:01")));
  }

  @Test
  void longNicknamesAreFittedOnCodePointBoundaries() {
    String nickname = "é".repeat(200);
    String fitted = PeerAnnouncement.fitNickname(nickname);
    assertThat(fitted.getBytes(StandardCharsets.UTF_8).length).isLessThanOrEqualTo(255);
    assertThat(fitted).isEqualTo("é".repeat(127));
    assertThatThrownBy(() -> new PeerAnnouncement(nickname, filled(32, 1), filled(32, 2), filled(64, 3)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void privatePayloadCarriesRecipientFirst() {
    PrivatePayload payload = new PrivatePayload(SENDER, new byte[]{9, 8, 7});
    byte[] bytes = payload.toBytes();
    assertThat(Arrays.copyOf(bytes, SenderId.SIZE)).isEqualTo(SENDER.toBytes());
    assertThat(PrivatePayload.fromBytes(bytes)).isEqualTo(payload);
    assertThatThrownBy(() -> PrivatePayload.fromBytes(new byte[3])).isInstanceOf(MalformedWireException.class);
  }

  @Test
  void channelPayloadCarriesName() {
    ChannelPayload payload = new ChannelPayload("#général", new byte[]{1, 2, 3});
    assertThat(ChannelPayload.fromBytes(payload.toBytes())).isEqualTo(payload);
    assertThatThrownBy(() -> ChannelPayload.fromBytes(new byte[]{10, 'a'})).isInstanceOf(MalformedWireException.class);
    assertThatThrownBy(() -> ChannelPayload.fromBytes(new byte[0])).isInstanceOf(MalformedWireException.class);
  }
}
