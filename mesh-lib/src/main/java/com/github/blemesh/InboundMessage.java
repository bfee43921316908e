// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh;

import com.github.blemesh.msg.MessageType;
import com.github.blemesh.msg.SenderId;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Optional;

/// A decoded, deduplicated and, where needed, decrypted message delivered to the application exactly once.
///
/// @param channel   set for channel messages only
/// @param viaLink   connection id of the neighbour that delivered it
public record InboundMessage(MessageType type,
                             SenderId sender,
                             long messageId,
                             String content,
                             @Nullable String channel,
                             int hopCount,
                             int ttl,
                             String viaLink,
                             Instant receivedAt) {

  public Optional<String> channelName() {
    return Optional.ofNullable(channel);
  }

  public boolean isPrivate() {
    return type == MessageType.PRIVATE;
  }
}
