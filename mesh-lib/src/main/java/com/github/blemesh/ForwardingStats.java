// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh;

import java.util.concurrent.atomic.LongAdder;

/// Counters updated from every link thread.
public final class ForwardingStats {

  public record Snapshot(long messagesSent,
                         long messagesReceived,
                         long messagesDelivered,
                         long messagesForwarded,
                         long duplicatesDropped,
                         long cacheMisses,
                         long malformedFrames,
                         long cryptoFailures,
                         long sendFailures,
                         long blockedDropped,
                         int cacheSize) {
  }

  final LongAdder sent = new LongAdder();
  final LongAdder received = new LongAdder();
  final LongAdder delivered = new LongAdder();
  final LongAdder forwarded = new LongAdder();
  final LongAdder duplicates = new LongAdder();
  final LongAdder cacheMisses = new LongAdder();
  final LongAdder malformed = new LongAdder();
  final LongAdder cryptoFailures = new LongAdder();
  final LongAdder sendFailures = new LongAdder();
  final LongAdder blocked = new LongAdder();

  Snapshot snapshot(int cacheSize) {
    return new Snapshot(sent.sum(), received.sum(), delivered.sum(), forwarded.sum(), duplicates.sum(),
        cacheMisses.sum(), malformed.sum(), cryptoFailures.sum(), sendFailures.sum(), blocked.sum(), cacheSize);
  }
}
