// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh.peer;

/// Thrown to the caller of connect when every link slot is taken. Never retried automatically.
public class CapacityExceededException extends IllegalStateException {
  private final int maxConnections;

  public CapacityExceededException(int maxConnections) {
    super("Maximum connections reached: " + maxConnections);
    this.maxConnections = maxConnections;
  }

  public int maxConnections() {
    return maxConnections;
  }
}
