// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blemesh;

import java.util.logging.Logger;

/// Single logger shared by the mesh library so that one level setting controls the whole protocol stack.
public final class MeshLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.blemesh");

  private MeshLogger() {
  }
}
