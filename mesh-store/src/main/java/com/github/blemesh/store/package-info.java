// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// H2 MVStore persistence for the device identity, the identity key material and the blocklist. Pass
/// `MVStore.open(null)` for a purely in-memory store or `MVStore.open(path)` for a file.
package com.github.blemesh.store;
