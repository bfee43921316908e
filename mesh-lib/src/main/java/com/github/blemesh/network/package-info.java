// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The seam between the mesh engine and a platform radio stack. Links are addressed by an opaque connection id
/// chosen by the transport.
package com.github.blemesh.network;
