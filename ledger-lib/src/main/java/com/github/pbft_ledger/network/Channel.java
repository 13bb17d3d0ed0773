// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.network;

/// A channel is a short value that identifies the type of message being sent.
/// Channels below 100 are reserved for system messages.
/// @see SystemChannel
public record Channel(short id) {
}
