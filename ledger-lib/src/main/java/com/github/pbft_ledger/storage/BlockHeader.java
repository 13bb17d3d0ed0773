// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.storage;

/// The archived root of a finalized block. After finalization the shard starts a fresh tree for the next height.
public record BlockHeader(int shardId, long height, String merkleRoot, int recordCount) {
}
