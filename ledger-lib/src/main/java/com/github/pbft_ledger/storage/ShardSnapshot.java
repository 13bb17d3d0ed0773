// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.storage;

import java.util.List;

/// A consistent copy of one shard for backup or replication.
///
/// @param merkleRoot  root of the open block's tree
/// @param blockHeight height of the open block, equal to the number of finalized blocks
public record ShardSnapshot(int shardId, List<PermanentRecord> records, String merkleRoot, long blockHeight,
                            List<BlockHeader> finalizedBlocks) {
  public ShardSnapshot {
    records = List.copyOf(records);
    finalizedBlocks = List.copyOf(finalizedBlocks);
  }
}
