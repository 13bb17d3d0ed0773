// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.storage;

import java.util.List;

/// Durable storage of committed records and finalized block headers. {@link MerkleStorage} replays it on start-up to
/// rebuild every shard's trees.
///
/// Shards append concurrently so implementations must be thread safe. Within one shard calls arrive in leaf order.
/// An exception thrown from any method is treated as fatal for the node.
public interface RecordJournal {

  void append(PermanentRecord record);

  void finalizeBlock(BlockHeader header);

  /// The records of the shard in the order they were appended.
  List<PermanentRecord> records(int shardId);

  /// The finalized blocks of the shard in height order.
  List<BlockHeader> blocks(int shardId);

  /// Make everything written so far crash durable.
  void sync();

  /// A journal that keeps nothing. Records live only in memory.
  static RecordJournal none() {
    return new RecordJournal() {
      @Override
      public void append(PermanentRecord record) {
      }

      @Override
      public void finalizeBlock(BlockHeader header) {
      }

      @Override
      public List<PermanentRecord> records(int shardId) {
        return List.of();
      }

      @Override
      public List<BlockHeader> blocks(int shardId) {
        return List.of();
      }

      @Override
      public void sync() {
      }
    };
  }
}
