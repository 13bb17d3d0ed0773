// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.storage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;

/// One partition of the log. A shard is the single writer of its Merkle trees: every read and write takes the
/// shard's mutex so that leaf index always equals insertion order within the open block.
///
/// When the open block reaches the block size its root is archived as a {@link BlockHeader} and a fresh tree is
/// started at the next height. Finalized trees are kept so that proofs can be regenerated for old records.
final class Shard {
  final int id;
  private final int blockSize;
  private final RecordJournal journal;

  /// Non-reentrant mutex guarding all state below
  private final Semaphore mutex = new Semaphore(1);

  private MerkleTree openTree = new MerkleTree();
  private long currentBlock = 0;
  private final Map<Long, MerkleTree> finalizedTrees = new HashMap<>();
  private final List<BlockHeader> finalizedBlocks = new ArrayList<>();
  private final List<PermanentRecord> records = new ArrayList<>();
  private final Map<String, PermanentRecord> recordsById = new HashMap<>();

  Shard(int id, int blockSize, RecordJournal journal) {
    this.id = id;
    this.blockSize = blockSize;
    this.journal = journal;
  }

  /// Appends in order. A request whose record id is already present returns the existing record unchanged.
  List<PermanentRecord> appendAll(List<StoreRequest> requests) {
    return underMutex(() -> {
      final var appended = new ArrayList<PermanentRecord>(requests.size());
      for (StoreRequest request : requests) {
        appended.add(appendUnderMutex(request));
      }
      return appended;
    });
  }

  private PermanentRecord appendUnderMutex(StoreRequest request) {
    final var existing = recordsById.get(request.recordId());
    if (existing != null) {
      LOGGER.fine(() -> "Shard " + id + " already holds record " + request.recordId());
      return existing;
    }
    final var hash = request.hash();
    final int leafIndex = openTree.append(hash);
    final var record = new PermanentRecord(
        request.recordId(),
        request.timestamp(),
        request.tokenId(),
        request.data(),
        request.tokenMetadata(),
        hash,
        openTree.proof(leafIndex),
        currentBlock,
        id);
    journal.append(record);
    index(record);
    if (openTree.size() >= blockSize) {
      journal.finalizeBlock(finalizeBlock());
    }
    return record;
  }

  /// Rebuilds state from journaled records without writing them back.
  void restore(List<PermanentRecord> journaled, List<BlockHeader> journaledBlocks) {
    underMutex(() -> {
      for (PermanentRecord record : journaled) {
        if (record.blockHeight() != currentBlock) {
          throw new IllegalStateException("Shard " + id + " journal has record " + record.id() + " at block "
              + record.blockHeight() + " while replaying block " + currentBlock);
        }
        final int leafIndex = openTree.append(record.hash());
        if (leafIndex != record.leafIndex() || !record.hashMatchesContent()) {
          throw new IllegalStateException("Shard " + id + " journal is inconsistent at record " + record.id());
        }
        index(record);
        if (openTree.size() >= blockSize) {
          finalizeBlock();
        }
      }
      if (!finalizedBlocks.equals(journaledBlocks)) {
        throw new IllegalStateException("Shard " + id + " journaled block headers do not match the replayed records");
      }
      return null;
    });
  }

  private void index(PermanentRecord record) {
    records.add(record);
    recordsById.put(record.id(), record);
  }

  private BlockHeader finalizeBlock() {
    final var header = new BlockHeader(id, currentBlock, openTree.root(), openTree.size());
    finalizedTrees.put(currentBlock, openTree);
    finalizedBlocks.add(header);
    openTree = new MerkleTree();
    currentBlock++;
    LOGGER.info(() -> "Shard " + id + " finalized block " + header.height() + " root " + header.merkleRoot());
    return header;
  }

  Optional<PermanentRecord> get(String recordId) {
    return underMutex(() -> Optional.ofNullable(recordsById.get(recordId)));
  }

  /// The record must be the one this shard holds, its hash must match its content, the proof issued at append time
  /// must verify, and a fresh proof from the block's tree must verify against the block's root.
  boolean verify(PermanentRecord record) {
    return underMutex(() -> {
      final var held = recordsById.get(record.id());
      if (held == null || !held.hash().equals(record.hash()) || !record.hashMatchesContent()) {
        return false;
      }
      final var issued = record.merkleProof();
      if (!issued.leafHash().equals(record.hash()) || !issued.verifies()) {
        return false;
      }
      return currentProofUnderMutex(record)
          .map(proof -> proof.leafHash().equals(record.hash()) && proof.verifiesAgainst(blockRoot(record.blockHeight())))
          .orElse(false);
    });
  }

  Optional<MerkleProof> currentProof(String recordId) {
    return underMutex(() -> Optional.ofNullable(recordsById.get(recordId)).flatMap(this::currentProofUnderMutex));
  }

  private Optional<MerkleProof> currentProofUnderMutex(PermanentRecord record) {
    final var tree = record.blockHeight() == currentBlock ? openTree : finalizedTrees.get(record.blockHeight());
    if (tree == null || record.leafIndex() >= tree.size()) {
      return Optional.empty();
    }
    return Optional.of(tree.proof(record.leafIndex()));
  }

  private String blockRoot(long height) {
    if (height == currentBlock) {
      return openTree.root();
    }
    return finalizedBlocks.get((int) height).merkleRoot();
  }

  List<PermanentRecord> query(RecordQuery query, int limit) {
    return underMutex(() -> records.stream().filter(query::matches).limit(limit).toList());
  }

  ShardSnapshot snapshot() {
    return underMutex(() -> new ShardSnapshot(id, records, openTree.root(), currentBlock, finalizedBlocks));
  }

  String root() {
    return underMutex(openTree::root);
  }

  int size() {
    return underMutex(records::size);
  }

  long finalizedBlockCount() {
    return underMutex(() -> (long) finalizedBlocks.size());
  }

  private <T> T underMutex(Supplier<T> action) {
    try {
      mutex.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted waiting for shard " + id, e);
    }
    try {
      return action.get();
    } finally {
      mutex.release();
    }
  }
}
