// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.storage;

import com.github.pbft_ledger.LedgerConfig;
import com.github.pbft_ledger.ValidationException;
import com.github.pbft_ledger.token.TokenPayload;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.stream.IntStream;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;

/// Sharded append-only record store. A record's shard is the first eight hex digits of its hash modulo the shard
/// count. Each shard keeps its own Merkle tree and is the single writer of it, so batches fan out across shards in
/// parallel while staying strictly sequential within a shard.
///
/// Any journal failure crashes the storage: the error is logged and every later write is refused until the node is
/// restarted and the journal replayed.
public class MerkleStorage implements AutoCloseable {
  private final LedgerConfig config;
  private final RecordJournal journal;
  private final Clock clock;
  private final Shard[] shards;
  private final ConcurrentHashMap<String, Integer> shardByRecordId = new ConcurrentHashMap<>();
  private final ExecutorService shardWriters;
  private final AtomicBoolean crashed = new AtomicBoolean(false);

  public MerkleStorage(LedgerConfig config) {
    this(config, RecordJournal.none(), Clock.systemUTC());
  }

  public MerkleStorage(LedgerConfig config, RecordJournal journal, Clock clock) {
    this.config = config;
    this.journal = journal;
    this.clock = clock;
    this.shards = IntStream.range(0, config.shardCount())
        .mapToObj(id -> new Shard(id, config.blockSize(), journal))
        .toArray(Shard[]::new);
    final var threadCount = new AtomicInteger();
    this.shardWriters = Executors.newFixedThreadPool(
        Math.min(config.shardCount(), Runtime.getRuntime().availableProcessors()),
        r -> {
          final var thread = new Thread(r, "shard-writer-" + threadCount.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
    recover();
  }

  private void recover() {
    long restored = 0;
    for (Shard shard : shards) {
      final var records = journal.records(shard.id);
      shard.restore(records, journal.blocks(shard.id));
      records.forEach(r -> shardByRecordId.put(r.id(), shard.id));
      restored += records.size();
    }
    if (restored > 0) {
      final long count = restored;
      LOGGER.info(() -> "Recovered " + count + " records across " + shards.length + " shards from the journal");
    }
  }

  public static int shardFor(String hash, int shardCount) {
    return (int) (Long.parseLong(hash.substring(0, 8), 16) % shardCount);
  }

  /// Stores a record with a fresh id stamped with the current time.
  public PermanentRecord storeRecord(TokenPayload payload, Map<String, Object> data) {
    return store(StoreRequest.of(payload, data, UUID.randomUUID().toString(), clock.millis()));
  }

  public PermanentRecord store(StoreRequest request) {
    return storeBatch(List.of(request)).get(0);
  }

  /// Partitions the requests by shard and appends each partition on its own writer. Results are in input order.
  public List<PermanentRecord> storeBatch(List<StoreRequest> requests) {
    if (crashed.get()) {
      throw new IllegalStateException("Storage has crashed and must be restarted from its journal");
    }
    final var byShard = new LinkedHashMap<Integer, List<Integer>>();
    for (int i = 0; i < requests.size(); i++) {
      final int shardId = shardFor(requests.get(i).hash(), shards.length);
      byShard.computeIfAbsent(shardId, k -> new ArrayList<>()).add(i);
    }

    final var results = new PermanentRecord[requests.size()];
    final var writes = byShard.entrySet().stream()
        .map(entry -> CompletableFuture.runAsync(() -> {
          final var positions = entry.getValue();
          final var appended = shards[entry.getKey()].appendAll(positions.stream().map(requests::get).toList());
          for (int j = 0; j < positions.size(); j++) {
            results[positions.get(j)] = appended.get(j);
          }
        }, shardWriters))
        .toArray(CompletableFuture[]::new);
    try {
      CompletableFuture.allOf(writes).join();
      journal.sync();
    } catch (CompletionException e) {
      final var cause = e.getCause() instanceof RuntimeException r ? r : e;
      crash(cause);
      throw cause;
    } catch (RuntimeException e) {
      crash(e);
      throw e;
    }
    final var stored = Arrays.asList(results);
    stored.forEach(r -> shardByRecordId.put(r.id(), r.shardId()));
    LOGGER.fine(() -> "Stored " + stored.size() + " records across " + byShard.size() + " shards");
    return stored;
  }

  private void crash(Throwable cause) {
    if (crashed.compareAndSet(false, true)) {
      LOGGER.log(Level.SEVERE, "Storage crashed writing the journal: " + cause, cause);
    }
  }

  public Optional<PermanentRecord> getRecord(String recordId) {
    final var shardId = shardByRecordId.get(recordId);
    return shardId == null ? Optional.empty() : shards[shardId].get(recordId);
  }

  /// True when the record is held by its shard and both its issued proof and a freshly generated proof verify.
  public boolean verifyRecord(PermanentRecord record) {
    if (record == null || record.shardId() < 0 || record.shardId() >= shards.length) {
      return false;
    }
    if (shardFor(record.hash(), shards.length) != record.shardId()) {
      return false;
    }
    return shards[record.shardId()].verify(record);
  }

  /// An inclusion proof for the record against the current root of the block that holds it.
  public Optional<MerkleProof> proofFor(String recordId) {
    final var shardId = shardByRecordId.get(recordId);
    return shardId == null ? Optional.empty() : shards[shardId].currentProof(recordId);
  }

  /// Linear scan in shard order then insertion order.
  public List<PermanentRecord> query(RecordQuery query) {
    final int limit = query.limit() == null ? config.defaultQueryLimit() : query.limit();
    if (limit < 1) {
      throw new ValidationException("Query limit must be positive: " + limit);
    }
    final var found = new ArrayList<PermanentRecord>();
    for (Shard shard : shards) {
      if (found.size() >= limit) break;
      found.addAll(shard.query(query, limit - found.size()));
    }
    return found;
  }

  public ShardSnapshot exportShard(int shardId) {
    return shard(shardId).snapshot();
  }

  public String shardRoot(int shardId) {
    return shard(shardId).root();
  }

  private Shard shard(int shardId) {
    if (shardId < 0 || shardId >= shards.length) {
      throw new ValidationException("Shard " + shardId + " does not exist; shard count is " + shards.length);
    }
    return shards[shardId];
  }

  public int shardCount() {
    return shards.length;
  }

  public StorageMetrics metrics() {
    long total = 0;
    int active = 0;
    long blocks = 0;
    for (Shard shard : shards) {
      final int size = shard.size();
      total += size;
      if (size > 0) active++;
      blocks += shard.finalizedBlockCount();
    }
    return new StorageMetrics(total, shards.length, active, (double) total / shards.length, blocks);
  }

  public boolean isCrashed() {
    return crashed.get();
  }

  @Override
  public void close() {
    shardWriters.shutdown();
  }
}
