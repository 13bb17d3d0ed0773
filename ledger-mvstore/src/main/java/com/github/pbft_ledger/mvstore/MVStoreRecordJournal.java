// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.mvstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.github.pbft_ledger.LedgerJson;
import com.github.pbft_ledger.storage.BlockHeader;
import com.github.pbft_ledger.storage.PermanentRecord;
import com.github.pbft_ledger.storage.RecordJournal;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.jetbrains.annotations.NotNull;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/// Journals records and block headers as JSON in per shard MVStore maps keyed by append position. {@link #sync()}
/// commits the store.
public class MVStoreRecordJournal implements RecordJournal {
  static final String PREFIX = "com.github.pbft_ledger.mvstore#";

  private final MVStore store;
  private final ConcurrentHashMap<Integer, MVMap<Long, String>> records = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Integer, MVMap<Long, String>> blocks = new ConcurrentHashMap<>();

  public MVStoreRecordJournal(@NotNull MVStore store) {
    this.store = store;
  }

  private MVMap<Long, String> recordMap(int shardId) {
    return records.computeIfAbsent(shardId, id -> store.openMap(PREFIX + "records-" + id));
  }

  private MVMap<Long, String> blockMap(int shardId) {
    return blocks.computeIfAbsent(shardId, id -> store.openMap(PREFIX + "blocks-" + id));
  }

  @Override
  public void append(PermanentRecord record) {
    final var map = recordMap(record.shardId());
    map.put((long) map.size(), write(record));
  }

  @Override
  public void finalizeBlock(BlockHeader header) {
    blockMap(header.shardId()).put(header.height(), write(header));
  }

  @Override
  public List<PermanentRecord> records(int shardId) {
    return recordMap(shardId).values().stream().map(json -> read(json, PermanentRecord.class)).toList();
  }

  @Override
  public List<BlockHeader> blocks(int shardId) {
    return blockMap(shardId).values().stream().map(json -> read(json, BlockHeader.class)).toList();
  }

  @Override
  public void sync() {
    store.commit();
  }

  private static String write(Object value) {
    try {
      return LedgerJson.MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Unable to journal " + value.getClass().getSimpleName(), e);
    }
  }

  private static <T> T read(String json, Class<T> type) {
    try {
      return LedgerJson.MAPPER.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Corrupt journal entry for " + type.getSimpleName(), e);
    }
  }
}
