// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.mvstore;

import com.github.pbft_ledger.LedgerConfig;
import com.github.pbft_ledger.TestTokens;
import com.github.pbft_ledger.storage.MerkleStorage;
import com.github.pbft_ledger.storage.PermanentRecord;
import com.github.pbft_ledger.storage.StoreRequest;
import com.github.pbft_ledger.token.TokenPayload;
import com.github.pbft_ledger.token.ValidationResults;
import org.h2.mvstore.MVStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

public class MVStoreRecordJournalTest {
  final LedgerConfig config = LedgerConfig.defaults().withBlockSize(50);

  static List<StoreRequest> requests(int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> StoreRequest.of(
            new TokenPayload("jti-" + i, "stage1.token-issuer", Set.of("stage2.consensus.network"), 0, 60,
                new ValidationResults(0.75, List.of("schema")), i % 3 == 0 ? null : "ops", 1),
            Map.of("i", i, "tags", List.of("a", "b"), "nested", Map.of("ok", true)),
            PermanentRecord.idFor("request-" + i),
            1_000L * i))
        .toList();
  }

  @Test
  public void inMemoryStoreRoundTripsEntries() {
    final var journal = new MVStoreRecordJournal(MVStore.open(null));
    try (var storage = new MerkleStorage(config, journal, TestTokens.CLOCK)) {
      storage.storeBatch(requests(120));
      final var journaled = IntStream.range(0, 4).mapToObj(journal::records).mapToInt(List::size).sum();
      assertThat(journaled).isEqualTo(120);
      assertThat(journal.records(0)).allMatch(PermanentRecord::hashMatchesContent);
    }
  }

  @Test
  public void recoversShardsAfterRestart(@TempDir Path dir) {
    final var file = dir.resolve("ledger.mv.db").toString();
    final List<PermanentRecord> stored;
    final String[] roots = new String[4];
    final long blocks;

    final var first = new MVStore.Builder().fileName(file).open();
    try (var storage = new MerkleStorage(config, new MVStoreRecordJournal(first), TestTokens.CLOCK)) {
      stored = storage.storeBatch(requests(400));
      for (int s = 0; s < 4; s++) {
        roots[s] = storage.shardRoot(s);
      }
      blocks = storage.metrics().blocksFinalized();
    }
    first.close();
    assertThat(blocks).isPositive();

    final var second = new MVStore.Builder().fileName(file).open();
    try (var storage = new MerkleStorage(config, new MVStoreRecordJournal(second), TestTokens.CLOCK)) {
      for (int s = 0; s < 4; s++) {
        assertThat(storage.shardRoot(s)).isEqualTo(roots[s]);
      }
      assertThat(storage.metrics().totalRecords()).isEqualTo(400);
      assertThat(storage.metrics().blocksFinalized()).isEqualTo(blocks);
      assertThat(stored).allMatch(storage::verifyRecord);
      assertThat(storage.getRecord(stored.get(7).id())).hasValueSatisfying(r -> {
        assertThat(r.hash()).isEqualTo(stored.get(7).hash());
        assertThat(r.merkleProof()).isEqualTo(stored.get(7).merkleProof());
      });
    } finally {
      second.close();
    }
  }
}
