// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.service;

import com.github.pbft_ledger.consensus.CommitHandler;
import com.github.pbft_ledger.consensus.CommittedRequest;
import com.github.pbft_ledger.storage.MerkleStorage;
import com.github.pbft_ledger.storage.PermanentRecord;
import com.github.pbft_ledger.storage.StoreRequest;

import java.util.List;
import java.util.Optional;

/// Executes committed requests by appending their records to the Merkle storage.
class StorageCommitHandler implements CommitHandler<PermanentRecord> {
  private final MerkleStorage storage;

  StorageCommitHandler(MerkleStorage storage) {
    this.storage = storage;
  }

  @Override
  public List<PermanentRecord> execute(List<CommittedRequest> committed) {
    return storage.storeBatch(committed.stream()
        .map(c -> StoreRequest.forCommitted(c.request(), c.payload()))
        .toList());
  }

  @Override
  public Optional<PermanentRecord> executed(String requestId) {
    return storage.getRecord(PermanentRecord.idFor(requestId));
  }
}
