// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.service;

import com.github.pbft_ledger.LedgerException;
import com.github.pbft_ledger.storage.PermanentRecord;

import java.util.Optional;

/// The outcome of one batch item: exactly one of record and error is present.
public record ProcessResult(PermanentRecord record, LedgerException error) {
  public ProcessResult {
    if ((record == null) == (error == null)) {
      throw new IllegalArgumentException("Exactly one of record and error must be set");
    }
  }

  public static ProcessResult success(PermanentRecord record) {
    return new ProcessResult(record, null);
  }

  public static ProcessResult failure(LedgerException error) {
    return new ProcessResult(null, error);
  }

  public boolean isSuccess() {
    return record != null;
  }

  public Optional<PermanentRecord> optionalRecord() {
    return Optional.ofNullable(record);
  }

  public Optional<LedgerException> optionalError() {
    return Optional.ofNullable(error);
  }
}
