// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.service;

import com.github.pbft_ledger.storage.PermanentRecord;

/// The answer to {@link StorageService#verifyRecord}. The record is null when it was not found.
public record RecordVerification(String recordId, boolean valid, PermanentRecord record, String reason) {

  static RecordVerification notFound(String recordId) {
    return new RecordVerification(recordId, false, null, "Record not found");
  }

  static RecordVerification of(PermanentRecord record, boolean valid) {
    return new RecordVerification(record.id(), valid, record, valid ? null : "Merkle proof verification failed");
  }
}
