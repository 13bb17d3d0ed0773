// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.storage;

import lombok.With;

/// Filters for {@link MerkleStorage#query}. Null fields do not filter. Times are inclusive epoch millis. A null limit
/// uses the configured default.
@With
public record RecordQuery(String tokenId, String department, Long startTime, Long endTime, Integer limit) {

  public static RecordQuery all() {
    return new RecordQuery(null, null, null, null, null);
  }

  public boolean matches(PermanentRecord record) {
    if (tokenId != null && !tokenId.equals(record.tokenId())) return false;
    if (department != null && !department.equals(record.department())) return false;
    if (startTime != null && record.timestamp() < startTime) return false;
    return endTime == null || record.timestamp() <= endTime;
  }
}
