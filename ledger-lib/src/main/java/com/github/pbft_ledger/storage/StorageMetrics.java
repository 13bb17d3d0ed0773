// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.storage;

public record StorageMetrics(long totalRecords, int shardCount, int shardsActive, double averageShardSize,
                             long blocksFinalized) {
}
