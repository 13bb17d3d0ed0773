// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.token;

public record VerifierMetrics(long verifiedTokens, long rejectedTokens, int replaySetSize, int cachedTokens,
                              int keysLoaded) {
}
