// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.service;

import com.github.pbft_ledger.consensus.ConsensusMetrics;
import com.github.pbft_ledger.storage.StorageMetrics;
import com.github.pbft_ledger.token.VerifierMetrics;

public record LedgerMetrics(ConsensusMetrics consensus, StorageMetrics storage, VerifierMetrics verification) {
}
