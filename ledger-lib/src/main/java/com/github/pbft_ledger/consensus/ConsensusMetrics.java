// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.NodeId;

public record ConsensusMetrics(NodeId nodeId, long currentView, NodeId primary, long currentSequence, int pending,
                               int committed, int byzantineTolerance, int quorumSize) {
}
