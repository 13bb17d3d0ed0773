// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

/// Progress of one slot at one node. A slot abandoned by a view change simply disappears.
public enum Phase {
  /// votes buffered before the PRE_PREPARE arrived
  IDLE,
  /// the primary has broadcast its PRE_PREPARE
  PRE_PREPARE,
  /// a backup accepted the PRE_PREPARE and broadcast its PREPARE
  PREPARE,
  /// prepared with a quorum and broadcast COMMIT
  COMMIT,
  /// committed with a quorum, waiting to execute in sequence order
  COMMITTED
}
