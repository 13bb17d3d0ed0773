// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.msg.ConsensusMessage;

import java.util.List;

/// Messages to broadcast plus the host results of anything executed while the mutex was held.
public record EngineResult<RESULT>(List<ConsensusMessage> messages, List<HostResult<RESULT>> results) {
  static <RESULT> EngineResult<RESULT> empty() {
    return new EngineResult<>(List.of(), List.of());
  }
}
