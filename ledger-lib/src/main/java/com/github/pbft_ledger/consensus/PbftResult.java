// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.msg.ConsensusMessage;

import java.util.List;

/// The outcome of handing one input to a {@link PbftNode}: messages to broadcast and requests now executable in
/// order.
public record PbftResult(List<ConsensusMessage> messages, List<CommittedRequest> committed) {
  public PbftResult {
    messages = List.copyOf(messages);
    committed = List.copyOf(committed);
  }

  static PbftResult noResult() {
    return new PbftResult(List.of(), List.of());
  }
}
