// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.NodeId;
import com.github.pbft_ledger.msg.SlotKey;

import java.util.Set;

/// Decides whether a set of matching votes for a slot is enough to move to the next phase. Only votes whose digest
/// matches the slot's accepted PRE_PREPARE are ever passed in.
public interface QuorumStrategy {
  QuorumOutcome assessPrepares(SlotKey slot, Set<NodeId> matchingVotes);

  QuorumOutcome assessCommits(SlotKey slot, Set<NodeId> matchingVotes);

  /// Enough nodes voted for the view to enter it.
  QuorumOutcome assessViewChange(long view, Set<NodeId> votes);

  /// Enough nodes want to leave the current view that at least one of them is correct, so this node joins them.
  QuorumOutcome assessViewChangeJoin(Set<NodeId> votes);

  enum QuorumOutcome {
    WIN, WAIT
  }

  default QuorumOutcome countVotes(int quorum, Set<NodeId> votes) {
    return votes.size() >= quorum ? QuorumOutcome.WIN : QuorumOutcome.WAIT;
  }
}
