// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.NodeId;
import com.github.pbft_ledger.msg.SlotKey;

import java.util.Set;

/// The PBFT quorum: with `n` nodes tolerating `f = floor((n - 1) / 3)` faults any `2f + 1` votes intersect any other
/// quorum in at least one correct node.
public class ByzantineQuorum implements QuorumStrategy {
  final int clusterSize;
  final int faultTolerance;
  final int quorum;

  public ByzantineQuorum(int clusterSize) {
    if (clusterSize < 1) {
      throw new IllegalArgumentException("clusterSize must be at least 1");
    }
    this.clusterSize = clusterSize;
    this.faultTolerance = (clusterSize - 1) / 3;
    this.quorum = 2 * faultTolerance + 1;
  }

  public ByzantineQuorum(ClusterMembership membership) {
    this(membership.size());
  }

  @Override
  public QuorumOutcome assessPrepares(SlotKey slot, Set<NodeId> matchingVotes) {
    return countVotes(quorum, matchingVotes);
  }

  @Override
  public QuorumOutcome assessCommits(SlotKey slot, Set<NodeId> matchingVotes) {
    return countVotes(quorum, matchingVotes);
  }

  @Override
  public QuorumOutcome assessViewChange(long view, Set<NodeId> votes) {
    return countVotes(quorum, votes);
  }

  @Override
  public QuorumOutcome assessViewChangeJoin(Set<NodeId> votes) {
    return countVotes(faultTolerance + 1, votes);
  }

  public int faultTolerance() {
    return faultTolerance;
  }

  public int quorum() {
    return quorum;
  }
}
