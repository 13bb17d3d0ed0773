// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.NodeId;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/// The fixed set of replicas. Every correct node holds the same membership so that all compute the same primary for
/// a view: the member at `view mod n` in node id order.
public record ClusterMembership(Map<NodeId, Member> members) {
  public ClusterMembership {
    if (members.isEmpty()) throw new IllegalArgumentException("A cluster needs at least one member");
    members = Map.copyOf(members);
  }

  public static ClusterMembership of(Collection<Member> members) {
    return new ClusterMembership(members.stream().collect(Collectors.toMap(Member::nodeId, Function.identity())));
  }

  public List<NodeId> sortedNodeIds() {
    return members.keySet().stream().sorted().toList();
  }

  public int size() {
    return members.size();
  }

  /// f = floor((n - 1) / 3)
  public int faultTolerance() {
    return (size() - 1) / 3;
  }

  /// 2f + 1
  public int quorumSize() {
    return 2 * faultTolerance() + 1;
  }

  public NodeId primaryFor(long view) {
    final var sorted = sortedNodeIds();
    return sorted.get((int) Math.floorMod(view, (long) sorted.size()));
  }

  public boolean contains(NodeId nodeId) {
    return members.containsKey(nodeId);
  }

  public Optional<Member> member(NodeId nodeId) {
    return Optional.ofNullable(members.get(nodeId));
  }

  /// The active members other than the given node, in node id order.
  public List<NodeId> otherActive(NodeId self) {
    return members.values().stream()
        .filter(Member::active)
        .map(Member::nodeId)
        .filter(id -> !id.equals(self))
        .sorted()
        .toList();
  }
}
