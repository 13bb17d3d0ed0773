// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger;

import java.util.Objects;

/// The identity of a replica. Primary selection sorts on this so it must be stable across the cluster.
public record NodeId(String id) implements Comparable<NodeId> {
  public NodeId {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) throw new IllegalArgumentException("Node ID must not be blank");
  }

  @Override
  public int compareTo(NodeId other) {
    return id.compareTo(other.id);
  }

  @Override
  public String toString() {
    return id;
  }
}
