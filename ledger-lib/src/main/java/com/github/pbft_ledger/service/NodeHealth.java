// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.service;

import com.github.pbft_ledger.NodeId;

/// A status suitable for an orchestrator liveness check. DOWN means the node must be restarted.
public record NodeHealth(NodeId nodeId, Status status, long view, NodeId primary, long totalRecords) {
  public enum Status {
    HEALTHY, DOWN
  }
}
