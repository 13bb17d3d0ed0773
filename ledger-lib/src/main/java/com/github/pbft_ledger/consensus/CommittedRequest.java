// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.NodeId;
import com.github.pbft_ledger.msg.Request;
import com.github.pbft_ledger.msg.SlotKey;
import com.github.pbft_ledger.token.TokenPayload;

import java.util.Set;

/// A request that reached a commit quorum and is ready to execute, with the votes that certified it.
///
/// @param prepareQuorum the nodes whose matching PRE_PREPARE or PREPARE completed the prepare quorum
/// @param commitQuorum  the nodes whose matching COMMIT completed the commit quorum
public record CommittedRequest(
    SlotKey slot,
    Request request,
    TokenPayload payload,
    String digest,
    Set<NodeId> prepareQuorum,
    Set<NodeId> commitQuorum
) {
  public CommittedRequest {
    prepareQuorum = Set.copyOf(prepareQuorum);
    commitQuorum = Set.copyOf(commitQuorum);
  }
}
