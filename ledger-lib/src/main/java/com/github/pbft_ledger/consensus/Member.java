// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.NodeId;

import java.security.PublicKey;
import java.util.Objects;

/// A replica as registered in the cluster configuration.
///
/// @param publicKey the Ed25519 key its consensus messages are signed with, may be null when a non key based
///                  {@link MessageAuthenticator} is in use
/// @param endpoint  the transport address the network layer delivers to
/// @param active    inactive members keep their place in primary rotation but are not sent messages
public record Member(NodeId nodeId, PublicKey publicKey, String endpoint, boolean active) {
  public Member {
    Objects.requireNonNull(nodeId, "nodeId");
  }

  public static Member of(NodeId nodeId, PublicKey publicKey) {
    return new Member(nodeId, publicKey, nodeId.id(), true);
  }
}
