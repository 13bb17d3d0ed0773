// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.NodeId;
import com.github.pbft_ledger.msg.ConsensusMessage;

/// Signs this node's consensus messages and checks the signatures of others. The protocol only depends on this
/// capability so the crypto provider is a deployment choice.
public interface MessageAuthenticator {

  String sign(byte[] content);

  /// @return true only when the signature was made over the content by the claimed signer
  boolean verify(byte[] content, String signature, NodeId signer);

  default ConsensusMessage sign(ConsensusMessage message) {
    return message.withSignature(sign(message.signedContent()));
  }

  default boolean verify(ConsensusMessage message) {
    return !message.signature().isEmpty() && verify(message.signedContent(), message.signature(), message.nodeId());
  }
}
