// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger;

import com.github.pbft_ledger.consensus.MessageAuthenticator;

/// A cheap stand in for real signatures: a node's signature is its id bound to the digest of the content.
public class TestAuthenticator implements MessageAuthenticator {
  private final NodeId self;

  public TestAuthenticator(NodeId self) {
    this.self = self;
  }

  @Override
  public String sign(byte[] content) {
    return expected(content, self);
  }

  @Override
  public boolean verify(byte[] content, String signature, NodeId signer) {
    return expected(content, signer).equals(signature);
  }

  static String expected(byte[] content, NodeId signer) {
    return "test:" + signer.id() + ":" + LedgerJson.sha256Hex(content);
  }
}
