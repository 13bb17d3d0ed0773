// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.storage;

import java.util.List;

/// Inclusion proof of one leaf. Folding the steps over the leaf hash yields the root the proof was issued against.
///
/// @param leafHash  the record hash at the leaf
/// @param leafIndex insertion position of the leaf within its block
/// @param steps     sibling hashes from the leaf level upwards
/// @param root      the tree root when the proof was issued
public record MerkleProof(String leafHash, int leafIndex, List<ProofStep> steps, String root) {
  public MerkleProof {
    steps = List.copyOf(steps);
  }

  /// A sibling hash and whether it sits to the left of the running hash.
  public record ProofStep(String hash, boolean left) {
  }

  /// Recomputes the root from the leaf and the steps.
  public String computeRoot() {
    String current = leafHash;
    for (ProofStep step : steps) {
      current = step.left() ? MerkleTree.hashPair(step.hash(), current) : MerkleTree.hashPair(current, step.hash());
    }
    return current;
  }

  public boolean verifies() {
    return computeRoot().equals(root);
  }

  public boolean verifiesAgainst(String expectedRoot) {
    return computeRoot().equals(expectedRoot);
  }
}
