// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.storage;

import com.github.pbft_ledger.LedgerJson;

import java.util.ArrayList;
import java.util.List;

/// Append-only binary Merkle tree over hex SHA-256 leaf hashes. A node without a right sibling is paired with itself.
///
/// Each append recomputes only the path from the new leaf to the root. The leaf index is the insertion order and never
/// changes, so a proof for index `i` can be regenerated at any time and verifies against the current root.
///
/// Not thread safe: a {@link Shard} owns its tree and serialises access.
public class MerkleTree {
  public static final String EMPTY_ROOT = LedgerJson.sha256Hex(new byte[0]);

  /// levels.get(0) are the leaves, the last level holds the root
  private final List<List<String>> levels = new ArrayList<>();

  public MerkleTree() {
    levels.add(new ArrayList<>());
  }

  /// Appends a leaf and returns its index.
  public int append(String leafHash) {
    final var leaves = levels.get(0);
    leaves.add(leafHash);
    final int leafIndex = leaves.size() - 1;
    int index = leafIndex;
    int level = 0;
    while (levels.get(level).size() > 1) {
      final var current = levels.get(level);
      final int parentIndex = index / 2;
      final int leftIndex = parentIndex * 2;
      final var left = current.get(leftIndex);
      final var right = leftIndex + 1 < current.size() ? current.get(leftIndex + 1) : left;
      if (levels.size() == level + 1) {
        levels.add(new ArrayList<>());
      }
      final var parents = levels.get(level + 1);
      final var parent = hashPair(left, right);
      if (parentIndex < parents.size()) {
        parents.set(parentIndex, parent);
      } else {
        parents.add(parent);
      }
      index = parentIndex;
      level++;
    }
    return leafIndex;
  }

  public String root() {
    final var top = levels.get(levels.size() - 1);
    return top.isEmpty() ? EMPTY_ROOT : top.get(0);
  }

  public int size() {
    return levels.get(0).size();
  }

  public String leaf(int index) {
    return levels.get(0).get(index);
  }

  public MerkleProof proof(int leafIndex) {
    if (leafIndex < 0 || leafIndex >= size()) {
      throw new IndexOutOfBoundsException("Leaf index out of bounds: " + leafIndex + " size " + size());
    }
    final var steps = new ArrayList<MerkleProof.ProofStep>();
    int index = leafIndex;
    for (int level = 0; level < levels.size() - 1; level++) {
      final var current = levels.get(level);
      final boolean isRightChild = index % 2 == 1;
      final int siblingIndex = isRightChild ? index - 1 : index + 1;
      final var sibling = siblingIndex < current.size() ? current.get(siblingIndex) : current.get(index);
      steps.add(new MerkleProof.ProofStep(sibling, isRightChild));
      index = index / 2;
    }
    return new MerkleProof(leaf(leafIndex), leafIndex, steps, root());
  }

  static String hashPair(String left, String right) {
    return LedgerJson.sha256Hex(left + right);
  }
}
