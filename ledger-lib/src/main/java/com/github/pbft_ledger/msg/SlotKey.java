// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.msg;

/// A consensus instance is identified by the view it was proposed in and the sequence number the primary assigned.
public record SlotKey(long view, long sequence) implements Comparable<SlotKey> {
  @Override
  public int compareTo(SlotKey other) {
    final int byView = Long.compare(view, other.view);
    return byView != 0 ? byView : Long.compare(sequence, other.sequence);
  }

  @Override
  public String toString() {
    return view + "-" + sequence;
  }
}
