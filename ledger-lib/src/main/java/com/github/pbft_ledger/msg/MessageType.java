// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.msg;

/// The three PBFT phases plus the view change vote on the wire. The byte is the wire tag.
public enum MessageType {
  PRE_PREPARE((byte) 1),
  PREPARE((byte) 2),
  COMMIT((byte) 3),
  VIEW_CHANGE((byte) 4);

  private final byte tag;

  MessageType(byte tag) {
    this.tag = tag;
  }

  public byte tag() {
    return tag;
  }

  public static MessageType fromTag(byte tag) {
    return switch (tag) {
      case 1 -> PRE_PREPARE;
      case 2 -> PREPARE;
      case 3 -> COMMIT;
      case 4 -> VIEW_CHANGE;
      default -> throw new IllegalArgumentException("Unknown message type tag: " + tag);
    };
  }
}
