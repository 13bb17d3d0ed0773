// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.network;

import java.util.List;

/// The channels the ledger uses between replicas.
public enum SystemChannel {
  CONSENSUS((short) 1),       // PRE_PREPARE, PREPARE, COMMIT and VIEW_CHANGE
  PROXY((short) 2);           // requests handed from the entry node to the other replicas

  final Channel channel;

  public Channel value() {
    return channel;
  }

  SystemChannel(short id) {
    this.channel = new Channel(id);
  }

  public static List<Channel> systemChannels() {
    return List.of(CONSENSUS.channel, PROXY.channel);
  }

  public short id() {
    return channel.id();
  }
}
