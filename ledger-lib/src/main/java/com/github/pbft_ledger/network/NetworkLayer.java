// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.network;

import com.github.pbft_ledger.NodeId;

import java.io.Closeable;
import java.util.function.Consumer;

/// The ledger is agnostic to the transport. An implementation delivers each message point-to-point to the registered
/// endpoint of the destination node and hands inbound messages for a channel to the subscribed handler.
public interface NetworkLayer extends Closeable {
  <T> void subscribe(Channel channel, Consumer<T> handler, String name);

  <T> void send(Channel channel, NodeId to, T msg);

  void start();
}
