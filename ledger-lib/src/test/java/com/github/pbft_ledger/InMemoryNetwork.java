// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger;

import com.github.pbft_ledger.network.Channel;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;
import java.util.function.Predicate;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;

/// Queues pickled messages between the layers of one test cluster. Nothing is delivered until a test calls
/// {@link #drain()} which delivers on the calling thread until the queue is empty, so runs are repeatable.
///
/// A silenced node neither sends nor receives. A drop rule discards individual messages.
public class InMemoryNetwork {
  public record Envelope(Channel channel, NodeId from, NodeId to, ByteBuffer data) {
  }

  private final Map<NodeId, Map<Channel, Consumer<ByteBuffer>>> endpoints = new ConcurrentHashMap<>();
  private final ConcurrentLinkedQueue<Envelope> queue = new ConcurrentLinkedQueue<>();
  private final Set<NodeId> silenced = ConcurrentHashMap.newKeySet();
  private final List<Predicate<Envelope>> dropRules = Collections.synchronizedList(new ArrayList<>());
  private final List<Envelope> delivered = Collections.synchronizedList(new ArrayList<>());

  void register(NodeId nodeId, Channel channel, Consumer<ByteBuffer> handler) {
    endpoints.computeIfAbsent(nodeId, k -> new ConcurrentHashMap<>()).put(channel, handler);
  }

  void send(Channel channel, NodeId from, NodeId to, ByteBuffer data) {
    queue.add(new Envelope(channel, from, to, data));
  }

  public void silence(NodeId nodeId) {
    silenced.add(nodeId);
  }

  public void heal(NodeId nodeId) {
    silenced.remove(nodeId);
  }

  public void dropWhen(Predicate<Envelope> rule) {
    dropRules.add(rule);
  }

  public void clearDropRules() {
    dropRules.clear();
  }

  /// Delivers queued messages, including those sent while delivering, until none are left.
  ///
  /// @return the number of messages delivered
  public int drain() {
    int count = 0;
    Envelope envelope;
    while ((envelope = queue.poll()) != null) {
      if (deliver(envelope)) {
        count++;
      }
    }
    return count;
  }

  private boolean deliver(Envelope envelope) {
    if (silenced.contains(envelope.from()) || silenced.contains(envelope.to())) {
      return false;
    }
    synchronized (dropRules) {
      if (dropRules.stream().anyMatch(rule -> rule.test(envelope))) {
        LOGGER.finer(() -> "Dropping " + envelope.channel() + " " + envelope.from() + " -> " + envelope.to());
        return false;
      }
    }
    final var handler = endpoints.getOrDefault(envelope.to(), Map.of()).get(envelope.channel());
    if (handler == null) {
      return false;
    }
    delivered.add(envelope);
    handler.accept(envelope.data().duplicate());
    return true;
  }

  public List<Envelope> delivered() {
    synchronized (delivered) {
      return List.copyOf(delivered);
    }
  }

  public int pending() {
    return queue.size();
  }
}
