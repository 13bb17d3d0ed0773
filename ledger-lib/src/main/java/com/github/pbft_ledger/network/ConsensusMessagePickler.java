// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.network;

import com.github.pbft_ledger.NodeId;
import com.github.pbft_ledger.Pickler;
import com.github.pbft_ledger.msg.ConsensusMessage;
import com.github.pbft_ledger.msg.MessageType;
import com.github.pbft_ledger.msg.Request;

import java.nio.ByteBuffer;
import java.util.Optional;

/// Binary wire format of the consensus channel:
///
/// ```
/// type(1) view(8) sequence(8) digest nodeId signature hasRequest(1) [request]
/// ```
///
/// Strings are an int length followed by UTF-8 bytes. The request, present only on PRE_PREPARE, uses
/// {@link RequestPickler}.
public class ConsensusMessagePickler implements Pickler<ConsensusMessage> {
  public static final ConsensusMessagePickler instance = new ConsensusMessagePickler();

  private static final int HEADER_SIZE = 1 + Long.BYTES + Long.BYTES; // type + view + sequence

  protected ConsensusMessagePickler() {
  }

  public static byte[] pickle(ConsensusMessage msg) {
    final var buffer = ByteBuffer.allocate(instance.sizeOf(msg));
    instance.serialize(msg, buffer);
    return buffer.array();
  }

  public static ConsensusMessage unpickle(ByteBuffer buffer) {
    return instance.deserialize(buffer);
  }

  @Override
  public void serialize(ConsensusMessage msg, ByteBuffer buffer) {
    buffer.put(msg.type().tag());
    buffer.putLong(msg.view());
    buffer.putLong(msg.sequence());
    PickleSupport.write(msg.digest(), buffer);
    PickleSupport.write(msg.nodeId().id(), buffer);
    PickleSupport.write(msg.signature(), buffer);
    buffer.put((byte) (msg.request().isPresent() ? 1 : 0));
    msg.request().ifPresent(request -> RequestPickler.instance.serialize(request, buffer));
  }

  @Override
  public ConsensusMessage deserialize(ByteBuffer buffer) {
    final var type = MessageType.fromTag(buffer.get());
    final long view = buffer.getLong();
    final long sequence = buffer.getLong();
    final var digest = PickleSupport.readString(buffer);
    final var nodeId = new NodeId(PickleSupport.readString(buffer));
    final var signature = PickleSupport.readString(buffer);
    final Optional<Request> request = buffer.get() == 1 ?
        Optional.of(RequestPickler.instance.deserialize(buffer)) : Optional.empty();
    return new ConsensusMessage(type, view, sequence, digest, nodeId, signature, request);
  }

  @Override
  public int sizeOf(ConsensusMessage msg) {
    return HEADER_SIZE
        + PickleSupport.sizeOf(msg.digest())
        + PickleSupport.sizeOf(msg.nodeId().id())
        + PickleSupport.sizeOf(msg.signature())
        + 1
        + msg.request().map(RequestPickler.instance::sizeOf).orElse(0);
  }
}
