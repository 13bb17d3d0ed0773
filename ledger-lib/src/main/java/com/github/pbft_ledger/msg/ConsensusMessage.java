// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.msg;

import com.github.pbft_ledger.NodeId;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/// A signed PBFT protocol message. Only PRE_PREPARE carries the request, and with it the capability token, so that
/// backups can check the digest and re-verify the token themselves.
///
/// The signature covers {@link #signedContent()}. It is empty until the sender signs the message.
public record ConsensusMessage(
    MessageType type,
    long view,
    long sequence,
    String digest,
    NodeId nodeId,
    String signature,
    Optional<Request> request
) {
  public ConsensusMessage {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(digest, "digest");
    Objects.requireNonNull(nodeId, "nodeId");
    signature = signature == null ? "" : signature;
    request = request == null ? Optional.empty() : request;
    if (type == MessageType.PRE_PREPARE && request.isEmpty()) {
      throw new IllegalArgumentException("PRE_PREPARE must carry the request");
    }
    if (type != MessageType.PRE_PREPARE && request.isPresent()) {
      throw new IllegalArgumentException(type + " must not carry the request");
    }
  }

  public static ConsensusMessage prePrepare(long view, long sequence, NodeId from, Request request) {
    return new ConsensusMessage(MessageType.PRE_PREPARE, view, sequence, request.digest(), from, "",
        Optional.of(request));
  }

  public static ConsensusMessage prepare(long view, long sequence, String digest, NodeId from) {
    return new ConsensusMessage(MessageType.PREPARE, view, sequence, digest, from, "", Optional.empty());
  }

  public static ConsensusMessage commit(long view, long sequence, String digest, NodeId from) {
    return new ConsensusMessage(MessageType.COMMIT, view, sequence, digest, from, "", Optional.empty());
  }

  /// A vote to move to `newView`. It carries no digest and no sequence.
  public static ConsensusMessage viewChange(long newView, NodeId from) {
    return new ConsensusMessage(MessageType.VIEW_CHANGE, newView, 0, "", from, "", Optional.empty());
  }

  public SlotKey slot() {
    return new SlotKey(view, sequence);
  }

  public Optional<String> token() {
    return request.map(Request::token);
  }

  /// The bytes the sender signs: `type|view|sequence|digest|nodeId`.
  public byte[] signedContent() {
    return (type.name() + "|" + view + "|" + sequence + "|" + digest + "|" + nodeId.id())
        .getBytes(StandardCharsets.UTF_8);
  }

  public ConsensusMessage withSignature(String signature) {
    return new ConsensusMessage(type, view, sequence, digest, nodeId, signature, request);
  }

  @Override
  public String toString() {
    return type + "{" + view + "-" + sequence + " from " + nodeId + " digest=" + abbreviate(digest) + "}";
  }

  private static String abbreviate(String digest) {
    return digest.length() > 12 ? digest.substring(0, 12) : digest;
  }
}
