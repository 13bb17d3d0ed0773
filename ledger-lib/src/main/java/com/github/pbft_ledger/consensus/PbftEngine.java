// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.NodeId;
import com.github.pbft_ledger.msg.ConsensusMessage;
import com.github.pbft_ledger.msg.Request;
import com.github.pbft_ledger.token.TokenPayload;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.TestOnly;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import java.util.logging.Level;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;

/// Guards a [PbftNode] with a mutex and applies committed requests through the host's [CommitHandler]:
/// - single threaded access to the node
/// - committed requests applied in order while the mutex is held
/// - the node marked crashed if the host fails to apply a committed request
///
/// It is closable to use try-with-resources so the node is stopped on bad data or storage failures.
public class PbftEngine<RESULT> implements AutoCloseable {
  /// The underlying algorithm guarded by this class.
  final protected PbftNode node;

  /// The callback to the host application to apply committed requests.
  final protected CommitHandler<RESULT> commitHandler;

  /// Non-reentrant fair mutex.
  private final Semaphore mutex = new Semaphore(1, true);

  public PbftEngine(@NotNull PbftNode node, @NotNull CommitHandler<RESULT> commitHandler) {
    this.node = node;
    this.commitHandler = commitHandler;
  }

  /// Processes a batch of inbound messages. The following may happen:
  ///
  /// 1. A message is dropped when it is stale, misdirected or not signed by a member.
  /// 2. Votes are recorded and the node answers with PREPARE or COMMIT messages.
  /// 3. Slots that reach the commit quorum are executed in sequence order through the [CommitHandler].
  /// 4. Enough VIEW_CHANGE votes move the node into a new view.
  ///
  /// @return messages to broadcast and the host results by request id
  public EngineResult<RESULT> consensus(List<ConsensusMessage> messages) {
    return underMutex(() -> {
      final var outbound = new ArrayList<ConsensusMessage>();
      final var committed = new ArrayList<CommittedRequest>();
      for (var message : messages) {
        LOGGER.finer(() -> node.nodeId() + " <~ " + message);
        final var result = node.consensus(message);
        outbound.addAll(result.messages());
        committed.addAll(result.committed());
      }
      return new EngineResult<>(outbound, apply(committed));
    });
  }

  /// Proposes a request when this node is the primary. Duplicates of committed or in-flight requests produce nothing.
  public EngineResult<RESULT> propose(Request request, TokenPayload payload) {
    return underMutex(() -> {
      if (!node.isPrimary()) {
        LOGGER.fine(() -> "node " + node.nodeId() + " ignoring proposal of " + request.id() + " as not primary");
        return EngineResult.<RESULT>empty();
      }
      final var result = node.prePrepare(request, payload);
      return new EngineResult<>(result.messages(), apply(result.committed()));
    });
  }

  /// Votes to leave the current view. The view changes once enough nodes voted, which may be right away when the
  /// votes of others already arrived. Committed slots still waiting on a gap are then executed.
  public EngineResult<RESULT> requestViewChange() {
    return underMutex(() -> {
      final var result = node.requestViewChange();
      return new EngineResult<>(result.messages(), apply(result.committed()));
    });
  }

  private List<HostResult<RESULT>> apply(List<CommittedRequest> committed) {
    if (committed.isEmpty()) {
      return List.of();
    }
    final List<RESULT> applied;
    try {
      applied = commitHandler.execute(committed);
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, "Crashing " + node.nodeId() + " as the host failed to apply committed requests: " + e, e);
      node.crash();
      throw e;
    }
    if (applied.size() != committed.size()) {
      node.crash();
      throw new IllegalStateException("Host returned " + applied.size() + " results for " + committed.size()
          + " committed requests");
    }
    final var results = new ArrayList<HostResult<RESULT>>(committed.size());
    for (int i = 0; i < committed.size(); i++) {
      final var c = committed.get(i);
      results.add(new HostResult<>(c.slot(), c.request().id(), applied.get(i)));
    }
    return results;
  }

  public Optional<RESULT> executed(String requestId) {
    return underMutex(() -> node.isCommitted(requestId) ? commitHandler.executed(requestId) : Optional.<RESULT>empty());
  }

  public boolean isCommitted(String requestId) {
    return underMutex(() -> node.isCommitted(requestId));
  }

  public boolean isPrimary() {
    return underMutex(node::isPrimary);
  }

  public NodeId primary() {
    return underMutex(node::primary);
  }

  public long view() {
    return underMutex(node::view);
  }

  public ConsensusMetrics metrics(int pending) {
    return underMutex(() -> new ConsensusMetrics(
        node.nodeId(),
        node.view(),
        node.primary(),
        node.sequence(),
        pending,
        node.committedCount(),
        node.membership().faultTolerance(),
        node.membership().quorumSize()));
  }

  public NodeId nodeId() {
    return node.nodeId();
  }

  private <T> T underMutex(Supplier<T> action) {
    try {
      mutex.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warning("PbftEngine was interrupted probably to shutdown while under load so we will close.");
      node.close();
      throw new ConsensusException(ConsensusException.Reason.NOT_RUNNING, "Interrupted waiting for the engine", e);
    }
    try {
      return action.get();
    } finally {
      mutex.release();
    }
  }

  @Override
  public void close() {
    LOGGER.info(() -> "Closing PbftEngine of " + node.nodeId());
    node.close();
  }

  public boolean isClosed() {
    return node.isClosed();
  }

  public boolean isCrashed() {
    return node.isCrashed();
  }

  @TestOnly
  public PbftNode node() {
    return node;
  }
}
