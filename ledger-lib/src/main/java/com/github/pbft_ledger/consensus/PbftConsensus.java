// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.LedgerConfig;
import com.github.pbft_ledger.NodeId;
import com.github.pbft_ledger.msg.ConsensusMessage;
import com.github.pbft_ledger.msg.Request;
import com.github.pbft_ledger.network.NetworkLayer;
import com.github.pbft_ledger.token.TokenException;
import com.github.pbft_ledger.token.TokenPayload;
import com.github.pbft_ledger.token.TokenVerifier;
import org.jetbrains.annotations.TestOnly;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;
import static com.github.pbft_ledger.network.SystemChannel.CONSENSUS;
import static com.github.pbft_ledger.network.SystemChannel.PROXY;

/// The replica as seen by the rest of the node. It gates requests on the token, proposes them when this node is the
/// primary or hands them to the other replicas, broadcasts what the engine produces, and completes the caller's
/// future once the request executes here.
///
/// A request submitted at a backup is sent to every other replica. The primary proposes it and the remaining backups
/// watch it. Every node that knows of a request arms a consensus timeout for it. When the timeout fires before the
/// request executes the node votes for a view change and keeps watching. Once enough nodes voted every node moves to
/// the new view and drives the requests it knows of at the new primary. After the configured number of timeouts a
/// request fails with {@link ConsensusException.Reason#QUORUM_NOT_REACHED}.
///
/// @param <RESULT> what the host's [CommitHandler] produces for an executed request
public class PbftConsensus<RESULT> implements AutoCloseable {
  private final LedgerConfig config;
  private final PbftEngine<RESULT> engine;
  private final ClusterMembership membership;
  private final NetworkLayer network;
  private final TokenVerifier tokenVerifier;
  private final ViewChangeTimer timer;

  /// Requests known at this node that have not executed here yet, whether submitted here or watched for a peer.
  private final ConcurrentHashMap<String, Pending<RESULT>> pending = new ConcurrentHashMap<>();

  volatile boolean running = false;

  record Pending<R>(Request request, TokenPayload payload, CompletableFuture<R> future, AtomicInteger timeouts) {
  }

  public PbftConsensus(LedgerConfig config,
                       PbftEngine<RESULT> engine,
                       ClusterMembership membership,
                       NetworkLayer network,
                       TokenVerifier tokenVerifier) {
    this.config = config;
    this.engine = engine;
    this.membership = membership;
    this.network = network;
    this.tokenVerifier = tokenVerifier;
    this.timer = new ViewChangeTimer(engine.nodeId());
  }

  /// Wires a node, its engine and this service. The node re-verifies PRE_PREPARE tokens with the same verifier that
  /// gates requests at entry.
  public static <R> PbftConsensus<R> create(LedgerConfig config,
                                            NodeId nodeId,
                                            ClusterMembership membership,
                                            MessageAuthenticator authenticator,
                                            TokenVerifier tokenVerifier,
                                            NetworkLayer network,
                                            CommitHandler<R> commitHandler) {
    final var node = new PbftNode(nodeId, membership, new ByzantineQuorum(membership), authenticator,
        tokenVerifier::reverify);
    return new PbftConsensus<>(config, new PbftEngine<>(node, commitHandler), membership, network, tokenVerifier);
  }

  public void start() {
    network.subscribe(CONSENSUS.value(), this::handleConsensusMessage, "consensus-" + engine.nodeId());
    network.subscribe(PROXY.value(), this::handleForwardedRequest, "proxy-" + engine.nodeId());
    running = true;
    network.start();
    LOGGER.info(() -> "Started " + engine.nodeId() + " in view " + engine.view() + " primary " + engine.primary());
  }

  /// Admits a request. The token is verified before anything else; a bad token never reaches the protocol.
  ///
  /// @return completes with the host result once the request executes at this node. A request already executed
  /// completes immediately with the earlier result. A request already pending returns the pending future.
  /// @throws ConsensusException with reason INVALID_TOKEN when the token is rejected or was issued for another request
  public CompletableFuture<RESULT> processRequest(Request request) {
    if (!isRunning()) {
      return CompletableFuture.failedFuture(
          new ConsensusException(ConsensusException.Reason.NOT_RUNNING, engine.nodeId() + " is not running"));
    }
    final TokenPayload payload;
    try {
      payload = tokenVerifier.reverify(request.token());
    } catch (TokenException e) {
      LOGGER.warning(() -> engine.nodeId() + " rejecting request " + request.id() + ": " + e.reason());
      throw new ConsensusException(ConsensusException.Reason.INVALID_TOKEN,
          "Request " + request.id() + " has an invalid token: " + e.getMessage(), e);
    }
    if (!payload.jti().equals(request.id())) {
      LOGGER.warning(() -> engine.nodeId() + " rejecting request " + request.id() + " carrying the token of "
          + payload.jti());
      throw new ConsensusException(ConsensusException.Reason.INVALID_TOKEN,
          "Request " + request.id() + " carries a token issued for " + payload.jti());
    }
    if (engine.isCommitted(request.id())) {
      LOGGER.fine(() -> engine.nodeId() + " request " + request.id() + " already executed");
      return engine.executed(request.id())
          .map(CompletableFuture::completedFuture)
          .orElseGet(() -> CompletableFuture.<RESULT>failedFuture(new IllegalStateException(
              "Request " + request.id() + " executed but its result is not available")));
    }
    final var fresh = new Pending<RESULT>(request, payload, new CompletableFuture<>(), new AtomicInteger());
    final var existing = pending.putIfAbsent(request.id(), fresh);
    if (existing != null) {
      return existing.future();
    }
    armTimeout(request.id());
    if (engine.isPrimary()) {
      transmit(engine.propose(request, payload));
    } else {
      LOGGER.fine(() -> engine.nodeId() + " sending " + request.id() + " to primary " + engine.primary()
          + " and the other backups");
      membership.otherActive(engine.nodeId()).forEach(to -> network.send(PROXY.value(), to, request));
    }
    return fresh.future();
  }

  public void handleConsensusMessage(ConsensusMessage message) {
    if (!isRunning() || message == null) {
      return;
    }
    final long before = engine.view();
    transmit(engine.consensus(List.of(message)));
    afterViewChange(before);
  }

  /// A peer sent a request it admitted. The token is checked exactly as at entry. The primary proposes it; a backup
  /// watches it so that it votes for a view change if the primary never gets it executed.
  public void handleForwardedRequest(Request request) {
    if (!isRunning() || request == null) {
      return;
    }
    final TokenPayload payload;
    try {
      payload = tokenVerifier.reverify(request.token());
    } catch (TokenException e) {
      LOGGER.warning(() -> engine.nodeId() + " dropping forwarded request " + request.id() + ": " + e.reason());
      return;
    }
    if (!payload.jti().equals(request.id())) {
      LOGGER.warning(() -> engine.nodeId() + " dropping forwarded request " + request.id() + " carrying the token of "
          + payload.jti());
      return;
    }
    if (engine.isCommitted(request.id())) {
      return;
    }
    final var watched = new Pending<RESULT>(request, payload, new CompletableFuture<>(), new AtomicInteger());
    if (pending.putIfAbsent(request.id(), watched) == null) {
      armTimeout(request.id());
    }
    if (engine.isPrimary()) {
      LOGGER.fine(() -> engine.nodeId() + " primary received forwarded request " + request.id());
      transmit(engine.propose(request, payload));
    } else {
      LOGGER.finer(() -> engine.nodeId() + " watching forwarded request " + request.id());
    }
  }

  private void armTimeout(String requestId) {
    timer.schedule(requestId, config.consensusTimeout(), () -> onTimeout(requestId));
  }

  private void onTimeout(String requestId) {
    final var p = pending.get(requestId);
    if (p == null || !isRunning()) {
      return;
    }
    final int timeouts = p.timeouts().incrementAndGet();
    if (timeouts > config.maxViewChanges()) {
      pending.remove(requestId);
      LOGGER.warning(() -> engine.nodeId() + " giving up on " + requestId + " after " + (timeouts - 1)
          + " view change attempts");
      p.future().completeExceptionally(new ConsensusException(ConsensusException.Reason.QUORUM_NOT_REACHED,
          "No quorum for request " + requestId + " after " + (timeouts - 1) + " view change attempts"));
      return;
    }
    LOGGER.warning(() -> engine.nodeId() + " consensus timeout for " + requestId + " in view " + engine.view());
    armTimeout(requestId);
    initiateViewChange();
  }

  /// Votes for this node to leave its current view. The view changes once a quorum of nodes voted; the pending
  /// requests are then driven at the new primary.
  public void initiateViewChange() {
    if (!isRunning()) {
      return;
    }
    final long before = engine.view();
    transmit(engine.requestViewChange());
    afterViewChange(before);
  }

  private void afterViewChange(long before) {
    final long view = engine.view();
    if (view == before) {
      return;
    }
    final var newPrimary = engine.primary();
    LOGGER.info(() -> engine.nodeId() + " view change " + before + " -> " + view + " new primary " + newPrimary
        + " re-driving " + pending.size() + " requests");
    pending.values().forEach(this::redrive);
  }

  private void redrive(Pending<RESULT> p) {
    armTimeout(p.request().id());
    if (engine.isPrimary()) {
      transmit(engine.propose(p.request(), p.payload()));
    } else {
      network.send(PROXY.value(), engine.primary(), p.request());
    }
  }

  private void transmit(EngineResult<RESULT> result) {
    for (ConsensusMessage message : result.messages()) {
      membership.otherActive(engine.nodeId())
          .forEach(to -> network.send(CONSENSUS.value(), to, message));
    }
    for (HostResult<RESULT> hostResult : result.results()) {
      timer.cancel(hostResult.requestId());
      final var p = pending.remove(hostResult.requestId());
      if (p != null) {
        p.future().complete(hostResult.result());
      }
    }
  }

  public boolean isCommitted(String requestId) {
    return engine.isCommitted(requestId);
  }

  public boolean isRunning() {
    return running && !engine.isCrashed() && !engine.isClosed();
  }

  public boolean isPrimary() {
    return engine.isPrimary();
  }

  public NodeId primary() {
    return engine.primary();
  }

  public long view() {
    return engine.view();
  }

  public NodeId nodeId() {
    return engine.nodeId();
  }

  public ConsensusMetrics metrics() {
    return engine.metrics(pending.size());
  }

  @TestOnly
  public PbftEngine<RESULT> engine() {
    return engine;
  }

  @Override
  public void close() {
    running = false;
    timer.close();
    pending.values().forEach(p -> p.future().completeExceptionally(
        new ConsensusException(ConsensusException.Reason.NOT_RUNNING, engine.nodeId() + " closed")));
    pending.clear();
    engine.close();
    try {
      network.close();
    } catch (IOException e) {
      LOGGER.warning(() -> engine.nodeId() + " failed to close the network: " + e.getMessage());
    }
  }
}
