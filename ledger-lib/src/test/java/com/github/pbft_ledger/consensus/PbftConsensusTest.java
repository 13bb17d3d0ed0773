// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.InMemoryNetwork;
import com.github.pbft_ledger.LedgerConfig;
import com.github.pbft_ledger.NodeId;
import com.github.pbft_ledger.TestAuthenticator;
import com.github.pbft_ledger.TestTokens;
import com.github.pbft_ledger.msg.ConsensusMessage;
import com.github.pbft_ledger.msg.MessageType;
import com.github.pbft_ledger.msg.Request;
import com.github.pbft_ledger.network.SystemChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.stream.IntStream;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PbftConsensusTest {

  @BeforeAll
  static void setupLogging() {
    final var logLevel = System.getProperty("java.util.logging.ConsoleHandler.level", "WARNING");
    final Level level = Level.parse(logLevel);
    LOGGER.setLevel(level);
    ConsoleHandler consoleHandler = new ConsoleHandler();
    consoleHandler.setLevel(level);
    LOGGER.addHandler(consoleHandler);
    LOGGER.setUseParentHandlers(false);
  }

  TestCluster cluster;

  @AfterEach
  void tearDown() {
    if (cluster != null) {
      cluster.close();
    }
  }

  static LedgerConfig config() {
    return TestTokens.config();
  }

  @Test
  public void primaryCommitsWithExactQuorumCertificates() {
    cluster = new TestCluster(7, config());
    final var request = cluster.newRequest();

    final var future = cluster.node(0).processRequest(request);
    cluster.network.drain();

    assertThat(future).isCompletedWithValue(request.id() + "@0-1");
    for (int i = 0; i < 7; i++) {
      final var handler = cluster.handler(i);
      assertThat(handler.executedIds()).as("node %d", i).containsExactly(request.id());
      final var certificate = handler.executed.get(0);
      assertThat(certificate.prepareQuorum()).as("prepare quorum at node %d", i).hasSize(5);
      assertThat(certificate.commitQuorum()).as("commit quorum at node %d", i).hasSize(5);
      assertThat(certificate.digest()).isEqualTo(request.digest());
    }
    final var delivered = cluster.deliveredConsensus();
    assertThat(delivered).filteredOn(m -> m.type() == MessageType.PRE_PREPARE).hasSize(6);
    assertThat(delivered).filteredOn(m -> m.type() == MessageType.PREPARE)
        .noneMatch(m -> m.nodeId().equals(cluster.id(0)));
  }

  @Test
  public void backupHandsRequestToEveryOtherReplica() {
    cluster = new TestCluster(4, config());
    final var request = cluster.newRequest();

    final var future = cluster.node(3).processRequest(request);
    cluster.network.drain();

    assertThat(future).isCompleted();
    assertThat(cluster.network.delivered())
        .filteredOn(e -> e.channel().equals(SystemChannel.PROXY.value()))
        .extracting(InMemoryNetwork.Envelope::to)
        .containsExactlyInAnyOrder(cluster.id(0), cluster.id(1), cluster.id(2));
    assertThat(cluster.deliveredConsensus()).filteredOn(m -> m.type() == MessageType.PRE_PREPARE)
        .allMatch(m -> m.nodeId().equals(cluster.id(0)))
        .hasSize(3);
    IntStream.range(0, 4).forEach(i -> assertThat(cluster.handler(i).executedIds()).containsExactly(request.id()));
    cluster.nodes.forEach(n -> assertThat(n.metrics().pending()).isZero());
  }

  @Test
  public void toleratesFaultyNodes() {
    cluster = new TestCluster(7, config());
    cluster.network.silence(cluster.id(5));
    cluster.network.silence(cluster.id(6));
    final var request = cluster.newRequest();

    final var future = cluster.node(0).processRequest(request);
    cluster.network.drain();

    assertThat(future).isCompleted();
    IntStream.range(0, 5).forEach(i -> assertThat(cluster.handler(i).executedIds()).containsExactly(request.id()));
    assertThat(cluster.handler(5).executed).isEmpty();
    assertThat(cluster.handler(6).executed).isEmpty();
  }

  @Test
  public void tooManyFaultyNodesBlocksCommit() {
    cluster = new TestCluster(7, config());
    cluster.network.silence(cluster.id(4));
    cluster.network.silence(cluster.id(5));
    cluster.network.silence(cluster.id(6));

    final var future = cluster.node(0).processRequest(cluster.newRequest());
    cluster.network.drain();

    assertThat(future).isNotDone();
    cluster.handlers.forEach(h -> assertThat(h.executed).isEmpty());
    assertThat(cluster.node(0).metrics().pending()).isEqualTo(1);
  }

  @Test
  public void invalidTokenNeverReachesTheProtocol() {
    cluster = new TestCluster(4, config());
    final var request = new Request("low", TestTokens.token().jti("low").score(0.3).sign(), Map.of(), 0);

    assertThatThrownBy(() -> cluster.node(0).processRequest(request))
        .isInstanceOfSatisfying(ConsensusException.class, e -> {
          assertThat(e.reason()).isEqualTo(ConsensusException.Reason.INVALID_TOKEN);
          assertThat(e.statusCode()).isEqualTo(401);
          assertThat(e.getMessage()).contains("Validation score too low");
        });
    assertThat(cluster.network.pending()).isZero();
    assertThat(cluster.network.drain()).isZero();
    assertThat(cluster.deliveredConsensus()).isEmpty();
  }

  @Test
  public void duplicateSubmissionIsANoOp() {
    cluster = new TestCluster(4, config());
    final var request = cluster.newRequest();

    final var first = cluster.node(0).processRequest(request);
    final var pendingAgain = cluster.node(0).processRequest(request);
    assertThat(pendingAgain).isSameAs(first);
    cluster.network.drain();

    final var afterCommit = cluster.node(0).processRequest(request);
    cluster.network.drain();

    assertThat(afterCommit).isCompletedWithValue(first.join());
    cluster.handlers.forEach(h -> assertThat(h.executedIds()).containsExactly(request.id()));
    assertThat(cluster.node(0).isCommitted(request.id())).isTrue();
  }

  @Test
  public void viewChangeMovesToNextPrimary() {
    cluster = new TestCluster(4, config());
    final var before = cluster.newRequest();
    final var committedBefore = cluster.node(0).processRequest(before);
    cluster.network.drain();
    assertThat(committedBefore).isCompleted();

    final long oldView = cluster.node(0).view();
    cluster.nodes.forEach(PbftConsensus::initiateViewChange);
    cluster.network.drain();

    for (var node : cluster.nodes) {
      assertThat(node.view()).isEqualTo(oldView + 1);
      assertThat(node.primary()).isEqualTo(cluster.id((int) ((oldView + 1) % 4)));
    }
    assertThat(cluster.node(1).isPrimary()).isTrue();

    final var after = cluster.newRequest();
    final var committedAfter = cluster.node(0).processRequest(after);
    final var resubmitted = cluster.node(2).processRequest(before);
    cluster.network.drain();

    assertThat(committedAfter).isCompletedWithValue(after.id() + "@1-1");
    assertThat(resubmitted).isCompletedWithValue(before.id() + "@0-1");
    cluster.handlers.forEach(h -> assertThat(h.executedIds()).containsExactly(before.id(), after.id()));
  }

  @Test
  public void pendingRequestIsDrivenAgainAfterViewChange() {
    cluster = new TestCluster(4, config());
    final var primary = cluster.id(0);
    cluster.network.dropWhen(e -> e.from().equals(primary) && e.channel().equals(SystemChannel.CONSENSUS.value()));
    final var request = cluster.newRequest();

    final var future = cluster.node(1).processRequest(request);
    cluster.network.drain();
    assertThat(future).isNotDone();

    cluster.nodes.forEach(PbftConsensus::initiateViewChange);
    cluster.network.drain();

    assertThat(future).isCompletedWithValue(request.id() + "@1-1");
    cluster.handlers.forEach(h -> assertThat(h.executedIds()).containsExactly(request.id()));
  }

  @Test
  public void oneNodeAloneCannotChangeTheView() {
    cluster = new TestCluster(4, config());

    cluster.node(3).initiateViewChange();
    cluster.network.drain();

    cluster.nodes.forEach(n -> assertThat(n.view()).isZero());
    assertThat(cluster.deliveredConsensus()).filteredOn(m -> m.type() == MessageType.VIEW_CHANGE)
        .hasSize(3)
        .allMatch(m -> m.nodeId().equals(cluster.id(3)) && m.view() == 1);
  }

  @Test
  public void peersJoinOnceMoreThanFNodesVoted() {
    cluster = new TestCluster(4, config());

    cluster.node(2).initiateViewChange();
    cluster.node(3).initiateViewChange();
    cluster.network.drain();

    cluster.nodes.forEach(n -> assertThat(n.view()).isEqualTo(1));
    assertThat(cluster.deliveredConsensus()).filteredOn(m -> m.type() == MessageType.VIEW_CHANGE)
        .extracting(ConsensusMessage::nodeId)
        .contains(cluster.id(0), cluster.id(1), cluster.id(2), cluster.id(3));
  }

  @Test
  public void crashedPrimaryIsReplacedByTimeout() throws InterruptedException {
    cluster = new TestCluster(4, config()
        .withConsensusTimeout(Duration.ofMillis(100))
        .withMaxViewChanges(5));
    cluster.network.silence(cluster.id(0));
    final var request = cluster.newRequest();

    final var future = cluster.node(1).processRequest(request);
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!future.isDone() && System.nanoTime() < deadline) {
      cluster.network.drain();
      Thread.sleep(10);
    }

    assertThat(future).isCompletedWithValue(request.id() + "@1-1");
    cluster.network.drain();
    IntStream.range(1, 4).forEach(i -> {
      assertThat(cluster.node(i).view()).as("view at node %d", i).isEqualTo(1);
      assertThat(cluster.node(i).primary()).isEqualTo(cluster.id(1));
      assertThat(cluster.handler(i).executedIds()).as("node %d", i).containsExactly(request.id());
    });
    assertThat(cluster.node(0).view()).isZero();
    assertThat(cluster.handler(0).executed).isEmpty();
  }

  @Test
  public void tokenCannotBeReusedForAnotherRequest() {
    cluster = new TestCluster(4, config());
    final var paid = cluster.newRequest();
    cluster.node(0).processRequest(paid);
    cluster.network.drain();
    assertThat(cluster.node(0).isCommitted(paid.id())).isTrue();

    final var forged = new Request("forged-id", paid.token(), Map.of("x", "forged"), paid.timestamp());

    assertThatThrownBy(() -> cluster.node(0).processRequest(forged))
        .isInstanceOfSatisfying(ConsensusException.class,
            e -> assertThat(e.reason()).isEqualTo(ConsensusException.Reason.INVALID_TOKEN));
    assertThatThrownBy(() -> cluster.node(2).processRequest(forged))
        .isInstanceOf(ConsensusException.class);

    // a primary that skips its own checks still cannot get backups to accept it
    final var payload = cluster.verifiers.get(0).reverify(paid.token());
    final var proposed = cluster.node(0).engine().propose(forged, payload);
    assertThat(proposed.messages()).singleElement()
        .satisfies(m -> assertThat(m.type()).isEqualTo(MessageType.PRE_PREPARE));
    IntStream.range(1, 4).forEach(i -> cluster.node(i).handleConsensusMessage(proposed.messages().get(0)));
    cluster.network.drain();

    assertThat(cluster.deliveredConsensus())
        .filteredOn(m -> m.type() == MessageType.PREPARE && m.digest().equals(forged.digest()))
        .isEmpty();
    cluster.handlers.forEach(h -> assertThat(h.executedIds()).containsExactly(paid.id()));
    IntStream.range(1, 4).forEach(i -> assertThat(cluster.node(i).isCommitted("forged-id")).isFalse());
  }

  @Test
  public void timeoutsGiveUpAfterMaxViewChanges() {
    cluster = new TestCluster(4, config()
        .withConsensusTimeout(Duration.ofMillis(50))
        .withMaxViewChanges(2));
    cluster.network.silence(cluster.id(2));
    cluster.network.silence(cluster.id(3));

    final var future = cluster.node(0).processRequest(cluster.newRequest());

    assertThatThrownBy(() -> future.get(10, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .cause()
        .isInstanceOfSatisfying(ConsensusException.class,
            e -> assertThat(e.reason()).isEqualTo(ConsensusException.Reason.QUORUM_NOT_REACHED));
    // no peer saw the votes so the view could not move
    assertThat(cluster.node(0).view()).isZero();
    assertThat(cluster.node(0).metrics().pending()).isZero();
  }

  @Test
  public void forgedVotesAreDropped() {
    final var liar = new NodeId("node-3");
    final var impersonated = new NodeId("node-2");
    cluster = new TestCluster(config(), TestCluster.membership(4),
        id -> new TestAuthenticator(id.equals(liar) ? impersonated : id));
    final var request = cluster.newRequest();

    final var future = cluster.node(0).processRequest(request);
    cluster.network.drain();

    assertThat(future).isCompleted();
    final var certificate = cluster.handler(0).executed.get(0);
    assertThat(certificate.prepareQuorum()).doesNotContain(liar);
    assertThat(certificate.commitQuorum()).doesNotContain(liar);
  }

  @Test
  public void ed25519SignedCluster() {
    final Map<NodeId, KeyPair> keys = new HashMap<>();
    final var members = IntStream.range(0, 4)
        .mapToObj(i -> new NodeId("node-" + i))
        .map(id -> {
          final var pair = TestTokens.newKeyPair();
          keys.put(id, pair);
          return Member.of(id, pair.getPublic());
        })
        .toList();
    final var membership = ClusterMembership.of(members);
    cluster = new TestCluster(config(), membership,
        id -> new Ed25519MessageAuthenticator(keys.get(id).getPrivate(), membership));
    final var request = cluster.newRequest();

    final var future = cluster.node(2).processRequest(request);
    cluster.network.drain();

    assertThat(future).isCompleted();
    cluster.handlers.forEach(h -> assertThat(h.executedIds()).containsExactly(request.id()));
    assertThat(cluster.deliveredConsensus()).allMatch(m -> m.signature().length() > 40);
  }

  @Test
  public void closedNodeRefusesRequests() {
    cluster = new TestCluster(4, config());
    cluster.node(0).close();

    final var future = cluster.node(0).processRequest(cluster.newRequest());

    assertThat(future).isCompletedExceptionally();
    assertThatThrownBy(future::join).hasCauseInstanceOf(ConsensusException.class);
    assertThat(cluster.node(0).isRunning()).isFalse();
  }

  @Test
  public void metrics() {
    cluster = new TestCluster(7, config());
    cluster.node(0).processRequest(cluster.newRequest());
    cluster.node(0).processRequest(cluster.newRequest());
    cluster.network.drain();

    final var metrics = cluster.node(0).metrics();
    assertThat(metrics.nodeId()).isEqualTo(cluster.id(0));
    assertThat(metrics.currentView()).isZero();
    assertThat(metrics.primary()).isEqualTo(cluster.id(0));
    assertThat(metrics.currentSequence()).isEqualTo(2);
    assertThat(metrics.pending()).isZero();
    assertThat(metrics.committed()).isEqualTo(2);
    assertThat(metrics.byzantineTolerance()).isEqualTo(2);
    assertThat(metrics.quorumSize()).isEqualTo(5);
    assertThat(cluster.node(3).metrics().committed()).isEqualTo(2);
  }
}
