// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.service;

import com.github.pbft_ledger.InMemoryNetwork;
import com.github.pbft_ledger.InMemoryNetworkLayer;
import com.github.pbft_ledger.LedgerConfig;
import com.github.pbft_ledger.NodeId;
import com.github.pbft_ledger.TestAuthenticator;
import com.github.pbft_ledger.TestTokens;
import com.github.pbft_ledger.ValidationException;
import com.github.pbft_ledger.consensus.ClusterMembership;
import com.github.pbft_ledger.consensus.Member;
import com.github.pbft_ledger.storage.PermanentRecord;
import com.github.pbft_ledger.storage.RecordJournal;
import com.github.pbft_ledger.storage.RecordQuery;
import com.github.pbft_ledger.token.TokenException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.stream.IntStream;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;
import static com.github.pbft_ledger.TestTokens.token;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StorageServiceTest {

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

  final InMemoryNetwork network = new InMemoryNetwork();
  final List<StorageService> services = new ArrayList<>();

  void startCluster(int size, LedgerConfig config) {
    final var membership = ClusterMembership.of(IntStream.range(0, size)
        .mapToObj(i -> Member.of(new NodeId("node-" + i), null))
        .toList());
    for (NodeId id : membership.sortedNodeIds()) {
      services.add(StorageService.create(config, id, membership, TestTokens.registry(), new TestAuthenticator(id),
          new InMemoryNetworkLayer(id, network), RecordJournal.none(), TestTokens.CLOCK));
    }
    services.forEach(StorageService::start);
  }

  StorageService node(int i) {
    return services.get(i);
  }

  @AfterEach
  void tearDown() {
    services.forEach(StorageService::close);
  }

  <T> T settle(CompletableFuture<T> future) {
    network.drain();
    assertThat(future).isCompleted();
    return future.join();
  }

  @Test
  public void requestIsStoredIdenticallyOnEveryReplica() {
    startCluster(4, TestTokens.config());
    final var builder = token().department("research");

    final var record = settle(node(0).processRequest(builder.sign(), Map.of("amount", 125, "currency", "EUR")));

    assertThat(record.tokenId()).isEqualTo(builder.jti());
    assertThat(record.id()).isEqualTo(PermanentRecord.idFor(builder.jti()));
    assertThat(record.timestamp()).isEqualTo(TestTokens.NOW.toEpochMilli());
    assertThat(record.department()).isEqualTo("research");
    assertThat(record.data()).containsEntry("currency", "EUR");
    for (var service : services) {
      assertThat(service.storage().getRecord(record.id())).contains(record);
      assertThat(service.storage().shardRoot(record.shardId())).isEqualTo(node(0).storage().shardRoot(record.shardId()));
      assertThat(service.verifyRecord(record.id()).valid()).isTrue();
    }
  }

  @Test
  public void requestEnteringAtBackupIsStored() {
    startCluster(4, TestTokens.config());

    final var record = settle(node(2).processRequest(TestTokens.valid(), Map.of("n", 1)));

    services.forEach(s -> assertThat(s.storage().getRecord(record.id())).isPresent());
  }

  @Test
  public void lowScoreTokenIsRejectedBeforeConsensus() {
    startCluster(4, TestTokens.config());

    final var future = node(0).processRequest(token().score(0.3).sign(), Map.of("n", 1));

    assertThat(future).isCompletedExceptionally();
    assertThatThrownBy(future::join)
        .hasCauseInstanceOf(TokenException.class)
        .hasMessageContaining("Validation score too low");
    assertThat(network.pending()).isZero();
    assertThat(node(0).metrics().storage().totalRecords()).isZero();
  }

  @Test
  public void missingDataIsAValidationError() {
    startCluster(1, TestTokens.config());
    final var future = node(0).processRequest(TestTokens.valid(), null);
    assertThatThrownBy(future::join).hasCauseInstanceOf(ValidationException.class);
  }

  @Test
  public void resubmittedTokenReturnsExistingRecord() {
    startCluster(4, TestTokens.config());
    final var jwt = TestTokens.valid();
    final var first = settle(node(0).processRequest(jwt, Map.of("n", 1)));

    final var again = settle(node(0).processRequest(jwt, Map.of("n", 1)));
    final var elsewhere = settle(node(3).processRequest(jwt, Map.of("n", 2)));

    assertThat(again).isEqualTo(first);
    assertThat(elsewhere).isEqualTo(first);
    services.forEach(s -> assertThat(s.metrics().storage().totalRecords()).isEqualTo(1));
  }

  @Test
  public void replayOfUncommittedTokenFails() {
    startCluster(4, TestTokens.config());
    network.silence(new NodeId("node-3"));
    network.silence(new NodeId("node-2"));
    final var jwt = TestTokens.valid();
    node(0).processRequest(jwt, Map.of("n", 1));

    final var replay = node(0).processRequest(jwt, Map.of("n", 1));

    assertThatThrownBy(replay::join)
        .cause()
        .isInstanceOfSatisfying(TokenException.class,
            e -> assertThat(e.reason()).isEqualTo(TokenException.Reason.REPLAY));
  }

  @Test
  public void batchKeepsInputOrderAndIsolatesFailures() {
    startCluster(4, TestTokens.config());
    final var items = List.of(
        new BatchItem(TestTokens.valid(), Map.of("i", 0)),
        new BatchItem(token().expiresAt(TestTokens.NOW.minusSeconds(30)).issuedAt(TestTokens.NOW.minusSeconds(90))
            .sign(), Map.of("i", 1)),
        new BatchItem(TestTokens.valid(), Map.of("i", 2)),
        new BatchItem(TestTokens.valid(), null),
        new BatchItem(TestTokens.valid(), Map.of("i", 4)));

    final var results = settle(node(1).processBatch(items));

    assertThat(results).hasSize(5);
    assertThat(results).extracting(ProcessResult::isSuccess).containsExactly(true, false, true, false, true);
    assertThat(results.get(0).record().data()).containsEntry("i", 0);
    assertThat(results.get(2).record().data()).containsEntry("i", 2);
    assertThat(results.get(4).record().data()).containsEntry("i", 4);
    assertThat(results.get(1).error()).isInstanceOfSatisfying(TokenException.class,
        e -> assertThat(e.reason()).isEqualTo(TokenException.Reason.EXPIRED));
    assertThat(results.get(3).error()).isInstanceOf(ValidationException.class);
    services.forEach(s -> assertThat(s.metrics().storage().totalRecords()).isEqualTo(3));
  }

  @Test
  public void queriesAndExports() {
    startCluster(4, TestTokens.config());
    final var finance = IntStream.range(0, 6)
        .mapToObj(i -> node(0).processRequest(token().department("finance").sign(), Map.of("i", i)))
        .toList();
    final var legal = node(0).processRequest(token().department("legal").sign(), Map.of("i", 99));
    network.drain();
    finance.forEach(f -> assertThat(f).isCompleted());

    assertThat(node(3).queryRecords(RecordQuery.all().withDepartment("finance"))).hasSize(6);
    assertThat(node(3).queryRecords(RecordQuery.all().withTokenId(legal.join().tokenId())))
        .containsExactly(legal.join());
    assertThat(node(3).queryRecords(RecordQuery.all().withLimit(2))).hasSize(2);

    final int exported = IntStream.range(0, 4).map(s -> node(2).exportShard(s).records().size()).sum();
    assertThat(exported).isEqualTo(7);
    assertThat(node(2).exportShard(legal.join().shardId()).records()).contains(legal.join());
    assertThatThrownBy(() -> node(2).exportShard(9)).isInstanceOf(ValidationException.class);
  }

  @Test
  public void verifyUnknownRecord() {
    startCluster(1, TestTokens.config());
    final var verification = node(0).verifyRecord("no-such-record");
    assertThat(verification.valid()).isFalse();
    assertThat(verification.record()).isNull();
    assertThat(verification.reason()).isEqualTo("Record not found");
  }

  @Test
  public void viewChangeKeepsServing() {
    startCluster(4, TestTokens.config());
    final var before = settle(node(0).processRequest(TestTokens.valid(), Map.of("n", 1)));

    services.forEach(StorageService::initiateViewChange);
    network.drain();
    final var after = settle(node(0).processRequest(TestTokens.valid(), Map.of("n", 2)));

    assertThat(node(0).health().primary()).isEqualTo(new NodeId("node-1"));
    assertThat(node(0).health().view()).isEqualTo(1);
    services.forEach(s -> {
      assertThat(s.storage().getRecord(before.id())).contains(before);
      assertThat(s.storage().getRecord(after.id())).contains(after);
      assertThat(s.metrics().storage().totalRecords()).isEqualTo(2);
    });
  }

  @Test
  public void metricsAndHealth() {
    startCluster(4, TestTokens.config());
    settle(node(0).processRequest(TestTokens.valid(), Map.of("n", 1)));

    final var metrics = node(1).metrics();
    assertThat(metrics.consensus().committed()).isEqualTo(1);
    assertThat(metrics.consensus().quorumSize()).isEqualTo(3);
    assertThat(metrics.storage().totalRecords()).isEqualTo(1);
    assertThat(metrics.storage().shardCount()).isEqualTo(4);
    assertThat(metrics.verification().verifiedTokens()).isEqualTo(1);

    final var health = node(1).health();
    assertThat(health.nodeId()).isEqualTo(new NodeId("node-1"));
    assertThat(health.status()).isEqualTo(NodeHealth.Status.HEALTHY);
    assertThat(health.totalRecords()).isEqualTo(1);

    node(1).close();
    assertThat(node(1).health().status()).isEqualTo(NodeHealth.Status.DOWN);
  }
}
