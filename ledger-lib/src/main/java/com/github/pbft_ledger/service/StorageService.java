// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.service;

import com.github.pbft_ledger.LedgerConfig;
import com.github.pbft_ledger.LedgerException;
import com.github.pbft_ledger.NodeId;
import com.github.pbft_ledger.ValidationException;
import com.github.pbft_ledger.consensus.ClusterMembership;
import com.github.pbft_ledger.consensus.MessageAuthenticator;
import com.github.pbft_ledger.consensus.PbftConsensus;
import com.github.pbft_ledger.msg.Request;
import com.github.pbft_ledger.network.NetworkLayer;
import com.github.pbft_ledger.storage.MerkleStorage;
import com.github.pbft_ledger.storage.PermanentRecord;
import com.github.pbft_ledger.storage.RecordJournal;
import com.github.pbft_ledger.storage.RecordQuery;
import com.github.pbft_ledger.storage.ShardSnapshot;
import com.github.pbft_ledger.token.KeyRegistry;
import com.github.pbft_ledger.token.TokenException;
import com.github.pbft_ledger.token.TokenPayload;
import com.github.pbft_ledger.token.TokenVerifier;
import org.jetbrains.annotations.TestOnly;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;

/// The node's front door. A request flows through token verification, then PBFT agreement across the replicas, then
/// into the Merkle storage of every replica once it commits. The request id is the token's `jti` so a token buys at
/// most one record.
public class StorageService implements AutoCloseable {
  private final LedgerConfig config;
  private final TokenVerifier tokenVerifier;
  private final PbftConsensus<PermanentRecord> consensus;
  private final MerkleStorage storage;
  private final Clock clock;

  public StorageService(LedgerConfig config,
                        TokenVerifier tokenVerifier,
                        PbftConsensus<PermanentRecord> consensus,
                        MerkleStorage storage,
                        Clock clock) {
    this.config = config;
    this.tokenVerifier = tokenVerifier;
    this.consensus = consensus;
    this.storage = storage;
    this.clock = clock;
  }

  /// Wires a verifier, a storage recovered from the journal and a consensus replica that executes into that storage.
  public static StorageService create(LedgerConfig config,
                                     NodeId nodeId,
                                     ClusterMembership membership,
                                     KeyRegistry keys,
                                     MessageAuthenticator authenticator,
                                     NetworkLayer network,
                                     RecordJournal journal,
                                     Clock clock) {
    final var verifier = new TokenVerifier(config, keys, clock);
    final var storage = new MerkleStorage(config, journal, clock);
    final var consensus = PbftConsensus.create(config, nodeId, membership, authenticator, verifier, network,
        new StorageCommitHandler(storage));
    return new StorageService(config, verifier, consensus, storage, clock);
  }

  public void start() {
    consensus.start();
  }

  /// Verifies the token, agrees the request with the other replicas and stores it.
  ///
  /// Presenting a token whose record already exists completes with that record rather than a replay error.
  public CompletableFuture<PermanentRecord> processRequest(String token, Map<String, Object> data) {
    if (data == null) {
      return CompletableFuture.failedFuture(new ValidationException("Request data is required"));
    }
    final TokenPayload payload;
    try {
      payload = tokenVerifier.verifyToken(token);
    } catch (TokenException e) {
      return alreadyStored(e);
    }
    return submit(token, data, payload);
  }

  private CompletableFuture<PermanentRecord> alreadyStored(TokenException e) {
    if (e.reason() == TokenException.Reason.REPLAY && e.tokenId().isPresent()) {
      final var jti = e.tokenId().get();
      if (consensus.isCommitted(jti)) {
        final var existing = storage.getRecord(PermanentRecord.idFor(jti));
        if (existing.isPresent()) {
          LOGGER.fine(() -> consensus.nodeId() + " token " + jti + " already stored as " + existing.get().id());
          return CompletableFuture.completedFuture(existing.get());
        }
      }
    }
    LOGGER.fine(() -> consensus.nodeId() + " rejected token: " + e.getMessage());
    return CompletableFuture.failedFuture(e);
  }

  private CompletableFuture<PermanentRecord> submit(String token, Map<String, Object> data, TokenPayload payload) {
    final var request = new Request(payload.jti(), token, data, clock.millis());
    try {
      return consensus.processRequest(request);
    } catch (LedgerException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /// Verifies every token in parallel then submits the survivors. The results are in input order and one bad item
  /// does not fail the others.
  public CompletableFuture<List<ProcessResult>> processBatch(List<BatchItem> items) {
    final var verifications = items.stream()
        .map(item -> CompletableFuture.supplyAsync(() -> tokenVerifier.verifyToken(item.token())))
        .toList();
    final List<CompletableFuture<ProcessResult>> results = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      final var item = items.get(i);
      CompletableFuture<PermanentRecord> stored;
      if (item.data() == null) {
        stored = CompletableFuture.failedFuture(new ValidationException("Request data is required"));
      } else {
        try {
          stored = submit(item.token(), item.data(), verifications.get(i).join());
        } catch (CompletionException e) {
          stored = e.getCause() instanceof TokenException te
              ? alreadyStored(te)
              : CompletableFuture.failedFuture(e.getCause());
        }
      }
      results.add(stored.handle((record, error) -> record != null
          ? ProcessResult.success(record)
          : ProcessResult.failure(asLedgerException(error))));
    }
    return CompletableFuture.allOf(results.toArray(CompletableFuture[]::new))
        .thenApply(ignored -> results.stream().map(CompletableFuture::join).toList());
  }

  static LedgerException asLedgerException(Throwable error) {
    final var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    if (cause instanceof LedgerException ledgerException) {
      return ledgerException;
    }
    return new LedgerException("INTERNAL_ERROR", String.valueOf(cause.getMessage()), 500, cause);
  }

  public List<PermanentRecord> queryRecords(RecordQuery query) {
    return storage.query(query);
  }

  public RecordVerification verifyRecord(String recordId) {
    return storage.getRecord(recordId)
        .map(record -> RecordVerification.of(record, storage.verifyRecord(record)))
        .orElseGet(() -> RecordVerification.notFound(recordId));
  }

  public ShardSnapshot exportShard(int shardId) {
    return storage.exportShard(shardId);
  }

  public void initiateViewChange() {
    consensus.initiateViewChange();
  }

  public LedgerMetrics metrics() {
    return new LedgerMetrics(consensus.metrics(), storage.metrics(), tokenVerifier.metrics());
  }

  public NodeHealth health() {
    final var up = consensus.isRunning() && !storage.isCrashed();
    return new NodeHealth(consensus.nodeId(),
        up ? NodeHealth.Status.HEALTHY : NodeHealth.Status.DOWN,
        consensus.view(),
        consensus.primary(),
        storage.metrics().totalRecords());
  }

  public NodeId nodeId() {
    return consensus.nodeId();
  }

  public LedgerConfig config() {
    return config;
  }

  @TestOnly
  public PbftConsensus<PermanentRecord> consensus() {
    return consensus;
  }

  @TestOnly
  public MerkleStorage storage() {
    return storage;
  }

  @TestOnly
  public TokenVerifier tokenVerifier() {
    return tokenVerifier;
  }

  @Override
  public void close() {
    consensus.close();
    tokenVerifier.close();
    storage.close();
  }
}
