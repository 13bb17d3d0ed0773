// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.NodeId;
import com.github.pbft_ledger.msg.ConsensusMessage;
import com.github.pbft_ledger.msg.MessageType;
import com.github.pbft_ledger.msg.Request;
import com.github.pbft_ledger.msg.SlotKey;
import com.github.pbft_ledger.token.TokenException;
import com.github.pbft_ledger.token.TokenPayload;
import org.jetbrains.annotations.TestOnly;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;

/// A PbftNode is one replica of the three phase PBFT agreement. It handles:
/// - signature and membership checks on every inbound message
/// - PRE_PREPARE acceptance at backups, including an independent re-check of the embedded token
/// - vote accumulation per `(view, sequence)` slot, counting only votes whose digest matches
/// - in order execution of committed slots within a view
/// - view changes
///
/// Does NOT handle:
/// - thread safety (managed by [PbftEngine])
/// - network communication and timeouts (handled by [PbftConsensus])
/// - applying committed requests (the engine's commit up-call)
///
/// The primary's PRE_PREPARE is its prepare vote. A slot is prepared once `2f+1` distinct nodes sent a matching
/// PRE_PREPARE or PREPARE, and committed once `2f+1` distinct nodes sent a matching COMMIT. The transition fires
/// on the vote that first reaches the quorum.
///
/// Sequence numbers restart at one in every view and slots execute strictly in sequence order. Votes that arrive
/// before their PRE_PREPARE are buffered, but only for sequences inside the watermark window above the last executed
/// one. A slot that has not committed when the view changes is abandoned; slots that committed but were waiting on a
/// gap are executed before the view is left.
///
/// A view change is a vote. A node that times out broadcasts a signed VIEW_CHANGE for the next view. A node that sees
/// `f+1` distinct nodes asking for a view above its own joins them by voting for the lowest such view, and a node
/// enters a view once `2f+1` distinct nodes voted for it. Messages for a view this node has not reached yet are held
/// and replayed when it enters that view.
///
/// A PRE_PREPARE is only accepted when its token was issued for its request: the token `jti` must equal the request
/// id, so an admitted token cannot be replayed inside another request.
///
/// This class is not thread safe.
public class PbftNode {
  /// Width of the window of sequence numbers above the last executed one that are accepted.
  static final long WATERMARK_WINDOW = 1024;

  /// How far above the current view votes and early messages are kept.
  static final long VIEW_WINDOW = 64;

  final NodeId nodeId;
  final ClusterMembership membership;
  final QuorumStrategy quorumStrategy;
  final MessageAuthenticator authenticator;

  /// Re-verifies the token embedded in a PRE_PREPARE. Throws {@link TokenException} to reject.
  final Function<String, TokenPayload> tokenCheck;

  long view = 0;

  /// The primary's last assigned sequence in this view, or the highest accepted one at a backup.
  long sequence = 0;

  long lastExecuted = 0;

  final TreeMap<Long, Slot> slots = new TreeMap<>();

  /// request id to the sequence of the slot carrying it in this view
  final Map<String, Long> inFlight = new HashMap<>();

  final Set<String> committedRequestIds = new HashSet<>();

  /// The highest view this node has voted to move to.
  long votedView = 0;

  /// Voters per view above the current one.
  final TreeMap<Long, Set<NodeId>> viewChangeVotes = new TreeMap<>();

  /// Messages for views above the current one, replayed on entering that view.
  final TreeMap<Long, List<ConsensusMessage>> earlyMessages = new TreeMap<>();

  volatile private boolean crashed = false;
  volatile private boolean closed = false;

  public PbftNode(NodeId nodeId,
                  ClusterMembership membership,
                  QuorumStrategy quorumStrategy,
                  MessageAuthenticator authenticator,
                  Function<String, TokenPayload> tokenCheck) {
    if (!membership.contains(nodeId)) {
      throw new IllegalArgumentException("Node " + nodeId + " is not a member of " + membership.sortedNodeIds());
    }
    this.nodeId = nodeId;
    this.membership = membership;
    this.quorumStrategy = quorumStrategy;
    this.authenticator = authenticator;
    this.tokenCheck = tokenCheck;
  }

  static final class Slot {
    final SlotKey key;
    Phase phase = Phase.IDLE;
    Request request;
    TokenPayload payload;
    String digest;
    final Map<NodeId, ConsensusMessage> prepares = new HashMap<>();
    final Map<NodeId, ConsensusMessage> commits = new HashMap<>();
    Set<NodeId> prepareQuorum = Set.of();
    Set<NodeId> commitQuorum = Set.of();

    Slot(SlotKey key) {
      this.key = key;
    }

    Set<NodeId> matching(Map<NodeId, ConsensusMessage> votes) {
      return votes.entrySet().stream()
          .filter(e -> e.getValue().digest().equals(digest))
          .map(Map.Entry::getKey)
          .collect(Collectors.toSet());
    }
  }

  /// Proposes a request as primary: assigns the next sequence and signs the PRE_PREPARE to broadcast.
  /// A request already committed or already in flight in this view yields no messages.
  PbftResult prePrepare(Request request, TokenPayload payload) {
    guardRunning();
    if (!isPrimary()) {
      throw new IllegalStateException(nodeId + " is not the primary of view " + view);
    }
    if (committedRequestIds.contains(request.id()) || inFlight.containsKey(request.id())) {
      LOGGER.fine(() -> nodeId + " not proposing " + request.id() + " as it is committed or in flight");
      return PbftResult.noResult();
    }
    final long next = sequence + 1;
    if (next > lastExecuted + WATERMARK_WINDOW) {
      LOGGER.warning(() -> nodeId + " cannot propose " + request.id() + " as sequence " + next
          + " is beyond the high watermark");
      return PbftResult.noResult();
    }
    sequence = next;
    final var prePrepare = authenticator.sign(ConsensusMessage.prePrepare(view, sequence, nodeId, request));
    final var slot = slots.computeIfAbsent(sequence, s -> new Slot(new SlotKey(view, s)));
    slot.request = request;
    slot.payload = payload;
    slot.digest = prePrepare.digest();
    slot.phase = Phase.PRE_PREPARE;
    slot.prepares.put(nodeId, prePrepare);
    inFlight.put(request.id(), sequence);
    LOGGER.fine(() -> nodeId + " PRE_PREPARE " + slot.key + " for request " + request.id());

    final var messages = new ArrayList<ConsensusMessage>();
    messages.add(prePrepare);
    final var committed = new ArrayList<CommittedRequest>();
    checkPrepared(slot, messages, committed);
    return new PbftResult(messages, committed);
  }

  /// The main entry point for inbound consensus messages. Invalid, stale or misdirected messages are dropped without
  /// a reply.
  PbftResult consensus(ConsensusMessage message) {
    guardRunning();
    if (!membership.contains(message.nodeId())) {
      LOGGER.warning(() -> nodeId + " dropping message from non member " + message);
      return PbftResult.noResult();
    }
    if (message.nodeId().equals(nodeId)) {
      return PbftResult.noResult();
    }
    if (!authenticator.verify(message)) {
      LOGGER.warning(() -> nodeId + " dropping message with invalid signature " + message);
      return PbftResult.noResult();
    }
    if (message.type() == MessageType.VIEW_CHANGE) {
      final var messages = new ArrayList<ConsensusMessage>();
      final var committed = new ArrayList<CommittedRequest>();
      acceptViewChange(message, messages, committed);
      return new PbftResult(messages, committed);
    }
    if (message.view() < view) {
      LOGGER.fine(() -> nodeId + " in view " + view + " dropping message for an earlier view " + message);
      return PbftResult.noResult();
    }
    if (message.view() > view) {
      holdForLaterView(message);
      return PbftResult.noResult();
    }
    if (message.sequence() <= lastExecuted || message.sequence() > lastExecuted + WATERMARK_WINDOW) {
      LOGGER.finer(() -> nodeId + " dropping message outside the watermarks " + message);
      return PbftResult.noResult();
    }

    final var messages = new ArrayList<ConsensusMessage>();
    final var committed = new ArrayList<CommittedRequest>();
    switch (message.type()) {
      case PRE_PREPARE -> acceptPrePrepare(message, messages, committed);
      case PREPARE -> acceptPrepare(message, messages, committed);
      case COMMIT -> acceptCommit(message, committed);
      case VIEW_CHANGE -> throw new AssertionError("handled above");
    }
    return new PbftResult(messages, committed);
  }

  private void acceptPrePrepare(ConsensusMessage message,
                                List<ConsensusMessage> messages,
                                List<CommittedRequest> committed) {
    if (!message.nodeId().equals(primary())) {
      LOGGER.warning(() -> nodeId + " dropping PRE_PREPARE from non primary " + message);
      return;
    }
    final var request = message.request().orElseThrow();
    if (!request.digest().equals(message.digest())) {
      LOGGER.warning(() -> nodeId + " dropping PRE_PREPARE whose digest does not match its request " + message);
      return;
    }
    final var existing = slots.get(message.sequence());
    if (existing != null && existing.request != null) {
      if (!existing.digest.equals(message.digest())) {
        LOGGER.warning(() -> nodeId + " dropping conflicting PRE_PREPARE for " + existing.key + " " + message);
      }
      return;
    }
    final var otherSequence = inFlight.get(request.id());
    if (otherSequence != null) {
      LOGGER.warning(() -> nodeId + " dropping PRE_PREPARE reusing request " + request.id() + " already at sequence "
          + otherSequence);
      return;
    }

    final TokenPayload payload;
    if (committedRequestIds.contains(request.id())) {
      // still vote so that sequence numbers stay aligned; execution will skip it
      payload = null;
    } else {
      try {
        payload = tokenCheck.apply(request.token());
      } catch (TokenException e) {
        LOGGER.warning(() -> nodeId + " rejecting PRE_PREPARE " + message + " as its token failed: " + e.reason());
        return;
      }
      if (!payload.jti().equals(request.id())) {
        LOGGER.warning(() -> nodeId + " rejecting PRE_PREPARE " + message + " as its token " + payload.jti()
            + " was not issued for request " + request.id());
        return;
      }
    }

    final var slot = existing != null ? existing : new Slot(message.slot());
    slots.put(message.sequence(), slot);
    slot.request = request;
    slot.payload = payload;
    slot.digest = message.digest();
    slot.phase = Phase.PREPARE;
    slot.prepares.put(message.nodeId(), message);
    sequence = Math.max(sequence, message.sequence());
    inFlight.put(request.id(), message.sequence());

    final var prepare = authenticator.sign(ConsensusMessage.prepare(view, message.sequence(), slot.digest, nodeId));
    slot.prepares.put(nodeId, prepare);
    messages.add(prepare);
    checkPrepared(slot, messages, committed);
  }

  private void acceptPrepare(ConsensusMessage message,
                             List<ConsensusMessage> messages,
                             List<CommittedRequest> committed) {
    if (message.nodeId().equals(primary())) {
      LOGGER.fine(() -> nodeId + " ignoring PREPARE from the primary " + message);
      return;
    }
    final var slot = slots.computeIfAbsent(message.sequence(), s -> new Slot(message.slot()));
    slot.prepares.putIfAbsent(message.nodeId(), message);
    checkPrepared(slot, messages, committed);
  }

  private void acceptCommit(ConsensusMessage message, List<CommittedRequest> committed) {
    final var slot = slots.computeIfAbsent(message.sequence(), s -> new Slot(message.slot()));
    slot.commits.putIfAbsent(message.nodeId(), message);
    checkCommitted(slot, committed);
  }

  private void checkPrepared(Slot slot, List<ConsensusMessage> messages, List<CommittedRequest> committed) {
    if (slot.request == null || (slot.phase != Phase.PRE_PREPARE && slot.phase != Phase.PREPARE)) {
      return;
    }
    final var votes = slot.matching(slot.prepares);
    if (quorumStrategy.assessPrepares(slot.key, votes) != QuorumStrategy.QuorumOutcome.WIN) {
      return;
    }
    slot.prepareQuorum = votes;
    slot.phase = Phase.COMMIT;
    final var commit = authenticator.sign(ConsensusMessage.commit(view, slot.key.sequence(), slot.digest, nodeId));
    slot.commits.put(nodeId, commit);
    messages.add(commit);
    LOGGER.fine(() -> nodeId + " prepared " + slot.key + " with " + votes.size() + " votes");
    checkCommitted(slot, committed);
  }

  private void checkCommitted(Slot slot, List<CommittedRequest> committed) {
    if (slot.phase != Phase.COMMIT) {
      return;
    }
    final var votes = slot.matching(slot.commits);
    if (quorumStrategy.assessCommits(slot.key, votes) != QuorumStrategy.QuorumOutcome.WIN) {
      return;
    }
    slot.commitQuorum = votes;
    slot.phase = Phase.COMMITTED;
    LOGGER.fine(() -> nodeId + " committed " + slot.key + " with " + votes.size() + " votes");
    executeInOrder(committed);
  }

  private void executeInOrder(List<CommittedRequest> committed) {
    Slot next;
    while ((next = slots.get(lastExecuted + 1)) != null && next.phase == Phase.COMMITTED) {
      slots.remove(lastExecuted + 1);
      lastExecuted++;
      execute(next, committed);
    }
  }

  private void execute(Slot slot, List<CommittedRequest> committed) {
    inFlight.remove(slot.request.id());
    if (!committedRequestIds.add(slot.request.id())) {
      LOGGER.fine(() -> nodeId + " skipping " + slot.key + " as request " + slot.request.id() + " already executed");
      return;
    }
    committed.add(new CommittedRequest(slot.key, slot.request, slot.payload, slot.digest, slot.prepareQuorum,
        slot.commitQuorum));
  }

  /// Votes to leave the current view, for example on a consensus timeout. Asking again before the view changes
  /// repeats the earlier vote so that every timeout of a slow round does not push the target further away.
  PbftResult requestViewChange() {
    guardRunning();
    final var messages = new ArrayList<ConsensusMessage>();
    final var committed = new ArrayList<CommittedRequest>();
    voteForView(votedView > view ? votedView : view + 1, messages, committed);
    return new PbftResult(messages, committed);
  }

  private void voteForView(long target, List<ConsensusMessage> messages, List<CommittedRequest> committed) {
    votedView = Math.max(votedView, target);
    messages.add(authenticator.sign(ConsensusMessage.viewChange(target, nodeId)));
    LOGGER.info(() -> nodeId + " in view " + view + " voting for view " + target);
    countViewVote(target, nodeId, messages, committed);
  }

  private void acceptViewChange(ConsensusMessage message,
                                List<ConsensusMessage> messages,
                                List<CommittedRequest> committed) {
    final long target = message.view();
    if (target <= view || target > view + VIEW_WINDOW) {
      LOGGER.fine(() -> nodeId + " in view " + view + " ignoring " + message);
      return;
    }
    countViewVote(target, message.nodeId(), messages, committed);
  }

  private void countViewVote(long target,
                             NodeId voter,
                             List<ConsensusMessage> messages,
                             List<CommittedRequest> committed) {
    viewChangeVotes.computeIfAbsent(target, v -> new HashSet<>()).add(voter);

    if (votedView <= view) {
      final var others = viewChangeVotes.values().stream()
          .flatMap(Set::stream)
          .filter(id -> !id.equals(nodeId))
          .collect(Collectors.toSet());
      if (quorumStrategy.assessViewChangeJoin(others) == QuorumStrategy.QuorumOutcome.WIN) {
        final long lowest = viewChangeVotes.firstKey();
        LOGGER.info(() -> nodeId + " joining " + others + " in leaving view " + view);
        voteForView(lowest, messages, committed);
        return;
      }
    }

    viewChangeVotes.descendingMap().entrySet().stream()
        .filter(e -> quorumStrategy.assessViewChange(e.getKey(), e.getValue()) == QuorumStrategy.QuorumOutcome.WIN)
        .map(Map.Entry::getKey)
        .findFirst()
        .ifPresent(newView -> {
          final var entered = enterView(newView);
          messages.addAll(entered.messages());
          committed.addAll(entered.committed());
        });
  }

  private void holdForLaterView(ConsensusMessage message) {
    if (message.view() > view + VIEW_WINDOW) {
      LOGGER.fine(() -> nodeId + " in view " + view + " dropping message for a distant view " + message);
      return;
    }
    final var held = earlyMessages.computeIfAbsent(message.view(), v -> new ArrayList<>());
    if (held.size() >= WATERMARK_WINDOW) {
      LOGGER.fine(() -> nodeId + " dropping early message as too many are held for view " + message.view());
      return;
    }
    LOGGER.finer(() -> nodeId + " in view " + view + " holding " + message);
    held.add(message);
  }

  /// Moves into the given view. Committed slots still waiting on a gap execute first; every other slot is abandoned.
  /// Messages held for the new view are then processed.
  PbftResult enterView(long newView) {
    guardRunning();
    if (newView <= view) {
      throw new IllegalArgumentException(nodeId + " cannot move from view " + view + " to view " + newView);
    }
    final var committed = new ArrayList<CommittedRequest>();
    slots.values().stream()
        .filter(slot -> slot.phase == Phase.COMMITTED)
        .toList()
        .forEach(slot -> execute(slot, committed));
    final var abandoned = slots.size() - committed.size();
    view = newView;
    votedView = Math.max(votedView, newView);
    sequence = 0;
    lastExecuted = 0;
    slots.clear();
    inFlight.clear();
    viewChangeVotes.headMap(newView, true).clear();
    earlyMessages.headMap(newView).clear();
    LOGGER.info(() -> nodeId + " changed to view " + view + " with primary " + primary() + " abandoning "
        + abandoned + " slots");

    final var messages = new ArrayList<ConsensusMessage>();
    final var held = earlyMessages.remove(newView);
    if (held != null) {
      for (ConsensusMessage message : held) {
        final var result = consensus(message);
        messages.addAll(result.messages());
        committed.addAll(result.committed());
      }
    }
    return new PbftResult(messages, committed);
  }

  public NodeId primary() {
    return membership.primaryFor(view);
  }

  public boolean isPrimary() {
    return primary().equals(nodeId);
  }

  public long view() {
    return view;
  }

  public long sequence() {
    return sequence;
  }

  public boolean isCommitted(String requestId) {
    return committedRequestIds.contains(requestId);
  }

  public int committedCount() {
    return committedRequestIds.size();
  }

  public NodeId nodeId() {
    return nodeId;
  }

  public ClusterMembership membership() {
    return membership;
  }

  @TestOnly
  Optional<Phase> phaseOf(long sequence) {
    return Optional.ofNullable(slots.get(sequence)).map(s -> s.phase);
  }

  @TestOnly
  int bufferedSlots() {
    return slots.size();
  }

  @TestOnly
  int heldForLaterViews() {
    return earlyMessages.values().stream().mapToInt(List::size).sum();
  }

  private void guardRunning() {
    if (crashed) {
      throw new ConsensusException(ConsensusException.Reason.NOT_RUNNING, nodeId + " has crashed and must be restarted");
    }
    if (closed) {
      throw new ConsensusException(ConsensusException.Reason.NOT_RUNNING, nodeId + " is closed");
    }
  }

  /// Marks this node as crashed. It refuses all further work until it is restarted.
  void crash() {
    crashed = true;
  }

  void close() {
    closed = true;
  }

  public boolean isCrashed() {
    return crashed;
  }

  public boolean isClosed() {
    return closed;
  }
}
