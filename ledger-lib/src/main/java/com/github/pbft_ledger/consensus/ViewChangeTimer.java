// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.NodeId;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;

/// One consensus timeout per pending request on a single daemon thread. Rescheduling a key replaces its timeout.
public class ViewChangeTimer implements AutoCloseable {
  private final NodeId nodeId;
  private final ScheduledExecutorService scheduler;
  private final ConcurrentHashMap<String, ScheduledFuture<?>> timeouts = new ConcurrentHashMap<>();

  public ViewChangeTimer(NodeId nodeId) {
    this.nodeId = nodeId;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      final var thread = new Thread(r, "view-change-timer-" + nodeId.id());
      thread.setDaemon(true);
      return thread;
    });
  }

  public void schedule(String key, Duration delay, Runnable task) {
    LOGGER.finer(() -> "Node " + nodeId + " setting timeout for " + key + " in " + delay.toMillis() + "ms");
    final ScheduledFuture<?> future = scheduler.schedule(() -> {
      timeouts.remove(key);
      try {
        task.run();
      } catch (RuntimeException e) {
        LOGGER.log(Level.WARNING, "Node " + nodeId + " timeout task for " + key + " failed: " + e, e);
      }
    }, delay.toMillis(), TimeUnit.MILLISECONDS);
    final var previous = timeouts.put(key, future);
    if (previous != null) {
      previous.cancel(false);
    }
  }

  public void cancel(String key) {
    final var current = timeouts.remove(key);
    if (current != null) {
      LOGGER.finer(() -> "Node " + nodeId + " clearing timeout for " + key);
      current.cancel(false);
    }
  }

  public int scheduled() {
    return timeouts.size();
  }

  @Override
  public void close() {
    timeouts.clear();
    scheduler.shutdownNow();
  }
}
