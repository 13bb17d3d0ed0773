// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.LedgerException;

/// A request could not be ordered.
public class ConsensusException extends LedgerException {
  public static final String CODE = "CONSENSUS_ERROR";

  public enum Reason {
    /// The token failed verification at entry. The request never entered the protocol.
    INVALID_TOKEN(401),
    /// No quorum was reached after the allowed number of view changes.
    QUORUM_NOT_REACHED(503),
    /// The node is closed or crashed.
    NOT_RUNNING(503);

    final int statusCode;

    Reason(int statusCode) {
      this.statusCode = statusCode;
    }
  }

  private final Reason reason;

  public ConsensusException(Reason reason, String message) {
    super(CODE, message, reason.statusCode);
    this.reason = reason;
  }

  public ConsensusException(Reason reason, String message, Throwable cause) {
    super(CODE, message, reason.statusCode, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
