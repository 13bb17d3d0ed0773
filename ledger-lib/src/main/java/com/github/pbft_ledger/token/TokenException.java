// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.token;

import com.github.pbft_ledger.LedgerException;

import java.util.Optional;

/// A capability token was rejected. None of the reasons are retryable with the same token.
public class TokenException extends LedgerException {
  public static final String CODE = "TOKEN_ERROR";

  public enum Reason {
    MALFORMED,
    UNKNOWN_KEY,
    BAD_SIGNATURE,
    ISSUER_AUDIENCE_MISMATCH,
    CLOCK_SKEW,
    EXPIRED,
    WINDOW_EXCEEDED,
    MISSING_FIELDS,
    LOW_SCORE,
    NO_PERMISSIONS,
    REPLAY
  }

  private final Reason reason;
  private final String tokenId;

  public TokenException(Reason reason, String message) {
    this(reason, message, null, null);
  }

  public TokenException(Reason reason, String message, String tokenId) {
    this(reason, message, tokenId, null);
  }

  public TokenException(Reason reason, String message, String tokenId, Throwable cause) {
    super(CODE, message, 401, cause);
    this.reason = reason;
    this.tokenId = tokenId;
  }

  public Reason reason() {
    return reason;
  }

  /// The `jti` when the token got far enough to read it.
  public Optional<String> tokenId() {
    return Optional.ofNullable(tokenId);
  }
}
