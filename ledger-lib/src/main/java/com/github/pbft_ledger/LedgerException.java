// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger;

/// Root of the ledger error taxonomy. The code is stable for callers to switch on and the status code is the
/// HTTP-like status a transport layer should map the failure to.
public class LedgerException extends RuntimeException {
  private final String code;
  private final int statusCode;

  public LedgerException(String code, String message, int statusCode) {
    super(message);
    this.code = code;
    this.statusCode = statusCode;
  }

  public LedgerException(String code, String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.statusCode = statusCode;
  }

  public String code() {
    return code;
  }

  public int statusCode() {
    return statusCode;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + code + "/" + statusCode + "]: " + getMessage();
  }
}
