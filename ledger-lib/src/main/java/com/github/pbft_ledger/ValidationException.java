// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger;

/// Bad caller input such as a missing payload or an out of range shard id.
public class ValidationException extends LedgerException {
  public static final String CODE = "VALIDATION_ERROR";

  public ValidationException(String message) {
    super(CODE, message, 400);
  }
}
