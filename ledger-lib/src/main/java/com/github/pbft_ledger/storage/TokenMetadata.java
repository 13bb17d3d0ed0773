// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.storage;

import com.github.pbft_ledger.token.TokenPayload;

/// The token facts attached to every stored record.
public record TokenMetadata(double validationScore, String department, long permissions) {
  public static TokenMetadata of(TokenPayload payload) {
    return new TokenMetadata(payload.score(), payload.department(), payload.permissions());
  }
}
