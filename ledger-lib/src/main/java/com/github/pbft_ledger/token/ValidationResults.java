// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.token;

import java.util.List;

/// The upstream issuer's assessment embedded in the token as `validation_results`.
public record ValidationResults(double score, List<String> checksPassed) {
  public ValidationResults {
    checksPassed = checksPassed == null ? List.of() : List.copyOf(checksPassed);
  }
}
