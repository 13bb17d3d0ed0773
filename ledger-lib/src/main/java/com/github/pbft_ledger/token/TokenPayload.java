// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.token;

import java.util.Set;

/// The verified claims of a capability token. Times are unix seconds.
///
/// @param jti               unique token id used for replay detection
/// @param issuer            the `iss` claim
/// @param audience          the `aud` claim
/// @param issuedAt          the `iat` claim
/// @param expiresAt         the `exp` claim
/// @param validationResults the upstream score
/// @param department        optional issuing department, may be null
/// @param permissions       bitmask of {@link Permission} bits, never zero once verified
public record TokenPayload(
    String jti,
    String issuer,
    Set<String> audience,
    long issuedAt,
    long expiresAt,
    ValidationResults validationResults,
    String department,
    long permissions
) {
  public TokenPayload {
    audience = audience == null ? Set.of() : Set.copyOf(audience);
  }

  public double score() {
    return validationResults.score();
  }
}
