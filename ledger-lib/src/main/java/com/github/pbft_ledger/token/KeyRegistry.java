// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.token;

import io.jsonwebtoken.security.Jwk;
import io.jsonwebtoken.security.JwkSet;
import io.jsonwebtoken.security.Jwks;

import java.security.Key;
import java.security.PublicKey;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;

/// The token issuer's verification keys by key id (`kid` header). Immutable; build a new registry to rotate keys.
public final class KeyRegistry {
  private final Map<String, PublicKey> keys;

  private KeyRegistry(Map<String, PublicKey> keys) {
    this.keys = Map.copyOf(keys);
  }

  public static KeyRegistry of(Map<String, ? extends PublicKey> keys) {
    return new KeyRegistry(new HashMap<>(keys));
  }

  /// Loads the public keys of a JWK set document. Keys without a `kid` or that are not public keys are skipped.
  public static KeyRegistry fromJwkSet(String json) {
    final JwkSet jwkSet = Jwks.setParser().build().parse(json);
    final var keys = new HashMap<String, PublicKey>();
    for (Jwk<?> jwk : jwkSet.getKeys()) {
      final Key key = jwk.toKey();
      if (jwk.getId() == null || !(key instanceof PublicKey publicKey)) {
        LOGGER.warning(() -> "Skipping JWK without kid or public key: " + jwk.getType());
        continue;
      }
      keys.put(jwk.getId(), publicKey);
    }
    LOGGER.fine(() -> "Loaded " + keys.size() + " token verification keys " + keys.keySet());
    return new KeyRegistry(keys);
  }

  public Optional<PublicKey> lookup(String keyId) {
    return keyId == null ? Optional.empty() : Optional.ofNullable(keys.get(keyId));
  }

  public Set<String> keyIds() {
    return keys.keySet();
  }

  public int size() {
    return keys.size();
  }
}
