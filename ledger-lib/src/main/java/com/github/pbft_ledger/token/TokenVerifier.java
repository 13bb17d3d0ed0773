// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.pbft_ledger.LedgerConfig;
import com.github.pbft_ledger.LedgerJson;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.InvalidClaimException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SecurityException;
import org.jetbrains.annotations.TestOnly;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;
import static com.github.pbft_ledger.token.TokenException.Reason.*;

/// The gate in front of consensus. A capability token is admitted at most once: a successful {@link #verifyToken}
/// records the `jti` in the replay set so that any later presentation of the same token fails with
/// {@link TokenException.Reason#REPLAY}.
///
/// Checks run in this order and the first failure wins:
///
/// 1. three non-empty segments, else MALFORMED
/// 2. the header `kid` resolves in the {@link KeyRegistry}, else UNKNOWN_KEY
/// 3. the EdDSA signature verifies, else BAD_SIGNATURE
/// 4. `iss` and `aud` match the configuration, else ISSUER_AUDIENCE_MISMATCH
/// 5. `jti`, `iat`, `exp`, `validation_results.score` and `permissions` are present, else MISSING_FIELDS
/// 6. `exp - iat` is within the maximum validity, else WINDOW_EXCEEDED
/// 7. `iat` is not beyond the clock skew in the future, else CLOCK_SKEW
/// 8. `exp` is not in the past, else EXPIRED
/// 9. the score meets the minimum, else LOW_SCORE
/// 10. permissions are nonzero, else NO_PERMISSIONS
/// 11. the `jti` is not in the replay set, else REPLAY
///
/// The replay set and the verified-token cache are concurrent maps so that parallel batch verification never loses an
/// insertion. A daemon thread evicts stale entries every cleanup interval.
public class TokenVerifier implements AutoCloseable {
  static final String VALIDATION_RESULTS = "validation_results";
  static final String PERMISSIONS = "permissions";
  static final String DEPARTMENT = "department";

  private final LedgerConfig config;
  private final KeyRegistry keys;
  private final Clock clock;

  /// jti to the instant after which it may be forgotten
  private final ConcurrentHashMap<String, Instant> replaySet = new ConcurrentHashMap<>();
  /// exact token text to the payload admitted for it
  private final ConcurrentHashMap<String, VerifiedToken> verifiedCache = new ConcurrentHashMap<>();

  private final AtomicLong verifiedCount = new AtomicLong();
  private final AtomicLong rejectedCount = new AtomicLong();

  private final ScheduledExecutorService cleanup;

  record VerifiedToken(TokenPayload payload, Instant verifiedAt) {
  }

  public TokenVerifier(LedgerConfig config, KeyRegistry keys, Clock clock) {
    this.config = config;
    this.keys = keys;
    this.clock = clock;
    this.cleanup = Executors.newSingleThreadScheduledExecutor(r -> {
      final var thread = new Thread(r, "token-cleanup");
      thread.setDaemon(true);
      return thread;
    });
    final long interval = config.cleanupInterval().toMillis();
    cleanup.scheduleAtFixedRate(this::evictExpired, interval, interval, TimeUnit.MILLISECONDS);
  }

  public TokenVerifier(LedgerConfig config, KeyRegistry keys) {
    this(config, keys, Clock.systemUTC());
  }

  /// Strict verification that consumes the token's `jti`.
  ///
  /// @throws TokenException when any check fails
  public TokenPayload verifyToken(String token) {
    try {
      final var payload = checkSignedClaims(token);
      admit(token, payload);
      verifiedCount.incrementAndGet();
      LOGGER.fine(() -> "Admitted token " + payload.jti() + " score=" + payload.score());
      return payload;
    } catch (TokenException e) {
      rejectedCount.incrementAndGet();
      LOGGER.fine(() -> "Rejected token " + e.tokenId().orElse("?") + " " + e.reason() + ": " + e.getMessage());
      throw e;
    }
  }

  /// Returns the payload this verifier already admitted for exactly this token, or runs {@link #verifyToken} when the
  /// token has not been seen. A node that admitted a request at entry sees the same token again inside the
  /// primary's PRE_PREPARE and must not treat that as a replay. A cached token that has since expired is rejected.
  public TokenPayload reverify(String token) {
    final var cached = token == null ? null : verifiedCache.get(token);
    if (cached == null) {
      return verifyToken(token);
    }
    final var payload = cached.payload();
    if (payload.expiresAt() < clock.instant().getEpochSecond()) {
      rejectedCount.incrementAndGet();
      throw new TokenException(EXPIRED, "Token expired", payload.jti());
    }
    return payload;
  }

  /// Verifies each token independently and in parallel. A token that fails for any reason, including an
  /// unexpected error, yields an empty entry at its index and leaves the other entries alone.
  public List<Optional<TokenPayload>> verifyBatch(List<String> tokens) {
    final var futures = tokens.stream()
        .map(token -> CompletableFuture.supplyAsync(() -> tryVerify(token)))
        .toList();
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private Optional<TokenPayload> tryVerify(String token) {
    try {
      return Optional.of(verifyToken(token));
    } catch (TokenException e) {
      return Optional.empty();
    } catch (RuntimeException e) {
      rejectedCount.incrementAndGet();
      LOGGER.log(Level.WARNING, "Unexpected failure verifying a token in a batch: " + e.getMessage(), e);
      return Optional.empty();
    }
  }

  public static boolean hasPermission(TokenPayload payload, long permissionBit) {
    return (payload.permissions() & permissionBit) != 0;
  }

  public static boolean hasPermission(TokenPayload payload, Permission permission) {
    return hasPermission(payload, permission.bit());
  }

  public boolean isReplayed(String jti) {
    return replaySet.containsKey(jti);
  }

  private TokenPayload checkSignedClaims(String token) {
    if (token == null || token.isBlank()) {
      throw new TokenException(MALFORMED, "Token is empty");
    }
    final var segments = token.split("\\.", -1);
    if (segments.length != 3 || segments[0].isEmpty() || segments[1].isEmpty()) {
      throw new TokenException(MALFORMED, "Token must have three segments");
    }
    if (segments[2].isEmpty()) {
      throw new TokenException(BAD_SIGNATURE, "Token is not signed");
    }
    final var keyId = readKeyId(segments[0]);
    final var key = keys.lookup(keyId)
        .orElseThrow(() -> new TokenException(UNKNOWN_KEY, "Unknown signing key: " + keyId));

    final Claims claims;
    try {
      claims = Jwts.parser()
          .verifyWith(key)
          .requireIssuer(config.tokenIssuer())
          .requireAudience(config.tokenAudience())
          .clockSkewSeconds(config.clockSkew().toSeconds())
          .clock(() -> Date.from(clock.instant()))
          .build()
          .parseSignedClaims(token)
          .getPayload();
    } catch (ExpiredJwtException e) {
      // structural failures take precedence over expiry
      final var expired = toPayload(e.getClaims());
      throw new TokenException(EXPIRED, "Token expired", expired.jti(), e);
    } catch (InvalidClaimException e) {
      throw new TokenException(ISSUER_AUDIENCE_MISMATCH, "Invalid " + e.getClaimName() + " claim", null, e);
    } catch (SecurityException e) {
      throw new TokenException(BAD_SIGNATURE, "Invalid token signature", null, e);
    } catch (JwtException | IllegalArgumentException e) {
      throw new TokenException(MALFORMED, "Malformed token: " + e.getMessage(), null, e);
    }

    final var payload = toPayload(claims);
    final long now = clock.instant().getEpochSecond();
    if (payload.issuedAt() > now + config.clockSkew().toSeconds()) {
      throw new TokenException(CLOCK_SKEW, "Token issued in the future", payload.jti());
    }
    if (payload.expiresAt() < now) {
      throw new TokenException(EXPIRED, "Token expired", payload.jti());
    }
    if (payload.score() < config.minValidationScore()) {
      throw new TokenException(LOW_SCORE, "Validation score too low", payload.jti());
    }
    if (payload.permissions() == 0) {
      throw new TokenException(NO_PERMISSIONS, "No permissions granted", payload.jti());
    }
    return payload;
  }

  private String readKeyId(String headerSegment) {
    try {
      final JsonNode header = LedgerJson.MAPPER.readTree(Base64.getUrlDecoder().decode(headerSegment));
      final var kid = header.path("kid");
      if (!kid.isTextual() || kid.asText().isBlank()) {
        throw new TokenException(UNKNOWN_KEY, "Token header has no key id");
      }
      return kid.asText();
    } catch (IOException | IllegalArgumentException e) {
      throw new TokenException(MALFORMED, "Token header is not base64url JSON", null, e);
    }
  }

  private TokenPayload toPayload(Claims claims) {
    final var missing = new ArrayList<String>();
    final var jti = claims.getId();
    if (jti == null || jti.isBlank()) missing.add("jti");
    final Date iat = claims.getIssuedAt();
    if (iat == null) missing.add("iat");
    final Date exp = claims.getExpiration();
    if (exp == null) missing.add("exp");
    final var score = readScore(claims.get(VALIDATION_RESULTS));
    if (score == null) missing.add(VALIDATION_RESULTS + ".score");
    final var permissions = claims.get(PERMISSIONS);
    if (!(permissions instanceof Number)) missing.add(PERMISSIONS);
    if (!missing.isEmpty()) {
      throw new TokenException(MISSING_FIELDS, "Missing required fields: " + String.join(", ", missing), jti);
    }

    final long issuedAt = iat.getTime() / 1000;
    final long expiresAt = exp.getTime() / 1000;
    if (expiresAt - issuedAt > config.maxTokenValidity().toSeconds()) {
      throw new TokenException(WINDOW_EXCEEDED, "Token validity window exceeds "
          + config.maxTokenValidity().toSeconds() + "s", jti);
    }
    final var department = claims.get(DEPARTMENT) instanceof String d ? d : null;
    return new TokenPayload(
        jti,
        claims.getIssuer(),
        claims.getAudience(),
        issuedAt,
        expiresAt,
        new ValidationResults(score, checksPassed(claims.get(VALIDATION_RESULTS))),
        department,
        ((Number) permissions).longValue());
  }

  private static Double readScore(Object validationResults) {
    if (validationResults instanceof Map<?, ?> map && map.get("score") instanceof Number n) {
      return n.doubleValue();
    }
    return null;
  }

  private static List<String> checksPassed(Object validationResults) {
    if (validationResults instanceof Map<?, ?> map && map.get("checks_passed") instanceof List<?> list) {
      return list.stream().map(String::valueOf).toList();
    }
    return List.of();
  }

  private void admit(String token, TokenPayload payload) {
    final var now = clock.instant();
    final var validUntil = Instant.ofEpochSecond(payload.expiresAt()).plus(config.clockSkew());
    final var retained = now.plus(config.replayRetention());
    final var retainUntil = validUntil.isAfter(retained) ? validUntil : retained;
    if (replaySet.putIfAbsent(payload.jti(), retainUntil) != null) {
      throw new TokenException(REPLAY, "Token already used", payload.jti());
    }
    verifiedCache.put(token, new VerifiedToken(payload, now));
  }

  /// Forgets replay entries past their retention and cached verifications older than the cache retention.
  public void evictExpired() {
    final var now = clock.instant();
    final var cacheCutoff = now.minus(config.verifiedCacheRetention());
    final int replayBefore = replaySet.size();
    final int cacheBefore = verifiedCache.size();
    replaySet.entrySet().removeIf(e -> e.getValue().isBefore(now));
    verifiedCache.entrySet().removeIf(e -> e.getValue().verifiedAt().isBefore(cacheCutoff));
    LOGGER.finer(() -> "Token cleanup evicted " + (replayBefore - replaySet.size()) + " replay entries and "
        + (cacheBefore - verifiedCache.size()) + " cached tokens");
  }

  public VerifierMetrics metrics() {
    return new VerifierMetrics(verifiedCount.get(), rejectedCount.get(), replaySet.size(), verifiedCache.size(),
        keys.size());
  }

  @TestOnly
  int replaySetSize() {
    return replaySet.size();
  }

  @Override
  public void close() {
    cleanup.shutdownNow();
  }

  @Override
  public String toString() {
    return "TokenVerifier{issuer=" + config.tokenIssuer() + ", audience=" + config.tokenAudience()
        + ", keys=" + keys.keyIds() + "}";
  }
}
