// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger;

import lombok.With;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;

/// Immutable node settings. Start from {@link #defaults()} or {@link #load()} and adjust with the `with*` methods.
///
/// {@link #load()} resolves each setting from, in order of precedence:
///
/// 1. JVM system properties named `pbft.ledger.<setting>` such as `pbft.ledger.shardCount`
/// 2. Environment variables named `PBFT_LEDGER_<SETTING>` such as `PBFT_LEDGER_SHARD_COUNT`
/// 3. The classpath resource `pbft-ledger.properties` using the bare setting names
/// 4. The defaults
///
/// Durations are ISO-8601 (`PT5S`) or a plain number of milliseconds.
@With
public record LedgerConfig(
    int shardCount,
    int blockSize,
    Duration consensusTimeout,
    int maxViewChanges,
    String tokenIssuer,
    String tokenAudience,
    Duration clockSkew,
    Duration maxTokenValidity,
    double minValidationScore,
    Duration verifiedCacheRetention,
    Duration replayRetention,
    Duration cleanupInterval,
    int defaultQueryLimit
) {
  public static final String RESOURCE = "pbft-ledger.properties";
  public static final String PROPERTY_PREFIX = "pbft.ledger.";
  public static final String ENV_PREFIX = "PBFT_LEDGER_";

  public LedgerConfig {
    if (shardCount < 1) throw new IllegalArgumentException("shardCount must be at least 1");
    if (blockSize < 1) throw new IllegalArgumentException("blockSize must be at least 1");
    if (maxViewChanges < 0) throw new IllegalArgumentException("maxViewChanges must not be negative");
    if (defaultQueryLimit < 1) throw new IllegalArgumentException("defaultQueryLimit must be at least 1");
    if (minValidationScore < 0.0 || minValidationScore > 1.0) {
      throw new IllegalArgumentException("minValidationScore must be within 0..1");
    }
    requirePositive(consensusTimeout, "consensusTimeout");
    requirePositive(maxTokenValidity, "maxTokenValidity");
    requirePositive(cleanupInterval, "cleanupInterval");
    requirePositive(verifiedCacheRetention, "verifiedCacheRetention");
    requirePositive(replayRetention, "replayRetention");
    if (clockSkew == null || clockSkew.isNegative()) throw new IllegalArgumentException("clockSkew must not be negative");
    if (tokenIssuer == null || tokenIssuer.isBlank()) throw new IllegalArgumentException("tokenIssuer is required");
    if (tokenAudience == null || tokenAudience.isBlank()) throw new IllegalArgumentException("tokenAudience is required");
  }

  public static LedgerConfig defaults() {
    return new LedgerConfig(
        4,
        1000,
        Duration.ofMillis(400),
        3,
        "stage1.token-issuer",
        "stage2.consensus.network",
        Duration.ofSeconds(5),
        Duration.ofSeconds(300),
        0.5,
        Duration.ofMinutes(5),
        Duration.ofMinutes(10),
        Duration.ofMinutes(5),
        100);
  }

  public static LedgerConfig load() {
    final var fileProperties = new Properties();
    try (InputStream in = LedgerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in != null) {
        fileProperties.load(in);
        LOGGER.fine(() -> "Loaded " + RESOURCE + " with " + fileProperties.size() + " settings");
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + RESOURCE, e);
    }
    return resolve(name -> {
      final var system = System.getProperty(PROPERTY_PREFIX + name);
      if (system != null) return system;
      final var env = System.getenv(envName(name));
      if (env != null) return env;
      return fileProperties.getProperty(name);
    });
  }

  /// Builds a config from a properties object using the bare setting names. Missing settings keep their defaults.
  public static LedgerConfig fromProperties(Properties properties) {
    return resolve(properties::getProperty);
  }

  static LedgerConfig resolve(Function<String, String> lookup) {
    final var d = defaults();
    return new LedgerConfig(
        intValue(lookup, "shardCount", d.shardCount()),
        intValue(lookup, "blockSize", d.blockSize()),
        durationValue(lookup, "consensusTimeout", d.consensusTimeout()),
        intValue(lookup, "maxViewChanges", d.maxViewChanges()),
        stringValue(lookup, "tokenIssuer", d.tokenIssuer()),
        stringValue(lookup, "tokenAudience", d.tokenAudience()),
        durationValue(lookup, "clockSkew", d.clockSkew()),
        durationValue(lookup, "maxTokenValidity", d.maxTokenValidity()),
        doubleValue(lookup, "minValidationScore", d.minValidationScore()),
        durationValue(lookup, "verifiedCacheRetention", d.verifiedCacheRetention()),
        durationValue(lookup, "replayRetention", d.replayRetention()),
        durationValue(lookup, "cleanupInterval", d.cleanupInterval()),
        intValue(lookup, "defaultQueryLimit", d.defaultQueryLimit()));
  }

  /// `shardCount` becomes `PBFT_LEDGER_SHARD_COUNT`
  static String envName(String setting) {
    return ENV_PREFIX + setting.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
  }

  private static String stringValue(Function<String, String> lookup, String name, String fallback) {
    final var value = lookup.apply(name);
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static int intValue(Function<String, String> lookup, String name, int fallback) {
    final var value = stringValue(lookup, name, null);
    if (value == null) return fallback;
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Setting " + name + " is not an integer: " + value, e);
    }
  }

  private static double doubleValue(Function<String, String> lookup, String name, double fallback) {
    final var value = stringValue(lookup, name, null);
    if (value == null) return fallback;
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Setting " + name + " is not a number: " + value, e);
    }
  }

  private static Duration durationValue(Function<String, String> lookup, String name, Duration fallback) {
    final var value = stringValue(lookup, name, null);
    if (value == null) return fallback;
    try {
      if (value.chars().allMatch(Character::isDigit)) {
        return Duration.ofMillis(Long.parseLong(value));
      }
      return Duration.parse(value);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Setting " + name + " is not a duration: " + value, e);
    }
  }

  private static void requirePositive(Duration duration, String name) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
