// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.storage;

import com.github.pbft_ledger.LedgerJson;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/// An immutable committed record owned by exactly one shard.
///
/// @param id            record id
/// @param timestamp     epoch millis
/// @param tokenId       the `jti` of the authorising token
/// @param data          the application payload
/// @param tokenMetadata score, department and permissions of the authorising token
/// @param hash          SHA-256 over the canonical JSON of id, timestamp, tokenId, data and tokenMetadata
/// @param merkleProof   inclusion proof issued when the record was appended
/// @param blockHeight   the block of the shard that holds the record
/// @param shardId       the owning shard
public record PermanentRecord(
    String id,
    long timestamp,
    String tokenId,
    Map<String, Object> data,
    TokenMetadata tokenMetadata,
    String hash,
    MerkleProof merkleProof,
    long blockHeight,
    int shardId
) {
  public PermanentRecord {
    data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  public static String idFor(String requestId) {
    return UUID.nameUUIDFromBytes(("record:" + requestId).getBytes(StandardCharsets.UTF_8)).toString();
  }

  public static String computeHash(String id, long timestamp, String tokenId, Map<String, Object> data,
                                   TokenMetadata tokenMetadata) {
    // data and metadata are siblings; a data key named tokenMetadata is only data
    final var canonical = new LinkedHashMap<String, Object>();
    canonical.put("id", id);
    canonical.put("timestamp", timestamp);
    canonical.put("tokenId", tokenId);
    canonical.put("data", data);
    canonical.put("tokenMetadata", tokenMetadata);
    return LedgerJson.sha256Hex(LedgerJson.canonical(canonical));
  }

  /// True when the hash still matches the content.
  public boolean hashMatchesContent() {
    return hash.equals(computeHash(id, timestamp, tokenId, data, tokenMetadata));
  }

  public int leafIndex() {
    return merkleProof.leafIndex();
  }

  public String department() {
    return tokenMetadata.department();
  }
}
