// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.storage;

import com.github.pbft_ledger.ValidationException;
import com.github.pbft_ledger.msg.Request;
import com.github.pbft_ledger.token.TokenPayload;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Everything needed to build a {@link PermanentRecord} except its position. The hash, and so the shard, is fixed
/// here.
public record StoreRequest(String recordId, long timestamp, String tokenId, Map<String, Object> data,
                           TokenMetadata tokenMetadata) {
  public StoreRequest {
    Objects.requireNonNull(recordId, "recordId");
    Objects.requireNonNull(tokenId, "tokenId");
    Objects.requireNonNull(tokenMetadata, "tokenMetadata");
    if (data == null) {
      throw new ValidationException("Record data is required");
    }
    data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  public static StoreRequest of(TokenPayload payload, Map<String, Object> data, String recordId, long timestamp) {
    return new StoreRequest(recordId, timestamp, payload.jti(), data, TokenMetadata.of(payload));
  }

  /// Every replica derives the same record from the same committed request.
  public static StoreRequest forCommitted(Request request, TokenPayload payload) {
    return of(payload, request.data(), PermanentRecord.idFor(request.id()), request.timestamp());
  }

  public String hash() {
    return PermanentRecord.computeHash(recordId, timestamp, tokenId, data, tokenMetadata);
  }
}
