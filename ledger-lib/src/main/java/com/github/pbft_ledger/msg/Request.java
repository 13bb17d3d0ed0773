// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.msg;

import com.github.pbft_ledger.LedgerJson;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A client request admitted into consensus. It is consumed exactly once: committed or rejected, never re-entered
/// under the same id.
///
/// @param id        unique request id, the token's `jti` when created by the storage service
/// @param token     the capability token authorising the request
/// @param data      the application payload, a JSON object
/// @param timestamp epoch millis assigned where the request entered the cluster
public record Request(String id, String token, Map<String, Object> data, long timestamp) {
  public Request {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(token, "token");
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  /// SHA-256 over the canonical JSON of all four fields. This is the unit of agreement.
  public String digest() {
    final var canonical = new LinkedHashMap<String, Object>();
    canonical.put("id", id);
    canonical.put("token", token);
    canonical.put("data", data);
    canonical.put("timestamp", timestamp);
    return LedgerJson.sha256Hex(LedgerJson.canonical(canonical));
  }

  @Override
  public String toString() {
    return "Request[id=" + id + ", timestamp=" + timestamp + ", data=" + data.keySet() + "]";
  }
}
