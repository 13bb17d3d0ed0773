// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.network;

import com.github.pbft_ledger.LedgerJson;
import com.github.pbft_ledger.Pickler;
import com.github.pbft_ledger.msg.Request;

import java.nio.ByteBuffer;

/// Wire format of a request handed to the other replicas: `id | token | timestamp | data-json`.
public class RequestPickler implements Pickler<Request> {
  public static final RequestPickler instance = new RequestPickler();

  protected RequestPickler() {
  }

  @Override
  public void serialize(Request request, ByteBuffer buffer) {
    PickleSupport.write(request.id(), buffer);
    PickleSupport.write(request.token(), buffer);
    buffer.putLong(request.timestamp());
    PickleSupport.write(LedgerJson.canonicalBytes(request.data()), buffer);
  }

  @Override
  public Request deserialize(ByteBuffer buffer) {
    final var id = PickleSupport.readString(buffer);
    final var token = PickleSupport.readString(buffer);
    final long timestamp = buffer.getLong();
    final var data = LedgerJson.readMap(PickleSupport.readBytes(buffer));
    return new Request(id, token, data, timestamp);
  }

  @Override
  public int sizeOf(Request request) {
    return PickleSupport.sizeOf(request.id())
        + PickleSupport.sizeOf(request.token())
        + Long.BYTES
        + PickleSupport.sizeOf(LedgerJson.canonicalBytes(request.data()));
  }
}
