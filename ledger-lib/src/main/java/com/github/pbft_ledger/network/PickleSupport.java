// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.network;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/// Length prefixed UTF-8 strings and byte arrays.
final class PickleSupport {
  private PickleSupport() {
  }

  static int sizeOf(String value) {
    return Integer.BYTES + value.getBytes(StandardCharsets.UTF_8).length;
  }

  static int sizeOf(byte[] value) {
    return Integer.BYTES + value.length;
  }

  static void write(String value, ByteBuffer buffer) {
    write(value.getBytes(StandardCharsets.UTF_8), buffer);
  }

  static void write(byte[] value, ByteBuffer buffer) {
    buffer.putInt(value.length);
    buffer.put(value);
  }

  static String readString(ByteBuffer buffer) {
    return new String(readBytes(buffer), StandardCharsets.UTF_8);
  }

  static byte[] readBytes(ByteBuffer buffer) {
    final int length = buffer.getInt();
    if (length < 0 || length > buffer.remaining()) {
      throw new IllegalArgumentException("Invalid length " + length + " with " + buffer.remaining() + " bytes remaining");
    }
    final var bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }
}
