// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.token;

import java.util.Arrays;

/// The bits of the `permissions` claim.
public enum Permission {
  READ(1L),
  WRITE(2L),
  ADMIN(4L),
  TRANSFER(8L);

  private final long bit;

  Permission(long bit) {
    this.bit = bit;
  }

  public long bit() {
    return bit;
  }

  public static long mask(Permission... permissions) {
    return Arrays.stream(permissions).mapToLong(Permission::bit).reduce(0L, (a, b) -> a | b);
  }
}
