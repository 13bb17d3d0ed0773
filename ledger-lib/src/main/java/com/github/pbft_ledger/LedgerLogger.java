// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger;

import java.util.logging.Logger;

/// The single JUL logger shared by the ledger. Applications configure handlers and levels on it in the usual way.
public final class LedgerLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.pbft_ledger");

  private LedgerLogger() {
  }
}
