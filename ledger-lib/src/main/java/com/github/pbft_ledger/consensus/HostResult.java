// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.msg.SlotKey;

public record HostResult<RESULT>(SlotKey slot, String requestId, RESULT result) {
}
