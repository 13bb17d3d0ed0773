// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.service;

import java.util.Map;

/// One entry of {@link StorageService#processBatch}.
public record BatchItem(String token, Map<String, Object> data) {
}
