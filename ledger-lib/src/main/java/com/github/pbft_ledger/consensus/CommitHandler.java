// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import java.util.List;
import java.util.Optional;

/// The host application's side of execution. Called under the engine mutex with requests in commit order.
///
/// @param <RESULT> what applying a request produces
public interface CommitHandler<RESULT> {

  /// Applies the committed requests and returns one result per request in the same order. Throwing crashes the node.
  List<RESULT> execute(List<CommittedRequest> committed);

  /// The result of a request executed earlier, used to answer a duplicate submission.
  Optional<RESULT> executed(String requestId);
}
