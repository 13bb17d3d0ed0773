// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.msg;

import com.github.pbft_ledger.NodeId;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RequestTest {

  @Test
  public void digestIgnoresKeyOrder() {
    final var ab = new LinkedHashMap<String, Object>();
    ab.put("a", 1);
    ab.put("b", Map.of("y", 2, "x", 1));
    final var ba = new LinkedHashMap<String, Object>();
    ba.put("b", Map.of("x", 1, "y", 2));
    ba.put("a", 1);

    assertThat(new Request("r", "t", ab, 5).digest()).isEqualTo(new Request("r", "t", ba, 5).digest());
  }

  @Test
  public void digestCoversEveryField() {
    final var base = new Request("r", "t", Map.of("a", 1), 5);

    assertThat(base.digest()).hasSize(64);
    assertThat(new Request("r2", "t", Map.of("a", 1), 5).digest()).isNotEqualTo(base.digest());
    assertThat(new Request("r", "t2", Map.of("a", 1), 5).digest()).isNotEqualTo(base.digest());
    assertThat(new Request("r", "t", Map.of("a", 2), 5).digest()).isNotEqualTo(base.digest());
    assertThat(new Request("r", "t", Map.of("a", 1), 6).digest()).isNotEqualTo(base.digest());
  }

  @Test
  public void onlyPrePrepareCarriesTheRequest() {
    final var request = new Request("r", "t", Map.of(), 0);
    final var node = new NodeId("n");

    assertThatThrownBy(() -> new ConsensusMessage(MessageType.PRE_PREPARE, 0, 1, "d", node, "", Optional.empty()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ConsensusMessage(MessageType.COMMIT, 0, 1, "d", node, "", Optional.of(request)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(ConsensusMessage.prePrepare(0, 1, node, request).token()).contains("t");
  }

  @Test
  public void signedContentBindsSenderAndSlot() {
    final var a = ConsensusMessage.prepare(1, 2, "d", new NodeId("a"));
    final var b = ConsensusMessage.prepare(1, 2, "d", new NodeId("b"));

    assertThat(new String(a.signedContent())).isEqualTo("PREPARE|1|2|d|a");
    assertThat(a.signedContent()).isNotEqualTo(b.signedContent());
    assertThat(a.withSignature("s").signedContent()).isEqualTo(a.signedContent());
  }
}
