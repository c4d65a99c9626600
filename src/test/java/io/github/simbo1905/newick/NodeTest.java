// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package io.github.simbo1905.newick;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

  @Test
  void labelsRejectNewickPunctuationAndWhitespace() {
    for (var bad : List.of("a(b", "a)b", "a,b", "a:b", "a;b", "a b", "a\tb")) {
      assertThatThrownBy(() -> Node.tip(bad)).isInstanceOf(IllegalArgumentException.class);
    }
    assertEquals("Oryza_sativa.v7-1", Node.tip("Oryza_sativa.v7-1").label());
  }

  @Test
  void lengthsMustBeNumbers() {
    assertThatThrownBy(() -> Node.tip("a", "1,5")).hasMessageContaining("not a number");
    assertEquals(1.5, Node.tip("a", "1.5").branchLength().orElseThrow());
  }

  @Test
  void innerNodesNeedChildren() {
    assertThrows(IllegalArgumentException.class, () -> Node.inner("x", null, List.of()));
  }

  @Test
  void childrenAreCopiedAndImmutable() {
    final List<Node> children = new ArrayList<>(List.of(Node.tip("a"), Node.tip("b")));
    final Node node = Node.inner("x", "1", children);
    children.add(Node.tip("c"));
    assertEquals(2, node.children().size());
    assertThrows(UnsupportedOperationException.class, () -> node.children().add(Node.tip("d")));
  }

  @Test
  void copiesKeepTheOriginalUntouched() {
    final Node node = Node.inner("x", "1", List.of(Node.tip("a"), Node.tip("b")));
    final Node relabelled = node.withLabel("y");
    assertEquals("x", node.label());
    assertEquals("y", relabelled.label());
    assertEquals(node.children(), relabelled.children());
    assertThat(node.withChildren(List.of(Node.tip("a"))).children()).containsExactly(Node.tip("a"));
  }

  @Test
  void concurrentCallersShareNothing() throws Exception {
    final String newick = Phylo.newick("monocot");
    final ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      final List<Future<String>> results = new ArrayList<>();
      for (int i = 0; i < 64; i++) {
        results.add(pool.submit(() -> Phylo.newickize(Phylo.parseNewick(newick))));
      }
      for (var result : results) {
        assertEquals(newick, result.get(10, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }
  }
}
