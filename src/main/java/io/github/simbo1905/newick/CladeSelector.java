// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.newick.Phylo.LOGGER;

/// Cuts out the subtree rooted at a labelled node.
final class CladeSelector {

  private CladeSelector() {
  }

  /// The subtree whose root carries exactly `label`, including that node's own label and length.
  /// When the label occurs more than once the first occurrence in the text wins.
  static Node select(Node root, String label) {
    Objects.requireNonNull(label, "Label must not be null");
    final Node found = TreeWalk.find(root, label);
    if (found == null) {
      final var e = new NewickNotFoundException("No node carries the label", List.of(label));
      LOGGER.warning(e::getMessage);
      throw e;
    }
    LOGGER.fine(() -> "Selected clade '" + label + "' with " + TreeWalk.tipLabels(found).size() + " tips");
    return found;
  }

  static String select(String text, String label) {
    return NewickWriter.write(select(NewickParser.parse(NewickText.removeWhitespace(text)), label));
  }
}
