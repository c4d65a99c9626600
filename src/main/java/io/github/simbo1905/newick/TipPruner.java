// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static io.github.simbo1905.newick.Phylo.LOGGER;

/// Reduces a tree to the subtree induced by a set of tips.
///
/// Branches holding none of the wanted tips are dropped. A node left with a single child is replaced by that child,
/// so the spliced node's own label and length disappear. Surviving tips keep their left-to-right order.
final class TipPruner {

  private TipPruner() {
  }

  static Node prune(Node root, Collection<String> tips) {
    Objects.requireNonNull(root, "Root node must not be null");
    Objects.requireNonNull(tips, "Tips must not be null");
    if (tips.isEmpty()) {
      throw new IllegalArgumentException("At least one tip must be requested");
    }
    final Set<String> wanted = new LinkedHashSet<>(tips);
    final Set<String> present = new HashSet<>(TreeWalk.tipLabels(root));
    final List<String> missing = wanted.stream().filter(tip -> !present.contains(tip)).toList();
    if (!missing.isEmpty()) {
      final var e = new NewickNotFoundException("Requested tips are not in the tree", missing);
      LOGGER.warning(e::getMessage);
      throw e;
    }
    // every wanted tip is present so the root always survives
    final Node pruned = keep(root, wanted).orElseThrow();
    LOGGER.fine(() -> "Pruned tree to " + wanted.size() + " tips");
    return pruned;
  }

  static String prune(String text, Collection<String> tips) {
    return NewickWriter.write(prune(NewickParser.parse(NewickText.removeWhitespace(text)), tips));
  }

  private static Optional<Node> keep(Node node, Set<String> wanted) {
    if (node.isTip()) {
      return wanted.contains(node.label()) ? Optional.of(node) : Optional.empty();
    }
    final List<Node> survivors = new ArrayList<>(node.children().size());
    for (var child : node.children()) {
      keep(child, wanted).ifPresent(survivors::add);
    }
    return switch (survivors.size()) {
      case 0 -> Optional.empty();
      case 1 -> Optional.of(survivors.get(0));
      default -> Optional.of(node.withChildren(survivors));
    };
  }
}
