// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/// Order-preserving traversals over a parsed tree.
///
/// Labels are visited children-first, which is the order their tokens appear in Newick text: a clade's label
/// follows its closing parenthesis.
final class TreeWalk {

  private TreeWalk() {
  }

  /// Non-empty labels of the nodes accepted by the filter, in textual order
  static List<String> labels(Node root, Predicate<Node> filter) {
    final List<String> out = new ArrayList<>();
    collect(root, filter, out);
    return out;
  }

  static List<String> tipLabels(Node root) {
    return labels(root, Node::isTip);
  }

  static List<String> innerLabels(Node root) {
    return labels(root, node -> !node.isTip());
  }

  private static void collect(Node node, Predicate<Node> filter, List<String> out) {
    for (var child : node.children()) {
      collect(child, filter, out);
    }
    if (!node.label().isEmpty() && filter.test(node)) {
      out.add(node.label());
    }
  }

  /// A copy of the tree in which every node with children has an empty label. Tips and lengths are kept.
  static Node withoutInnerLabels(Node node) {
    if (node.isTip()) {
      return node;
    }
    final List<Node> children = new ArrayList<>(node.children().size());
    for (var child : node.children()) {
      children.add(withoutInnerLabels(child));
    }
    return new Node("", node.length(), children);
  }

  /// First node in textual order carrying exactly this label, or null
  static Node find(Node node, String label) {
    for (var child : node.children()) {
      final Node found = find(child, label);
      if (found != null) {
        return found;
      }
    }
    return node.label().equals(label) ? node : null;
  }
}
