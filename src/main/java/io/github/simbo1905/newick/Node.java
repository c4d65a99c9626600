// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/// A node of a rooted, ordered phylogenetic tree.
///
/// Each node owns its children outright and holds no reference to its parent, so every algorithm in this
/// package is a top-down walk. Nodes are immutable: transforms build new trees rather than editing old ones.
///
/// @param label    the taxon or clade name, possibly empty but never null
/// @param length   the branch length to the parent exactly as it was written, or null when absent
/// @param children the ordered children, empty for a tip
public record Node(@NotNull String label, @Nullable String length, @NotNull List<Node> children) {

  /// A signed decimal number with an optional exponent, e.g. `0.5`, `-1`, `.25`, `1e-3`
  static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  public Node {
    Objects.requireNonNull(label, "Label must not be null");
    Objects.requireNonNull(children, "Children must not be null");
    if (!isLabel(label)) {
      throw new IllegalArgumentException("Label must not contain Newick punctuation or whitespace: '" + label + "'");
    }
    if (length != null && !isNumber(length)) {
      throw new IllegalArgumentException("Branch length is not a number: '" + length + "'");
    }
    children = List.copyOf(children);
  }

  public static Node tip(String label) {
    return new Node(label, null, List.of());
  }

  public static Node tip(String label, @Nullable String length) {
    return new Node(label, length, List.of());
  }

  public static Node inner(String label, @Nullable String length, List<Node> children) {
    if (children.isEmpty()) {
      throw new IllegalArgumentException("An inner node needs at least one child: '" + label + "'");
    }
    return new Node(label, length, children);
  }

  public boolean isTip() {
    return children.isEmpty();
  }

  /// The branch length as a number, empty when none was written
  public OptionalDouble branchLength() {
    return length == null ? OptionalDouble.empty() : OptionalDouble.of(Double.parseDouble(length));
  }

  /// A copy of this node carrying a different label
  public Node withLabel(String newLabel) {
    return new Node(newLabel, length, children);
  }

  /// A copy of this node carrying different children; the label and length are kept
  public Node withChildren(List<Node> newChildren) {
    return new Node(label, length, newChildren);
  }

  static boolean isStructural(char c) {
    return c == '(' || c == ')' || c == ',' || c == ':' || c == ';';
  }

  static boolean isLabel(String text) {
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (isStructural(c) || Character.isWhitespace(c)) {
        return false;
      }
    }
    return true;
  }

  static boolean isNumber(String text) {
    return NUMBER.matcher(text).matches();
  }
}
