// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

import java.util.Objects;

/// Writes a tree as canonical Newick text. The output is the exact inverse of [NewickParser] on canonical input
/// because branch lengths are emitted using the text they were parsed from.
final class NewickWriter {

  private NewickWriter() {
  }

  static String write(Node root) {
    Objects.requireNonNull(root, "Root node must not be null");
    final var sb = new StringBuilder();
    append(root, sb);
    return sb.append(';').toString();
  }

  private static void append(Node node, StringBuilder sb) {
    if (!node.isTip()) {
      sb.append('(');
      for (int i = 0; i < node.children().size(); ++i) {
        if (i > 0) {
          sb.append(',');
        }
        append(node.children().get(i), sb);
      }
      sb.append(')');
    }
    sb.append(node.label());
    if (node.length() != null) {
      sb.append(':').append(node.length());
    }
  }
}
