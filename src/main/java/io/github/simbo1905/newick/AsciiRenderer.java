// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static java.nio.charset.StandardCharsets.UTF_8;

/// Draws a tree with Unicode box-drawing characters, depth first.
///
/// Width 1 gives the labelled layout where every node, inner nodes included, sits on its own line:
/// ```
///  root
/// ├─ one
/// └─ anc
///   ├─ two
///   └─ three
/// ```
/// Any larger width gives the compact layout. Inner labels are dropped and a node's first child continues on the
/// node's own line. Branches to all but the last child are stretched to `2 * width - 3` dashes, and the stretch
/// shrinks by one width step per level:
/// ```
/// ┬───── one
/// └─┬─── two
///   └─ three
/// ```
final class AsciiRenderer {

  /// Standard output as UTF-8; `System.out` uses the platform encoding and turns box-drawing characters into `?`
  static final PrintStream STDOUT = new PrintStream(new FileOutputStream(FileDescriptor.out), true, UTF_8);

  private AsciiRenderer() {
  }

  static List<String> render(Node root, int width) {
    Objects.requireNonNull(root, "Root node must not be null");
    if (width < 1) {
      throw new IllegalArgumentException("Graph width must be at least 1 but was " + width);
    }
    return width == 1 ? labelled(root) : compact(root, width);
  }

  static String format(Node root, int width) {
    final var sb = new StringBuilder();
    for (var line : render(root, width)) {
      sb.append(line).append('\n');
    }
    return sb.toString();
  }

  private static List<String> labelled(Node node) {
    final List<String> lines = new ArrayList<>();
    lines.add(" " + node.label());
    final var children = node.children();
    for (int i = 0; i < children.size(); i++) {
      final boolean last = i == children.size() - 1;
      indent(lines, labelled(children.get(i)), last ? "└─" : "├─", last ? "  " : "│ ");
    }
    return lines;
  }

  private static List<String> compact(Node node, int width) {
    if (node.isTip()) {
      return new ArrayList<>(List.of(" " + node.label()));
    }
    final List<String> lines = new ArrayList<>();
    final var children = node.children();
    final int stretched = Math.max(1, 2 * width - 3);
    for (int i = 0; i < children.size(); i++) {
      final boolean first = i == 0;
      final boolean last = i == children.size() - 1;
      final int dashes = last ? 1 : stretched;
      final char glyph = first && last ? '─' : first ? '┬' : last ? '└' : '├';
      indent(lines, compact(children.get(i), width - 1),
          glyph + "─".repeat(dashes),
          (last ? " " : "│") + " ".repeat(dashes));
    }
    return lines;
  }

  /// Appends the child's lines: the first behind the branch, the rest behind the continuation
  private static void indent(List<String> lines, List<String> child, String branch, String continuation) {
    lines.add(branch + child.get(0));
    for (int i = 1; i < child.size(); i++) {
      lines.add(continuation + child.get(i));
    }
  }
}
