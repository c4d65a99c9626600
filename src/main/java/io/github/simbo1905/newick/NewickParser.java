// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.newick.Phylo.LOGGER;

/// Recursive descent parser for whitespace-free Newick text. The tree is built bottom-up as each subtree closes.
///
/// ```
/// tree    := subtree ';'
/// subtree := clade | leaf
/// clade   := '(' subtree (',' subtree)* ')' label? length?
/// leaf    := label length?
/// length  := ':' number
/// ```
///
/// An instance holds the cursor for exactly one parse and is thrown away afterwards.
final class NewickParser {

  /// Set via system property `newick.parser.maxDepth`
  static final int MAX_DEPTH = Integer.getInteger("newick.parser.maxDepth", 1024);

  private final String text;
  private int position;
  private int depth;

  private NewickParser(String text) {
    this.text = text;
  }

  static Node parse(String text) {
    Objects.requireNonNull(text, "Newick text must not be null");
    final var parser = new NewickParser(text);
    if (text.isEmpty()) {
      throw parser.error("Empty input where a tree is required");
    }
    final Node root = parser.subtree();
    parser.expectTerminator();
    LOGGER.finer(() -> "Parsed " + text.length() + " characters into tree rooted at '" + root.label() + "'");
    return root;
  }

  private Node subtree() {
    if (peek() == '(') {
      return clade();
    }
    final String label = label();
    return new Node(label, length(), List.of());
  }

  private Node clade() {
    if (++depth > MAX_DEPTH) {
      throw error("Tree is nested deeper than " + MAX_DEPTH + " levels");
    }
    position++; // '('
    final List<Node> children = new ArrayList<>();
    children.add(subtree());
    while (peek() == ',') {
      position++;
      children.add(subtree());
    }
    if (peek() != ')') {
      if (atEnd() || peek() == ';') {
        throw error("Unbalanced parentheses: expected ')'");
      }
      throw error("Unexpected character '" + text.charAt(position) + "' inside clade");
    }
    position++;
    depth--;
    final String label = label();
    return new Node(label, length(), children);
  }

  private String label() {
    final int start = position;
    while (!atEnd() && !Node.isStructural(text.charAt(position)) && !Character.isWhitespace(text.charAt(position))) {
      position++;
    }
    return text.substring(start, position);
  }

  /// Returns the branch length exactly as written so that serialization reproduces it byte for byte
  private String length() {
    if (peek() != ':') {
      return null;
    }
    position++;
    final int start = position;
    while (!atEnd() && !Node.isStructural(text.charAt(position))) {
      position++;
    }
    final String token = text.substring(start, position);
    if (!Node.isNumber(token)) {
      throw error("Invalid branch length '" + token + "'", start);
    }
    return token;
  }

  private void expectTerminator() {
    if (atEnd()) {
      throw error("Missing terminating ';'");
    }
    final char c = text.charAt(position);
    switch (c) {
      case ';' -> {
        if (position != text.length() - 1) {
          throw error("Trailing characters after ';'", position + 1);
        }
      }
      case ')' -> throw error("Unbalanced parentheses: unexpected ')'");
      case ',' -> throw error("',' outside of any enclosing parentheses");
      default -> throw error("Unexpected character '" + c + "'");
    }
  }

  private char peek() {
    return atEnd() ? '\0' : text.charAt(position);
  }

  private boolean atEnd() {
    return position >= text.length();
  }

  private NewickParseException error(String message) {
    return error(message, position);
  }

  private NewickParseException error(String message, int at) {
    final var e = new NewickParseException(message, text, at);
    LOGGER.warning(e::getMessage);
    return e;
  }
}
