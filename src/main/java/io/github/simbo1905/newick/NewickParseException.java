// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

/// Thrown when Newick text is malformed. Carries the offending text and the character position at which the
/// problem was detected so that callers can point at it in a diagnostic.
public class NewickParseException extends IllegalArgumentException {

  private final String text;
  private final int position;

  public NewickParseException(String message, String text, int position) {
    super(message + " at position " + position + ": " + excerpt(text, position));
    this.text = text;
    this.position = position;
  }

  public String text() {
    return text;
  }

  public int position() {
    return position;
  }

  /// A short window of the input with a caret marking the position
  static String excerpt(String text, int position) {
    final int from = Math.max(0, position - 20);
    final int to = Math.min(text.length(), position + 20);
    return (from > 0 ? "..." : "") + text.substring(from, position) + "^" + text.substring(position, to)
        + (to < text.length() ? "..." : "");
  }
}
