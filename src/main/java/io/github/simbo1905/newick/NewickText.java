// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.github.simbo1905.newick.Phylo.LOGGER;

/// Transforms that work directly on Newick text without building a tree. Each one leaves every character it
/// does not target exactly as it was.
final class NewickText {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /// `:` followed by the length token, which runs up to the next punctuation
  private static final Pattern LENGTH = Pattern.compile(":([^,();:]*)");

  /// A label token: a run of non-punctuation after the start of text or after `(`, `)` or `,`.
  /// Length tokens are excluded because they follow `:`.
  private static final Pattern LABEL = Pattern.compile("(?<=^|[(),])[^(),:;]+");

  /// A clade label directly after a closing parenthesis
  private static final Pattern INNER_LABEL = Pattern.compile("\\)[^(),:;]+");

  private NewickText() {
  }

  static String removeWhitespace(String text) {
    Objects.requireNonNull(text, "Newick text must not be null");
    return WHITESPACE.matcher(text).replaceAll("");
  }

  /// Whitespace is removed first, so padded text gives the same answer as normalized text
  static List<Double> extractLengths(String raw) {
    final String text = removeWhitespace(raw);
    final List<Double> lengths = new ArrayList<>();
    final Matcher m = LENGTH.matcher(text);
    while (m.find()) {
      final String token = m.group(1);
      if (!Node.isNumber(token)) {
        final var e = new NewickParseException("Invalid branch length '" + token + "'", text, m.start(1));
        LOGGER.warning(e::getMessage);
        throw e;
      }
      lengths.add(Double.valueOf(token));
    }
    return lengths;
  }

  static String removeLengths(String text) {
    Objects.requireNonNull(text, "Newick text must not be null");
    return LENGTH.matcher(text).replaceAll("");
  }

  static List<String> extractNames(String raw) {
    final String text = removeWhitespace(raw);
    final List<String> names = new ArrayList<>();
    final Matcher m = LABEL.matcher(text);
    while (m.find()) {
      names.add(m.group());
    }
    return names;
  }

  static String removeInnerNames(String text) {
    Objects.requireNonNull(text, "Newick text must not be null");
    return INNER_LABEL.matcher(text).replaceAll(")");
  }

  /// Rewrites every label token through the function, leaving punctuation and lengths alone
  static String mapLabels(String text, UnaryOperator<String> function) {
    final Matcher m = LABEL.matcher(text);
    final StringBuilder sb = new StringBuilder(text.length());
    while (m.find()) {
      m.appendReplacement(sb, Matcher.quoteReplacement(function.apply(m.group())));
    }
    m.appendTail(sb);
    return sb.toString();
  }
}
