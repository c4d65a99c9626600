// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.github.simbo1905.newick.Phylo.LOGGER;

/// Four-letter species codes such as `osat` for `Oryza_sativa`.
final class SpeciesNames {

  /// `Genus_species[_qualifier...]` where the genus may be capitalised or, as in Ensembl, all lowercase
  static final Pattern SPECIES = Pattern.compile("([A-Za-z])[a-z]*_([a-z]{3})[a-z]*(?:_[A-Za-z0-9.]+)*");

  private SpeciesNames() {
  }

  static boolean isSpeciesName(String name) {
    return SPECIES.matcher(name).matches();
  }

  static String shorten(String name) {
    Objects.requireNonNull(name, "Species name must not be null");
    final Matcher m = SPECIES.matcher(name);
    if (!m.matches()) {
      final String msg = "Not a Genus_species name: '" + name + "'";
      LOGGER.warning(() -> msg);
      throw new IllegalArgumentException(msg);
    }
    return (m.group(1) + m.group(2)).toLowerCase(Locale.ROOT);
  }

  /// Shortens the labels that look like species names. Codes and clade names pass through, so this is idempotent.
  static String shortenNames(String text) {
    Objects.requireNonNull(text, "Newick text must not be null");
    return NewickText.mapLabels(text, SpeciesNames::shortenLabel);
  }

  /// Padding around a label is kept as it was and only the name inside it is shortened
  private static String shortenLabel(String label) {
    final String name = label.strip();
    if (!isSpeciesName(name)) {
      return label;
    }
    final int at = label.indexOf(name);
    return label.substring(0, at) + shorten(name) + label.substring(at + name.length());
  }
}
