// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static io.github.simbo1905.newick.Phylo.LOGGER;

/// An immutable table of named clades, each mapped to normalized Newick text.
///
/// Entries keep their insertion order. Lookups of unknown identifiers fail with [NewickNotFoundException].
public final class CladeTable {

  /// Species as named by Ensembl Plants, grouped along the grass and monocot phylogeny
  public static final CladeTable PLANTS;

  static {
    final String bep = "((oryza_sativa,leersia_perrieri)oryzoideae,(brachypodium_distachyon,"
        + "(hordeum_vulgare,(aegilops_tauschii,triticum_aestivum))triticeae)pooideae)bep;";
    final String pacmad = "((sorghum_bicolor,zea_mays)andropogoneae,(setaria_italica,panicum_hallii_fil2)paniceae)pacmad;";
    final String poaceae = "(" + body(bep) + "," + body(pacmad) + ")poaceae;";
    final String commelinids = "(" + body(poaceae) + ",musa_acuminata)commelinids;";
    final String monocot = "(" + body(commelinids) + ",dioscorea_rotundata)monocot;";
    final Map<String, String> newicks = new LinkedHashMap<>();
    newicks.put("bep", bep);
    newicks.put("pacmad", pacmad);
    newicks.put("poaceae", poaceae);
    newicks.put("commelinids", commelinids);
    newicks.put("monocot", monocot);
    PLANTS = of(newicks);
  }

  private final Map<String, String> newicks;

  private CladeTable(Map<String, String> newicks) {
    this.newicks = newicks;
  }

  /// Builds a table from caller supplied entries. Whitespace is removed and every entry must parse.
  public static CladeTable of(Map<String, String> newicks) {
    Objects.requireNonNull(newicks, "Clade map must not be null");
    final Map<String, String> normalized = new LinkedHashMap<>();
    newicks.forEach((clade, newick) -> {
      Objects.requireNonNull(clade, "Clade identifier must not be null");
      Objects.requireNonNull(newick, () -> "Newick text must not be null for clade " + clade);
      final String text = NewickText.removeWhitespace(newick);
      NewickParser.parse(text);
      normalized.put(clade, text);
    });
    LOGGER.fine(() -> "Clade table holds " + normalized.keySet());
    return new CladeTable(Collections.unmodifiableMap(normalized));
  }

  public Set<String> clades() {
    return newicks.keySet();
  }

  public String newick(String clade) {
    Objects.requireNonNull(clade, "Clade identifier must not be null");
    final String text = newicks.get(clade);
    if (text == null) {
      final var e = new NewickNotFoundException("Unknown clade", List.of(clade));
      LOGGER.warning(e::getMessage);
      throw e;
    }
    return text;
  }

  /// Tip names of the clade in tree order
  public List<String> listSpecies(String clade) {
    return TreeWalk.tipLabels(NewickParser.parse(newick(clade)));
  }

  /// Every species in the table in first-seen order
  public List<String> listSpecies() {
    final var seen = new LinkedHashSet<String>();
    for (var clade : newicks.keySet()) {
      seen.addAll(listSpecies(clade));
    }
    return List.copyOf(seen);
  }

  /// The full species name whose four-letter code is `code`, if the table knows one
  public Optional<String> lengthen(String code) {
    Objects.requireNonNull(code, "Species code must not be null");
    return listSpecies().stream()
        .filter(SpeciesNames::isSpeciesName)
        .filter(name -> SpeciesNames.shorten(name).equals(code))
        .findFirst();
  }

  /// Orders clade identifiers by the length of their Newick text. Equal lengths keep the given order.
  public List<String> sortedByLength(Collection<String> clades, boolean reverse) {
    Objects.requireNonNull(clades, "Clades must not be null");
    final List<String> sorted = new ArrayList<>(clades);
    Comparator<String> byLength = Comparator.comparingInt(clade -> newick(clade).length());
    sorted.sort(reverse ? byLength.reversed() : byLength);
    return sorted;
  }

  private static String body(String newick) {
    return newick.substring(0, newick.length() - 1);
  }
}
