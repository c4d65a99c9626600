// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

import java.io.PrintStream;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/// Entry point for working with phylogenetic trees written in Newick notation.
///
/// Every operation is a pure function of its arguments: nothing here touches files, the network or shared state,
/// so all of it may be called concurrently. Text rewrites leave every character they do not target untouched.
/// Operations that extract labels or lengths, or that need the tree structure, remove whitespace first;
/// [#parseNewick] itself expects whitespace-free text.
/// Malformed input fails with [NewickParseException] and a missing clade or tip with [NewickNotFoundException].
public interface Phylo {

  Logger LOGGER = Logger.getLogger(Phylo.class.getName());

  /// Width used when none is given. Set via system property `newick.graph.width`.
  int DEFAULT_GRAPH_WIDTH = Integer.getInteger("newick.graph.width", 1);

  /// Parse whitespace-free Newick text terminated by `;`
  /// @param text the Newick text
  /// @return the root of the tree
  static Node parseNewick(String text) {
    return NewickParser.parse(text);
  }

  /// Write a tree back to canonical Newick text ending in `;`
  /// @param root the root of the tree
  /// @return the Newick text, byte-identical to the parsed input when that input was canonical
  static String newickize(Node root) {
    return NewickWriter.write(root);
  }

  /// Remove every whitespace character, including line breaks and tabs
  static String removeWhitespace(String text) {
    return NewickText.removeWhitespace(text);
  }

  /// Branch lengths in the order their `:` tokens appear
  static List<Double> extractLengths(String text) {
    return NewickText.extractLengths(text);
  }

  static String removeLengths(String text) {
    return NewickText.removeLengths(text);
  }

  /// All non-empty labels, tips and clades alike, in the order they appear in the text
  static List<String> extractNames(String text) {
    return NewickText.extractNames(text);
  }

  static List<String> extractTipNames(String text) {
    return TreeWalk.tipLabels(normalizedTree(text));
  }

  static List<String> extractInnerNames(String text) {
    return TreeWalk.innerLabels(normalizedTree(text));
  }

  /// Drop the labels of all nodes with children by rebuilding the parsed tree
  static String removeInner(String text) {
    return NewickWriter.write(TreeWalk.withoutInnerLabels(normalizedTree(text)));
  }

  /// Drop the labels of all nodes with children by editing the text in place
  static String removeInnerNames(String text) {
    return NewickText.removeInnerNames(text);
  }

  /// `Oryza_sativa` becomes `osat`
  static String shorten(String name) {
    return SpeciesNames.shorten(name);
  }

  static String shortenNames(String text) {
    return SpeciesNames.shortenNames(text);
  }

  /// The subtree rooted at the node labelled `label`, with that node's own label and length, ending in `;`
  static String selectClade(String text, String label) {
    return CladeSelector.select(text, label);
  }

  /// The subtree induced by `tips`, with nodes left holding a single child spliced out
  /// @throws NewickNotFoundException if any requested tip is not in the tree
  static String selectTips(String text, Collection<String> tips) {
    return TipPruner.prune(text, tips);
  }

  /// Render the tree as a box-drawing diagram. The trailing `;` may be omitted.
  /// @param width 1 for the labelled layout, larger for the compact layout with longer branches
  static String graph(String text, int width) {
    return AsciiRenderer.format(NewickParser.parse(terminated(NewickText.removeWhitespace(text))), width);
  }

  static String graph(String text) {
    return graph(text, DEFAULT_GRAPH_WIDTH);
  }

  /// Write the diagram to standard output encoded as UTF-8 whatever the platform encoding
  static void printGraph(String text, int width) {
    printGraph(text, width, AsciiRenderer.STDOUT);
  }

  static void printGraph(String text, int width, PrintStream out) {
    out.print(graph(text, width));
    out.flush();
  }

  static void printGraph(String text) {
    printGraph(text, DEFAULT_GRAPH_WIDTH);
  }

  /// Newick text of a clade in the built-in [CladeTable#PLANTS] table
  static String newick(String clade) {
    return CladeTable.PLANTS.newick(clade);
  }

  /// Every species in the built-in table, in first-seen order
  static List<String> listSpecies() {
    return CladeTable.PLANTS.listSpecies();
  }

  static List<String> listSpecies(String clade) {
    return CladeTable.PLANTS.listSpecies(clade);
  }

  static Optional<String> lengthen(String code) {
    return CladeTable.PLANTS.lengthen(code);
  }

  /// Clade identifiers ordered by the length of their Newick text in the built-in table
  static List<String> sortedByLenNewicks(Collection<String> clades, boolean reverse) {
    return CladeTable.PLANTS.sortedByLength(clades, reverse);
  }

  private static Node normalizedTree(String text) {
    return NewickParser.parse(NewickText.removeWhitespace(text));
  }

  private static String terminated(String text) {
    return text.endsWith(";") ? text : text + ";";
  }
}
