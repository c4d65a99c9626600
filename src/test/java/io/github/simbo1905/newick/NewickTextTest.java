// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package io.github.simbo1905.newick;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/// Label and branch length transforms, checked through the public [Phylo] entry points
class NewickTextTest {

  static final String NEWICK_STANDARD = """
      (
          (
              oryza_sativa:0.1,
              hordeum_vulgare:0.2
          )bep:0.3,
          panicum_hallii_fil2:0.4
      )poaceae:0.5;""";

  static final String NEWICK = Phylo.removeWhitespace(NEWICK_STANDARD);
  static final String XLENGTH = Phylo.removeLengths(NEWICK);
  static final String POPULAR = Phylo.removeInnerNames(NEWICK);
  static final String XLENGTH_TIPS = Phylo.removeInnerNames(XLENGTH);
  static final String SHORT = Phylo.shortenNames(NEWICK);
  static final String XLENGTH_SHORT_TIPS = Phylo.shortenNames(XLENGTH_TIPS);

  static final List<String> TIP_NAMES = List.of("oryza_sativa", "hordeum_vulgare", "panicum_hallii_fil2");
  static final List<String> INNER_NAMES = List.of("bep", "poaceae");
  static final List<String> NAMES = List.of("oryza_sativa", "hordeum_vulgare", "bep", "panicum_hallii_fil2", "poaceae");
  static final List<String> SHORT_NAMES = List.of("osat", "hvul", "bep", "phal", "poaceae");
  static final List<String> SHORT_TIP_NAMES = List.of("osat", "hvul", "phal");

  @BeforeAll
  static void setupLogging() {
    io.github.simbo1905.LoggingControl.setupCleanLogging();
  }

  @Test
  void removeWhitespace() {
    assertEquals("((A,B),C);", Phylo.removeWhitespace(" ( (A , \t B),\n    C) ;\n "));
    assertEquals("((oryza_sativa:0.1,hordeum_vulgare:0.2)bep:0.3,panicum_hallii_fil2:0.4)poaceae:0.5;", NEWICK);
  }

  @Test
  void extractLengths() {
    assertEquals(List.of(0.1, 0.2, 0.3, 0.4, 0.5), Phylo.extractLengths(NEWICK_STANDARD));
    assertEquals(List.of(0.1, 0.2, 0.3, 0.4, 0.5), Phylo.extractLengths(NEWICK));
    assertEquals(List.of(), Phylo.extractLengths(XLENGTH));
    assertEquals(List.of(-1.0, 0.001), Phylo.extractLengths("(A:-1,B:1e-3);"));
  }

  @Test
  void extractLengthsRejectsNonNumbers() {
    final var e = assertThrows(NewickParseException.class, () -> Phylo.extractLengths("(A:1,B:two);"));
    assertEquals(7, e.position());
  }

  @Test
  void removeLengths() {
    assertEquals("((oryza_sativa,hordeum_vulgare)bep,panicum_hallii_fil2)poaceae;", XLENGTH);
    assertEquals(XLENGTH, Phylo.removeLengths(XLENGTH));
    assertEquals(XLENGTH_TIPS, Phylo.removeLengths(POPULAR));
    assertEquals("((osat,hvul),phal);", Phylo.removeLengths(XLENGTH_SHORT_TIPS));
  }

  @Test
  void extractNamesFollowsTokenOrder() {
    assertEquals(NAMES, Phylo.extractNames(NEWICK_STANDARD));
    assertEquals(NAMES, Phylo.extractNames(XLENGTH));
    assertEquals(TIP_NAMES, Phylo.extractNames(POPULAR));
    assertEquals(TIP_NAMES, Phylo.extractNames(XLENGTH_TIPS));
    assertEquals(SHORT_NAMES, Phylo.extractNames(SHORT));
    assertEquals(SHORT_TIP_NAMES, Phylo.extractNames(XLENGTH_SHORT_TIPS));
  }

  @Test
  void extractTipNames() {
    assertEquals(TIP_NAMES, Phylo.extractTipNames(NEWICK_STANDARD));
    assertEquals(TIP_NAMES, Phylo.extractTipNames(XLENGTH));
    assertEquals(TIP_NAMES, Phylo.extractTipNames(POPULAR));
    assertEquals(TIP_NAMES, Phylo.extractTipNames(XLENGTH_TIPS));
    assertEquals(SHORT_TIP_NAMES, Phylo.extractTipNames(SHORT));
    assertEquals(SHORT_TIP_NAMES, Phylo.extractTipNames(XLENGTH_SHORT_TIPS));
  }

  @Test
  void extractInnerNames() {
    assertEquals(INNER_NAMES, Phylo.extractInnerNames(NEWICK_STANDARD));
    assertEquals(INNER_NAMES, Phylo.extractInnerNames(XLENGTH));
    assertEquals(List.of(), Phylo.extractInnerNames(POPULAR));
    assertEquals(List.of(), Phylo.extractInnerNames(XLENGTH_TIPS));
    assertEquals(INNER_NAMES, Phylo.extractInnerNames(SHORT));
    assertEquals(List.of(), Phylo.extractInnerNames(XLENGTH_SHORT_TIPS));
  }

  @Test
  void tipAndInnerNamesNeedParsableText() {
    assertThrows(NewickParseException.class, () -> Phylo.extractTipNames("((A,B),C"));
  }

  @Test
  void removeInner() {
    assertEquals("((oryza_sativa:0.1,hordeum_vulgare:0.2):0.3,panicum_hallii_fil2:0.4):0.5;", POPULAR);
    assertEquals("((oryza_sativa,hordeum_vulgare),panicum_hallii_fil2);", XLENGTH_TIPS);
    assertEquals("((osat,hvul),phal);", XLENGTH_SHORT_TIPS);
    assertEquals(XLENGTH_TIPS, Phylo.removeInner(XLENGTH));
    assertEquals(XLENGTH_TIPS, Phylo.removeInnerNames(XLENGTH));
    assertEquals(POPULAR, Phylo.removeInnerNames(POPULAR));
    assertEquals(POPULAR, Phylo.removeInner(NEWICK));
    assertEquals(XLENGTH_TIPS, Phylo.removeInner(XLENGTH_TIPS));
    assertEquals(XLENGTH_SHORT_TIPS, Phylo.removeInner(XLENGTH_SHORT_TIPS));
  }

  @Test
  void removeInnerKeepsALabelledTipRoot() {
    assertEquals("A:1;", Phylo.removeInner("A:1;"));
    assertEquals("A:1;", Phylo.removeInnerNames("A:1;"));
  }

  @Test
  void shortenNames() {
    assertEquals("((osat:0.1,hvul:0.2)bep:0.3,phal:0.4)poaceae:0.5;", SHORT);
    assertEquals(SHORT, Phylo.shortenNames(SHORT));
    assertEquals("((osat,hvul),phal);", XLENGTH_SHORT_TIPS);
    assertEquals(XLENGTH_SHORT_TIPS, Phylo.shortenNames(XLENGTH_TIPS));
    assertEquals(XLENGTH_SHORT_TIPS, Phylo.shortenNames(XLENGTH_SHORT_TIPS));
  }

  @Test
  void shorten() {
    assertEquals("osat", Phylo.shorten("Oryza_sativa"));
    assertEquals("phal", Phylo.shorten("Panicum_hallii_fil2"));
    assertEquals("hvul", Phylo.shorten("hordeum_vulgare"));
    assertThatIllegal("poaceae");
    assertThatIllegal("Oryza_sa");
    assertThatIllegal("osat");
  }

  private static void assertThatIllegal(String name) {
    assertThat(assertThrows(IllegalArgumentException.class, () -> Phylo.shorten(name)))
        .hasMessageContaining(name);
  }

  @Test
  void lengthsNeverChangeNameOrder() {
    for (var text : List.of(NEWICK, POPULAR, SHORT, "((((A:1,B:2):3,(C,D)cd:4),(E,(F,G):1)),H)x:2;")) {
      assertEquals(Phylo.extractNames(text), Phylo.extractNames(Phylo.removeLengths(text)), text);
    }
  }

  @Test
  void transformsAreIdempotent() {
    for (var text : List.of(NEWICK, XLENGTH, POPULAR, SHORT, "(Zea_mays:1,(Sorghum_bicolor,osat)x)y;")) {
      final String noInner = Phylo.removeInnerNames(text);
      assertEquals(noInner, Phylo.removeInnerNames(noInner), text);
      final String shortened = Phylo.shortenNames(text);
      assertEquals(shortened, Phylo.shortenNames(shortened), text);
      final String noLengths = Phylo.removeLengths(text);
      assertEquals(noLengths, Phylo.removeLengths(noLengths), text);
    }
  }

  @Test
  void shortenNamesShortensPaddedLabelsAndKeepsThePadding() {
    assertEquals("( osat ,B);", Phylo.shortenNames("( Oryza_sativa ,B);"));
    assertEquals("(\n  osat:0.1,hvul);", Phylo.shortenNames("(\n  Oryza_sativa:0.1,hordeum_vulgare);"));
  }

  @Test
  void shortenNamesLeavesPunctuationAndLengthsAlone() {
    assertEquals("(zmay:1,(sbic,osat)x)y;", Phylo.shortenNames("(Zea_mays:1,(Sorghum_bicolor,osat)x)y;"));
  }
}
