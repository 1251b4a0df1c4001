package com.spotify.wff;

import static com.spotify.wff.FormulaAnalyzer.Classification.CONTINGENCY;
import static com.spotify.wff.FormulaAnalyzer.Classification.CONTRADICTION;
import static com.spotify.wff.FormulaAnalyzer.Classification.TAUTOLOGY;
import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class FormulaAnalyzerTest {

  static Stream<Formula> samples() {
    return SampleFormulas.formulas();
  }

  @Test
  public void testTautologies() {
    assertThat(FormulaAnalyzer.isTautology(Wff.parse("p OR (NOT p)"))).isTrue();
    assertThat(FormulaAnalyzer.isTautology(Wff.parse("(p -> q) & (q -> r) -> (p -> r)")))
        .isTrue();
    assertThat(FormulaAnalyzer.isTautology(Wff.parse("NOT (p OR q) IFF (NOT p AND NOT q)")))
        .isTrue();
    assertThat(FormulaAnalyzer.isTautology(Formula.TRUE)).isTrue();
    assertThat(FormulaAnalyzer.isTautology(Wff.parse("p IMPLIES q"))).isFalse();
  }

  @Test
  public void testSatisfiability() {
    assertThat(FormulaAnalyzer.isSatisfiable(Wff.parse("p AND (NOT p)"))).isFalse();
    assertThat(FormulaAnalyzer.isContradiction(Wff.parse("p AND (NOT p)"))).isTrue();
    assertThat(FormulaAnalyzer.isSatisfiable(Wff.parse("p AND NOT q"))).isTrue();
    assertThat(FormulaAnalyzer.isSatisfiable(Formula.FALSE)).isFalse();
  }

  @Test
  public void testClassification() {
    assertThat(FormulaAnalyzer.classify(Wff.parse("p OR NOT p"))).isEqualTo(TAUTOLOGY);
    assertThat(FormulaAnalyzer.classify(Wff.parse("p IFF NOT p"))).isEqualTo(CONTRADICTION);
    assertThat(FormulaAnalyzer.classify(Wff.parse("p AND q"))).isEqualTo(CONTINGENCY);
    assertThat(FormulaAnalyzer.classify(Formula.FALSE)).isEqualTo(CONTRADICTION);
    assertThat(FormulaAnalyzer.isContingent(Wff.parse("p OR q"))).isTrue();
    assertThat(FormulaAnalyzer.isContingent(Wff.parse("p OR TRUE"))).isFalse();
  }

  @Test
  public void testEquivalence() {
    assertThat(FormulaAnalyzer.areEquivalent(Wff.parse("p IMPLIES q"), Wff.parse("(NOT p) OR q")))
        .isTrue();
    assertThat(FormulaAnalyzer.areEquivalent(Wff.parse("p IMPLIES q"), Wff.parse("q IMPLIES p")))
        .isFalse();
    assertThat(FormulaAnalyzer.areEquivalent(Wff.parse("p"), Wff.parse("q"))).isFalse();
  }

  @Test
  public void testEquivalenceOverUnionOfAtoms() {
    assertThat(FormulaAnalyzer.areEquivalent(Wff.parse("p"), Wff.parse("p AND (q OR NOT q)")))
        .isTrue();
    assertThat(FormulaAnalyzer.areEquivalent(Wff.parse("r OR NOT r"), Formula.TRUE)).isTrue();
    assertThat(FormulaAnalyzer.areEquivalent(Wff.parse("p"), Wff.parse("p AND q"))).isFalse();
  }

  @Test
  public void testEntailment() {
    assertThat(FormulaAnalyzer.entails(Wff.parse("p AND q"), Wff.parse("p"))).isTrue();
    assertThat(FormulaAnalyzer.entails(Wff.parse("p"), Wff.parse("p AND q"))).isFalse();
    assertThat(FormulaAnalyzer.entails(Wff.parse("p AND (p -> q)"), Wff.parse("q"))).isTrue();
    assertThat(FormulaAnalyzer.entails(Formula.FALSE, Wff.parse("q"))).isTrue();
  }

  @Test
  public void testSatisfyingAssignmentIsFirstInOrder() {
    assertThat(FormulaAnalyzer.satisfyingAssignment(Wff.parse("p OR q")))
        .contains(Assignment.of("p", false, "q", true));
    assertThat(FormulaAnalyzer.satisfyingAssignment(Wff.parse("p AND NOT q")))
        .contains(Assignment.of("p", true, "q", false));
    assertThat(FormulaAnalyzer.satisfyingAssignment(Wff.parse("p AND NOT p"))).isEmpty();
    assertThat(FormulaAnalyzer.satisfyingAssignment(Formula.TRUE)).contains(Assignment.empty());
  }

  @Test
  public void testModels() {
    final List<Assignment> models =
        ImmutableList.copyOf(FormulaAnalyzer.models(Wff.parse("p OR q")));

    assertThat(models)
        .containsExactly(
            Assignment.of("p", false, "q", true),
            Assignment.of("p", true, "q", false),
            Assignment.of("p", true, "q", true));
  }

  @ParameterizedTest
  @MethodSource("samples")
  public void testTautologyIffNegationIsContradiction(Formula formula) {
    assertThat(FormulaAnalyzer.isTautology(formula))
        .isEqualTo(FormulaAnalyzer.isContradiction(Formula.not(formula)));
  }

  @ParameterizedTest
  @MethodSource("samples")
  public void testClassificationAgreesWithQueries(Formula formula) {
    final FormulaAnalyzer.Classification classification = FormulaAnalyzer.classify(formula);

    assertThat(classification == TAUTOLOGY).isEqualTo(FormulaAnalyzer.isTautology(formula));
    assertThat(classification == CONTRADICTION)
        .isEqualTo(FormulaAnalyzer.isContradiction(formula));
  }

  @Test
  public void testEquivalenceIsReflexiveAndSymmetric() {
    final List<Formula> formulas = SampleFormulas.formulas().collect(Collectors.toList());
    for (Formula first : formulas) {
      assertThat(FormulaAnalyzer.areEquivalent(first, first)).as("%s", first).isTrue();
      for (Formula second : formulas) {
        assertThat(FormulaAnalyzer.areEquivalent(first, second))
            .as("%s and %s", first, second)
            .isEqualTo(FormulaAnalyzer.areEquivalent(second, first));
      }
    }
  }
}
