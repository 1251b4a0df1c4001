package com.spotify.wff;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

class FormulaNormalizerTest {

  static Stream<Formula> samples() {
    return SampleFormulas.formulas();
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = ';',
      value = {
        "p; p",
        "NOT (p AND q); (NOT p OR NOT q)",
        "NOT (p OR q); (NOT p AND NOT q)",
        "p IMPLIES q; (NOT p OR q)",
        "NOT (p IMPLIES q); (p AND NOT q)",
        "p IFF q; ((p AND q) OR (NOT p AND NOT q))",
        "NOT (p IFF q); ((p AND NOT q) OR (NOT p AND q))",
        "~~~p; NOT p",
        "NOT NOT (p OR NOT q); (p OR NOT q)",
        "NOT TRUE; FALSE",
        "NOT (p AND FALSE); (NOT p OR TRUE)",
        "NOT ((p IMPLIES q) AND NOT r); ((p AND NOT q) OR r)",
        "p XOR q; ((p AND NOT q) OR (NOT p AND q))",
        "NOT (p XOR q); ((p AND q) OR (NOT p AND NOT q))",
        "p NAND q; (NOT p OR NOT q)",
        "NOT (p NAND q); (p AND q)",
        "p NOR q; (NOT p AND NOT q)",
        "NOT (p NOR q); (p OR q)",
        "NOT (p NAND NOT q); (p AND NOT q)",
      })
  public void testToNnf(String input, String expected) {
    assertThat(Wff.toString(FormulaNormalizer.toNnf(Wff.parse(input)))).isEqualTo(expected);
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = ';',
      value = {
        "p; p",
        "p OR (q AND r); ((p OR q) AND (p OR r))",
        "(q AND r) OR p; ((q OR p) AND (r OR p))",
        "(a AND b) OR (c AND d); (((a OR c) AND (a OR d)) AND ((b OR c) AND (b OR d)))",
        "p IMPLIES q; (NOT p OR q)",
        "NOT (p OR q); (NOT p AND NOT q)",
        "p AND NOT p; FALSE",
        "p OR TRUE; TRUE",
        "(p AND TRUE) OR (q AND r); ((p OR q) AND (p OR r))",
        "p NOR q; (NOT p AND NOT q)",
        "p XOR q; (((p OR NOT p) AND (p OR q)) AND ((NOT q OR NOT p) AND (NOT q OR q)))",
      })
  public void testToCnf(String input, String expected) {
    assertThat(Wff.toString(FormulaNormalizer.toCnf(Wff.parse(input)))).isEqualTo(expected);
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = ';',
      value = {
        "p; p",
        "p AND (q OR r); ((p AND q) OR (p AND r))",
        "(a OR b) AND (c OR d); (((a AND c) OR (a AND d)) OR ((b AND c) OR (b AND d)))",
        "NOT (p AND q); (NOT p OR NOT q)",
        "p IFF q; ((p AND q) OR (NOT p AND NOT q))",
        "p OR NOT p; TRUE",
        "p NAND q; (NOT p OR NOT q)",
        "NOT (p NOR q) AND r; ((p AND r) OR (q AND r))",
      })
  public void testToDnf(String input, String expected) {
    assertThat(Wff.toString(FormulaNormalizer.toDnf(Wff.parse(input)))).isEqualTo(expected);
  }

  @Test
  public void testShapePredicates() {
    assertThat(FormulaNormalizer.isNnf(Wff.parse("(NOT p OR q) AND r"))).isTrue();
    assertThat(FormulaNormalizer.isNnf(Wff.parse("NOT (p OR q)"))).isFalse();
    assertThat(FormulaNormalizer.isNnf(Wff.parse("p IMPLIES q"))).isFalse();
    assertThat(FormulaNormalizer.isNnf(Wff.parse("p XOR q"))).isFalse();
    assertThat(FormulaNormalizer.isNnf(Wff.parse("NOT p NAND q"))).isFalse();
    assertThat(FormulaNormalizer.isCnf(Wff.parse("p NOR q"))).isFalse();

    assertThat(FormulaNormalizer.isCnf(Wff.parse("(p OR NOT q) AND (r OR s OR t) AND u"))).isTrue();
    assertThat(FormulaNormalizer.isCnf(Wff.parse("(p AND q) OR r"))).isFalse();
    assertThat(FormulaNormalizer.isCnf(Wff.parse("p OR (q AND r)"))).isFalse();
    assertThat(FormulaNormalizer.isCnf(Formula.TRUE)).isTrue();

    assertThat(FormulaNormalizer.isDnf(Wff.parse("(p AND NOT q) OR r OR (s AND t)"))).isTrue();
    assertThat(FormulaNormalizer.isDnf(Wff.parse("(p OR q) AND r"))).isFalse();
    assertThat(FormulaNormalizer.isDnf(Wff.parse("NOT NOT p"))).isFalse();
  }

  @Test
  public void testInputIsNotModified() {
    final Formula formula = Wff.parse("NOT (p IFF (q OR r))");
    final Formula copy = Wff.parse("NOT (p IFF (q OR r))");
    FormulaNormalizer.toCnf(formula);
    FormulaNormalizer.toDnf(formula);

    assertThat(formula).isEqualTo(copy);
  }

  @ParameterizedTest
  @MethodSource("samples")
  public void testNnfIsIdempotent(Formula formula) {
    final Formula nnf = FormulaNormalizer.toNnf(formula);

    assertThat(FormulaNormalizer.toNnf(nnf)).isEqualTo(nnf);
  }

  @ParameterizedTest
  @MethodSource("samples")
  public void testNormalFormsHaveTheirShape(Formula formula) {
    assertThat(FormulaNormalizer.isNnf(FormulaNormalizer.toNnf(formula))).isTrue();
    assertThat(FormulaNormalizer.isCnf(FormulaNormalizer.toCnf(formula))).isTrue();
    assertThat(FormulaNormalizer.isDnf(FormulaNormalizer.toDnf(formula))).isTrue();
  }

  @ParameterizedTest
  @MethodSource("samples")
  public void testNormalFormsPreserveMeaning(Formula formula) {
    final Formula nnf = FormulaNormalizer.toNnf(formula);
    final Formula cnf = FormulaNormalizer.toCnf(formula);
    final Formula dnf = FormulaNormalizer.toDnf(formula);

    for (Assignment a : Assignments.of(formula)) {
      final boolean expected = Evaluator.evaluate(formula, a);
      // normal forms may drop atoms, so evaluation under a is always possible
      assertThat(Evaluator.evaluate(nnf, a)).as("nnf %s", a).isEqualTo(expected);
      assertThat(Evaluator.evaluate(cnf, a)).as("cnf %s", a).isEqualTo(expected);
      assertThat(Evaluator.evaluate(dnf, a)).as("dnf %s", a).isEqualTo(expected);
    }
  }
}
