package com.spotify.wff;

import static com.spotify.wff.Formula.and;
import static com.spotify.wff.Formula.atom;
import static com.spotify.wff.Formula.iff;
import static com.spotify.wff.Formula.implies;
import static com.spotify.wff.Formula.nand;
import static com.spotify.wff.Formula.nor;
import static com.spotify.wff.Formula.not;
import static com.spotify.wff.Formula.or;
import static com.spotify.wff.Formula.xor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.spotify.wff.Token.Kind;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class PrinterTest {

  private final Formula p = atom("p");
  private final Formula q = atom("q");
  private final Formula r = atom("r");

  static Stream<String> samples() {
    return SampleFormulas.texts();
  }

  @Test
  public void testFullyParenthesized() {
    assertThat(Printer.print(and(or(p, q), not(r)))).isEqualTo("((p OR q) AND NOT r)");
    assertThat(Printer.print(not(and(p, q)))).isEqualTo("NOT (p AND q)");
    assertThat(Printer.print(not(not(p)))).isEqualTo("NOT NOT p");
    assertThat(Printer.print(iff(implies(p, q), Formula.TRUE)))
        .isEqualTo("((p IMPLIES q) IFF TRUE)");
    assertThat(Printer.print(p)).isEqualTo("p");
  }

  @Test
  public void testSymbolicSyntax() {
    final Formula formula = iff(implies(not(p), and(q, Formula.FALSE)), or(not(not(r)), p));

    assertThat(Printer.print(formula, Syntax.symbolic()))
        .isEqualTo("((~p -> (q & FALSE)) <-> (~~r | p))");
  }

  @Test
  public void testExclusiveAndNegatedConnectives() {
    final Formula formula = xor(nand(p, not(q)), nor(q, r));

    assertThat(Printer.print(formula)).isEqualTo("((p NAND NOT q) XOR (q NOR r))");
    assertThat(Printer.print(formula, Syntax.symbolic())).isEqualTo("((p @ ~q) ^ (q % r))");
  }

  @Test
  public void testNestedSameConnectiveKeepsGrouping() {
    assertThat(Printer.print(implies(implies(p, q), r))).isEqualTo("((p IMPLIES q) IMPLIES r)");
    assertThat(Printer.print(implies(p, implies(q, r)))).isEqualTo("(p IMPLIES (q IMPLIES r))");
  }

  @ParameterizedTest
  @MethodSource("samples")
  public void testRoundTrip(String text) {
    final Formula parsed = Wff.parse(text);

    assertThat(Wff.parse(Wff.toString(parsed))).isEqualTo(parsed);
    assertThat(new Parser(Syntax.symbolic()).parse(Printer.print(parsed, Syntax.symbolic())))
        .isEqualTo(parsed);
  }

  @Test
  public void testAtomThatIsKeywordOfSyntaxCannotBePrinted() {
    final Syntax syntax = Syntax.defaults().toBuilder().spell(Kind.OR, "p").build();

    assertThatThrownBy(() -> Printer.print(or(q, p), syntax))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(Printer.print(or(q, r), syntax)).isEqualTo("(q p r)");
  }
}
