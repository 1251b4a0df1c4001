package com.spotify.wff;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.spotify.wff.Token.Kind;

/**
 * Renders formulas in their canonical text form: fully parenthesized, using the primary spellings
 * of a {@link Syntax}. Every binary node is wrapped in parentheses, negation is written as a
 * prefix and atoms and constants stand alone, e.g. {@code ((p AND NOT q) IMPLIES r)}. Parsing the
 * output with the same syntax yields an equal formula.
 */
public final class Printer {

  private Printer() {}

  public static String print(Formula formula) {
    return print(formula, Syntax.defaults());
  }

  public static String print(Formula formula, Syntax syntax) {
    requireNonNull(formula, "formula");
    requireNonNull(syntax, "syntax");
    final StringBuilder out = new StringBuilder();
    print(formula, syntax, out);
    return out.toString();
  }

  private static void print(Formula formula, Syntax syntax, StringBuilder out) {
    switch (formula.type()) {
      case TRUE -> out.append(syntax.primary(Kind.TRUE));
      case FALSE -> out.append(syntax.primary(Kind.FALSE));
      case ATOM -> {
        final String name = ((Atom) formula).name();
        checkArgument(!syntax.isKeyword(name), "Atom '%s' is a keyword in %s", name, syntax);
        out.append(name);
      }
      case NOT -> {
        final String not = syntax.primary(Kind.NOT);
        out.append(not);
        if (Syntax.isIdentifier(not)) {
          // keywords need a separator, symbols do not
          out.append(' ');
        }
        print(((Not) formula).operand(), syntax, out);
      }
      case AND, OR, IMPLIES, IFF, XOR, NAND, NOR -> {
        final BinaryFormula binary = (BinaryFormula) formula;
        out.append('(');
        print(binary.left(), syntax, out);
        out.append(' ').append(syntax.primary(kindOf(formula.type()))).append(' ');
        print(binary.right(), syntax, out);
        out.append(')');
      }
    }
  }

  private static Kind kindOf(Formula.Type type) {
    return switch (type) {
      case TRUE -> Kind.TRUE;
      case FALSE -> Kind.FALSE;
      case ATOM -> Kind.ATOM;
      case NOT -> Kind.NOT;
      case AND -> Kind.AND;
      case OR -> Kind.OR;
      case IMPLIES -> Kind.IMPLIES;
      case IFF -> Kind.IFF;
      case XOR -> Kind.XOR;
      case NAND -> Kind.NAND;
      case NOR -> Kind.NOR;
    };
  }
}
