package com.spotify.wff;

import java.util.Map;

/**
 * Entry points for working with propositional formulas in the default {@link Syntax}.
 *
 * <pre>{@code
 * Formula f = Wff.parse("p IMPLIES q");
 * Wff.evaluate(f, Map.of("p", true, "q", false)); // false
 * Wff.areEquivalent(f, Wff.parse("NOT p OR q")); // true
 * Wff.toString(Wff.toCnf(f)); // "(NOT p OR q)"
 * }</pre>
 */
public final class Wff {

  private Wff() {}

  /**
   * Parses formula text.
   *
   * @throws Exceptions.LexError if the text contains a character that starts no token
   * @throws Exceptions.SyntaxError if the text is not exactly one formula
   */
  public static Formula parse(String text) {
    return Parser.parseDefault(text);
  }

  /** The canonical, fully parenthesized text of {@code formula}; {@link #parse} reads it back. */
  public static String toString(Formula formula) {
    return Printer.print(formula);
  }

  /**
   * Evaluates a formula.
   *
   * @throws Exceptions.EvaluationError if an atom of the formula is unbound
   */
  public static boolean evaluate(Formula formula, Assignment assignment) {
    return Evaluator.evaluate(formula, assignment);
  }

  /**
   * Evaluates a formula under the bindings of {@code values}.
   *
   * @throws Exceptions.EvaluationError if an atom of the formula is unbound
   */
  public static boolean evaluate(Formula formula, Map<String, Boolean> values) {
    return Evaluator.evaluate(formula, Assignment.of(values));
  }

  public static Iterable<Assignment> allAssignments(Formula formula) {
    return Assignments.of(formula);
  }

  public static Formula simplify(Formula formula) {
    return FormulaNormalizer.simplify(formula);
  }

  public static Formula toNnf(Formula formula) {
    return FormulaNormalizer.toNnf(formula);
  }

  public static Formula toCnf(Formula formula) {
    return FormulaNormalizer.toCnf(formula);
  }

  public static Formula toDnf(Formula formula) {
    return FormulaNormalizer.toDnf(formula);
  }

  public static boolean isTautology(Formula formula) {
    return FormulaAnalyzer.isTautology(formula);
  }

  public static boolean isSatisfiable(Formula formula) {
    return FormulaAnalyzer.isSatisfiable(formula);
  }

  public static boolean isContradiction(Formula formula) {
    return FormulaAnalyzer.isContradiction(formula);
  }

  public static boolean areEquivalent(Formula first, Formula second) {
    return FormulaAnalyzer.areEquivalent(first, second);
  }

  public static TruthTable truthTable(Formula formula) {
    return FormulaAnalyzer.truthTable(formula);
  }
}
