package com.spotify.wff;

import static java.util.Objects.requireNonNull;

import com.spotify.wff.Exceptions.EvaluationError;

/** Computes the truth value of a formula under an assignment. */
public final class Evaluator {

  private Evaluator() {}

  /**
   * Evaluates {@code formula} under {@code assignment}. Both operands of every binary connective
   * are evaluated, so an unbound atom is reported regardless of the values of the other operands.
   *
   * @throws EvaluationError if the assignment does not bind an atom of the formula
   */
  public static boolean evaluate(Formula formula, Assignment assignment) {
    requireNonNull(formula, "formula");
    requireNonNull(assignment, "assignment");
    return evaluateInternal(formula, assignment);
  }

  private static boolean evaluateInternal(Formula formula, Assignment assignment) {
    return switch (formula.type()) {
      case TRUE -> true;
      case FALSE -> false;
      case ATOM -> {
        final String name = ((Atom) formula).name();
        yield assignment.value(name).orElseThrow(() -> EvaluationError.unboundAtom(name));
      }
      case NOT -> !evaluateInternal(((Not) formula).operand(), assignment);
      case AND, OR, IMPLIES, IFF, XOR, NAND, NOR -> {
        final BinaryFormula binary = (BinaryFormula) formula;
        final boolean left = evaluateInternal(binary.left(), assignment);
        final boolean right = evaluateInternal(binary.right(), assignment);
        yield binary.apply(left, right);
      }
    };
  }
}
