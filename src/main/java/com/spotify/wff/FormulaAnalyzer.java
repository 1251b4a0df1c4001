package com.spotify.wff;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Semantic queries answered by evaluating formulas under every assignment of {@link
 * Assignments}. All queries take time exponential in the number of distinct atoms.
 */
public final class FormulaAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(FormulaAnalyzer.class);

  /** Where a formula stands with respect to its models. */
  public enum Classification {
    /** True under every assignment. */
    TAUTOLOGY,
    /** True under no assignment. */
    CONTRADICTION,
    /** True under some but not all assignments. */
    CONTINGENCY
  }

  private FormulaAnalyzer() {}

  public static boolean isTautology(Formula formula) {
    requireNonNull(formula, "formula");
    return Iterables.all(assignments(formula), a -> Evaluator.evaluate(formula, a));
  }

  /** Stops at the first satisfying assignment in enumeration order. */
  public static boolean isSatisfiable(Formula formula) {
    return satisfyingAssignment(formula).isPresent();
  }

  public static boolean isContradiction(Formula formula) {
    return !isSatisfiable(formula);
  }

  public static boolean isContingent(Formula formula) {
    return classify(formula) == Classification.CONTINGENCY;
  }

  /** Classifies with a single pass, stopping as soon as both outcomes have been seen. */
  public static Classification classify(Formula formula) {
    requireNonNull(formula, "formula");
    boolean seenTrue = false;
    boolean seenFalse = false;
    for (Assignment assignment : assignments(formula)) {
      if (Evaluator.evaluate(formula, assignment)) {
        seenTrue = true;
      } else {
        seenFalse = true;
      }
      if (seenTrue && seenFalse) {
        return Classification.CONTINGENCY;
      }
    }
    return seenTrue ? Classification.TAUTOLOGY : Classification.CONTRADICTION;
  }

  /**
   * Whether both formulas have the same value under every assignment over the union of their
   * atoms.
   */
  public static boolean areEquivalent(Formula first, Formula second) {
    requireNonNull(first, "first");
    requireNonNull(second, "second");
    return Iterables.all(
        assignments(union(first.atoms(), second.atoms())),
        a -> Evaluator.evaluate(first, a) == Evaluator.evaluate(second, a));
  }

  /**
   * Whether every assignment over the atoms of both formulas that makes {@code premise} true
   * makes {@code conclusion} true as well.
   */
  public static boolean entails(Formula premise, Formula conclusion) {
    requireNonNull(premise, "premise");
    requireNonNull(conclusion, "conclusion");
    return Iterables.all(
        assignments(union(premise.atoms(), conclusion.atoms())),
        a -> !Evaluator.evaluate(premise, a) || Evaluator.evaluate(conclusion, a));
  }

  /** The first assignment in enumeration order under which {@code formula} is true. */
  public static Optional<Assignment> satisfyingAssignment(Formula formula) {
    return Optional.ofNullable(Iterables.getFirst(models(formula), null));
  }

  /** The satisfying assignments of {@code formula}, lazily and in enumeration order. */
  public static Iterable<Assignment> models(Formula formula) {
    requireNonNull(formula, "formula");
    return Iterables.filter(assignments(formula), a -> Evaluator.evaluate(formula, a));
  }

  public static TruthTable truthTable(Formula formula) {
    return TruthTable.of(formula);
  }

  private static Iterable<Assignment> assignments(Formula formula) {
    return assignments(formula.atoms());
  }

  private static Iterable<Assignment> assignments(Set<String> atoms) {
    final Iterable<Assignment> assignments = Assignments.over(atoms);
    log.debug("Enumerating up to {} assignments over {}", Assignments.count(atoms.size()), atoms);
    return assignments;
  }

  private static Set<String> union(Set<String> first, Set<String> second) {
    return ImmutableSortedSet.<String>naturalOrder().addAll(first).addAll(second).build();
  }
}
