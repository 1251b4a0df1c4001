package com.spotify.wff;

import static com.spotify.wff.Formula.and;
import static com.spotify.wff.Formula.not;
import static com.spotify.wff.Formula.or;
import static java.util.Objects.requireNonNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites formulas into negation, conjunctive and disjunctive normal form.
 *
 * <p>All rewrites build new trees and leave their input untouched. Conversion to CNF and DNF
 * distributes one connective over the other and can grow the formula exponentially; no bound is
 * applied.
 */
public final class FormulaNormalizer {

  private static final Logger log = LoggerFactory.getLogger(FormulaNormalizer.class);

  private FormulaNormalizer() {}

  /** Same as {@link Formula#simplify()}. */
  public static Formula simplify(Formula formula) {
    return requireNonNull(formula, "formula").simplify();
  }

  /**
   * Converts to negation normal form: every connective other than conjunction and disjunction is
   * expanded, and negation is pushed down until it only applies to atoms. Constants are kept, a
   * negated constant becomes the opposite constant.
   */
  public static Formula toNnf(Formula formula) {
    return nnf(requireNonNull(formula, "formula"));
  }

  /**
   * Converts to conjunctive normal form, a conjunction of clauses where every clause is a
   * disjunction of literals. The formula is simplified first, so the result contains a constant
   * only if it is one.
   */
  public static Formula toCnf(Formula formula) {
    final Formula cnf = cnf(nnf(simplify(formula)));
    log.debug("Converted formula of size {} to CNF of size {}", formula.size(), cnf.size());
    return cnf;
  }

  /**
   * Converts to disjunctive normal form, a disjunction of terms where every term is a conjunction
   * of literals. The formula is simplified first, so the result contains a constant only if it is
   * one.
   */
  public static Formula toDnf(Formula formula) {
    final Formula dnf = dnf(nnf(simplify(formula)));
    log.debug("Converted formula of size {} to DNF of size {}", formula.size(), dnf.size());
    return dnf;
  }

  /** Whether negation only applies to atoms and there is no implication or biconditional. */
  public static boolean isNnf(Formula formula) {
    return switch (formula.type()) {
      case TRUE, FALSE, ATOM -> true;
      case NOT -> formula.isLiteral();
      case AND, OR -> formula.operands().stream().allMatch(FormulaNormalizer::isNnf);
      case IMPLIES, IFF, XOR, NAND, NOR -> false;
    };
  }

  public static boolean isCnf(Formula formula) {
    return formula.isConstant() || isNested(formula, Formula.Type.AND, Formula.Type.OR);
  }

  public static boolean isDnf(Formula formula) {
    return formula.isConstant() || isNested(formula, Formula.Type.OR, Formula.Type.AND);
  }

  // outer-typed tree of inner-typed trees of literals
  private static boolean isNested(Formula formula, Formula.Type outer, Formula.Type inner) {
    if (formula.type() == outer) {
      return formula.operands().stream().allMatch(o -> isNested(o, outer, inner));
    }
    return isFlat(formula, inner);
  }

  private static boolean isFlat(Formula formula, Formula.Type type) {
    if (formula.type() == type) {
      return formula.operands().stream().allMatch(o -> isFlat(o, type));
    }
    return formula.isLiteral();
  }

  private static Formula nnf(Formula formula) {
    return switch (formula.type()) {
      case TRUE, FALSE, ATOM -> formula;
      case NOT -> negate(((Not) formula).operand());
      case AND, OR -> {
        final BinaryFormula binary = (BinaryFormula) formula;
        yield binary.with(nnf(binary.left()), nnf(binary.right()));
      }
      case IMPLIES ->
          // a -> b == ~a | b
          or(negate(left(formula)), nnf(right(formula)));
      case IFF ->
          // a <-> b == (a & b) | (~a & ~b)
          or(
              and(nnf(left(formula)), nnf(right(formula))),
              and(negate(left(formula)), negate(right(formula))));
      case XOR ->
          // a ^ b == (a & ~b) | (~a & b)
          or(
              and(nnf(left(formula)), negate(right(formula))),
              and(negate(left(formula)), nnf(right(formula))));
      case NAND ->
          // a @ b == ~a | ~b
          or(negate(left(formula)), negate(right(formula)));
      case NOR ->
          // a % b == ~a & ~b
          and(negate(left(formula)), negate(right(formula)));
    };
  }

  // nnf of ~formula
  private static Formula negate(Formula formula) {
    return switch (formula.type()) {
      case TRUE -> Formula.FALSE;
      case FALSE -> Formula.TRUE;
      case ATOM -> not(formula);
      case NOT ->
          // ~~a -> a
          nnf(((Not) formula).operand());
      case AND ->
          // ~(a & b) -> ~a | ~b
          or(negate(left(formula)), negate(right(formula)));
      case OR ->
          // ~(a | b) -> ~a & ~b
          and(negate(left(formula)), negate(right(formula)));
      case IMPLIES ->
          // ~(a -> b) -> a & ~b
          and(nnf(left(formula)), negate(right(formula)));
      case IFF ->
          // ~(a <-> b) -> (a & ~b) | (~a & b)
          or(
              and(nnf(left(formula)), negate(right(formula))),
              and(negate(left(formula)), nnf(right(formula))));
      case XOR ->
          // ~(a ^ b) -> (a & b) | (~a & ~b)
          or(
              and(nnf(left(formula)), nnf(right(formula))),
              and(negate(left(formula)), negate(right(formula))));
      case NAND ->
          // ~(a @ b) -> a & b
          and(nnf(left(formula)), nnf(right(formula)));
      case NOR ->
          // ~(a % b) -> a | b
          or(nnf(left(formula)), nnf(right(formula)));
    };
  }

  // input is in nnf
  private static Formula cnf(Formula formula) {
    return switch (formula.type()) {
      case AND -> ((BinaryFormula) formula).with(cnf(left(formula)), cnf(right(formula)));
      case OR -> distribute(cnf(left(formula)), cnf(right(formula)), Formula.Type.OR);
      default -> formula;
    };
  }

  // input is in nnf
  private static Formula dnf(Formula formula) {
    return switch (formula.type()) {
      case OR -> ((BinaryFormula) formula).with(dnf(left(formula)), dnf(right(formula)));
      case AND -> distribute(dnf(left(formula)), dnf(right(formula)), Formula.Type.AND);
      default -> formula;
    };
  }

  /**
   * Combines two normal forms with {@code inner}, distributing it over the other connective: for
   * CNF {@code (a & b) | c -> (a | c) & (b | c)}, for DNF {@code (a | b) & c -> (a & c) | (b & c)}.
   */
  private static Formula distribute(Formula a, Formula b, Formula.Type inner) {
    final Formula.Type outer = inner == Formula.Type.OR ? Formula.Type.AND : Formula.Type.OR;
    if (a.type() == outer) {
      return combine(
          outer, distribute(left(a), b, inner), distribute(right(a), b, inner));
    } else if (b.type() == outer) {
      return combine(
          outer, distribute(a, left(b), inner), distribute(a, right(b), inner));
    }
    return combine(inner, a, b);
  }

  private static Formula combine(Formula.Type type, Formula left, Formula right) {
    return type == Formula.Type.AND ? and(left, right) : or(left, right);
  }

  private static Formula left(Formula formula) {
    return ((BinaryFormula) formula).left();
  }

  private static Formula right(Formula formula) {
    return ((BinaryFormula) formula).right();
  }
}
