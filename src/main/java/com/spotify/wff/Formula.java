package com.spotify.wff;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;

/* Formula ADT written with sealed interfaces and records */
public sealed interface Formula permits Atom, True, False, Not, BinaryFormula {

  Formula TRUE = new True();
  Formula FALSE = new False();

  // this also defines the order of the connectives for printing and reporting
  enum Type {
    TRUE,
    FALSE,
    ATOM,
    NOT,
    AND,
    OR,
    IMPLIES,
    IFF,
    XOR,
    NAND,
    NOR
  }

  Type type();

  /** Direct children, left to right. Leaves have none. */
  List<Formula> operands();

  static Formula atom(String name) {
    return new Atom(name);
  }

  static Formula constant(boolean value) {
    return value ? TRUE : FALSE;
  }

  static Formula not(Formula operand) {
    return new Not(operand);
  }

  static Formula and(Formula left, Formula right) {
    return new And(left, right);
  }

  /** Left-nested conjunction of one or more operands. */
  static Formula and(Formula first, Formula... rest) {
    Formula result = requireNonNull(first);
    for (Formula operand : rest) {
      result = and(result, operand);
    }
    return result;
  }

  static Formula or(Formula left, Formula right) {
    return new Or(left, right);
  }

  /** Left-nested disjunction of one or more operands. */
  static Formula or(Formula first, Formula... rest) {
    Formula result = requireNonNull(first);
    for (Formula operand : rest) {
      result = or(result, operand);
    }
    return result;
  }

  static Formula implies(Formula antecedent, Formula consequent) {
    return new Implies(antecedent, consequent);
  }

  static Formula iff(Formula left, Formula right) {
    return new Iff(left, right);
  }

  static Formula xor(Formula left, Formula right) {
    return new Xor(left, right);
  }

  static Formula nand(Formula left, Formula right) {
    return new Nand(left, right);
  }

  static Formula nor(Formula left, Formula right) {
    return new Nor(left, right);
  }

  default boolean isConstant() {
    return this instanceof True || this instanceof False;
  }

  default boolean isTrue() {
    return this instanceof True;
  }

  default boolean isFalse() {
    return this instanceof False;
  }

  default boolean isAtom() {
    return this instanceof Atom;
  }

  default boolean isNot() {
    return this instanceof Not;
  }

  default boolean isAnd() {
    return this instanceof And;
  }

  default boolean isOr() {
    return this instanceof Or;
  }

  /** An atom, or the negation of an atom. */
  default boolean isLiteral() {
    return isAtom() || (this instanceof Not not && not.operand().isAtom());
  }

  /** Whether this formula is {@code ~other}. */
  default boolean isNegationOf(Formula other) {
    return this instanceof Not not && not.operand().equals(other);
  }

  /** The distinct atom names occurring in this formula, in natural string order. */
  default SortedSet<String> atoms() {
    final ImmutableSortedSet.Builder<String> atoms = ImmutableSortedSet.naturalOrder();
    collectAtoms(this, atoms);
    return atoms.build();
  }

  /** The connective types of all inner nodes of this formula. */
  default Set<Type> connectives() {
    final Set<Type> connectives = EnumSet.noneOf(Type.class);
    collectConnectives(this, connectives);
    return Sets.immutableEnumSet(connectives);
  }

  /** Number of nodes in the tree. */
  default int size() {
    int size = 1;
    for (Formula operand : operands()) {
      size += operand.size();
    }
    return size;
  }

  /** Height of the tree; a leaf has depth 1. */
  default int depth() {
    int deepest = 0;
    for (Formula operand : operands()) {
      deepest = Math.max(deepest, operand.depth());
    }
    return deepest + 1;
  }

  /**
   * Rewrites this formula bottom-up, eliminating double negations, folding constants and
   * collapsing trivial operand pairs. The result is a fixed point: simplifying it again returns
   * an equal formula.
   */
  default Formula simplify() {
    return this;
  }

  private static void collectAtoms(Formula formula, ImmutableSortedSet.Builder<String> atoms) {
    switch (formula.type()) {
      case ATOM -> atoms.add(((Atom) formula).name());
      case TRUE, FALSE -> {}
      default -> formula.operands().forEach(o -> collectAtoms(o, atoms));
    }
  }

  private static void collectConnectives(Formula formula, Set<Type> connectives) {
    switch (formula.type()) {
      case TRUE, FALSE, ATOM -> {}
      default -> {
        connectives.add(formula.type());
        formula.operands().forEach(o -> collectConnectives(o, connectives));
      }
    }
  }
}
