package com.spotify.wff;

import static java.util.Objects.requireNonNull;

/** Negated disjunction: true only when both operands are false. */
public record Nor(Formula left, Formula right) implements BinaryFormula {

  public Nor {
    requireNonNull(left, "left");
    requireNonNull(right, "right");
  }

  @Override
  public Type type() {
    return Type.NOR;
  }

  @Override
  public boolean apply(boolean left, boolean right) {
    return !(left || right);
  }

  @Override
  public BinaryFormula with(Formula left, Formula right) {
    return new Nor(left, right);
  }

  @Override
  public Formula simplify() {
    final Formula l = left.simplify();
    final Formula r = right.simplify();

    if (l.isTrue() || r.isTrue()) {
      return FALSE;
    } else if (l.isFalse()) {
      return Formula.not(r).simplify();
    } else if (r.isFalse() || l.equals(r)) {
      // a % a -> ~a
      return Formula.not(l).simplify();
    } else if (l.isNegationOf(r) || r.isNegationOf(l)) {
      return FALSE;
    }
    return with(l, r);
  }

  @Override
  public String toString() {
    return Printer.print(this);
  }
}
