package com.spotify.wff;

import static java.util.Objects.requireNonNull;

/** Exclusive disjunction: true when exactly one operand is true. */
public record Xor(Formula left, Formula right) implements BinaryFormula {

  public Xor {
    requireNonNull(left, "left");
    requireNonNull(right, "right");
  }

  @Override
  public Type type() {
    return Type.XOR;
  }

  @Override
  public boolean apply(boolean left, boolean right) {
    return left != right;
  }

  @Override
  public BinaryFormula with(Formula left, Formula right) {
    return new Xor(left, right);
  }

  @Override
  public Formula simplify() {
    final Formula l = left.simplify();
    final Formula r = right.simplify();

    if (l.isFalse()) {
      return r;
    } else if (r.isFalse()) {
      return l;
    } else if (l.isTrue()) {
      return Formula.not(r).simplify();
    } else if (r.isTrue()) {
      return Formula.not(l).simplify();
    } else if (l.equals(r)) {
      return FALSE;
    } else if (l.isNegationOf(r) || r.isNegationOf(l)) {
      return TRUE;
    }
    return with(l, r);
  }

  @Override
  public String toString() {
    return Printer.print(this);
  }
}
