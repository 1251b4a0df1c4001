package com.spotify.wff;

import static java.util.Objects.requireNonNull;

/** Negated conjunction: false only when both operands are true. */
public record Nand(Formula left, Formula right) implements BinaryFormula {

  public Nand {
    requireNonNull(left, "left");
    requireNonNull(right, "right");
  }

  @Override
  public Type type() {
    return Type.NAND;
  }

  @Override
  public boolean apply(boolean left, boolean right) {
    return !(left && right);
  }

  @Override
  public BinaryFormula with(Formula left, Formula right) {
    return new Nand(left, right);
  }

  @Override
  public Formula simplify() {
    final Formula l = left.simplify();
    final Formula r = right.simplify();

    if (l.isFalse() || r.isFalse()) {
      return TRUE;
    } else if (l.isTrue()) {
      return Formula.not(r).simplify();
    } else if (r.isTrue() || l.equals(r)) {
      // a @ a -> ~a
      return Formula.not(l).simplify();
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
