package com.spotify.wff;

import static java.util.Objects.requireNonNull;

public record Iff(Formula left, Formula right) implements BinaryFormula {

  public Iff {
    requireNonNull(left, "left");
    requireNonNull(right, "right");
  }

  @Override
  public Type type() {
    return Type.IFF;
  }

  @Override
  public boolean apply(boolean left, boolean right) {
    return left == right;
  }

  @Override
  public BinaryFormula with(Formula left, Formula right) {
    return new Iff(left, right);
  }

  @Override
  public Formula simplify() {
    final Formula l = left.simplify();
    final Formula r = right.simplify();

    if (l.isTrue()) {
      return r;
    } else if (r.isTrue()) {
      return l;
    } else if (l.isFalse()) {
      return Formula.not(r).simplify();
    } else if (r.isFalse()) {
      return Formula.not(l).simplify();
    } else if (l.equals(r)) {
      return TRUE;
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
