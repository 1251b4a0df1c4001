package com.spotify.wff;

import static java.util.Objects.requireNonNull;

public record And(Formula left, Formula right) implements BinaryFormula {

  public And {
    requireNonNull(left, "left");
    requireNonNull(right, "right");
  }

  @Override
  public Type type() {
    return Type.AND;
  }

  @Override
  public boolean apply(boolean left, boolean right) {
    return left && right;
  }

  @Override
  public BinaryFormula with(Formula left, Formula right) {
    return new And(left, right);
  }

  @Override
  public Formula simplify() {
    final Formula l = left.simplify();
    final Formula r = right.simplify();

    if (l.isFalse() || r.isFalse()) {
      return FALSE;
    } else if (l.isTrue()) {
      return r;
    } else if (r.isTrue()) {
      return l;
    } else if (l.equals(r)) {
      return l;
    } else if (l.isNegationOf(r) || r.isNegationOf(l)) {
      // a & ~a -> F
      return FALSE;
    }
    return with(l, r);
  }

  @Override
  public String toString() {
    return Printer.print(this);
  }
}
