package com.spotify.wff;

import static java.util.Objects.requireNonNull;

public record Or(Formula left, Formula right) implements BinaryFormula {

  public Or {
    requireNonNull(left, "left");
    requireNonNull(right, "right");
  }

  @Override
  public Type type() {
    return Type.OR;
  }

  @Override
  public boolean apply(boolean left, boolean right) {
    return left || right;
  }

  @Override
  public BinaryFormula with(Formula left, Formula right) {
    return new Or(left, right);
  }

  @Override
  public Formula simplify() {
    final Formula l = left.simplify();
    final Formula r = right.simplify();

    if (l.isTrue() || r.isTrue()) {
      return TRUE;
    } else if (l.isFalse()) {
      return r;
    } else if (r.isFalse()) {
      return l;
    } else if (l.equals(r)) {
      return l;
    } else if (l.isNegationOf(r) || r.isNegationOf(l)) {
      // a | ~a -> T
      return TRUE;
    }
    return with(l, r);
  }

  @Override
  public String toString() {
    return Printer.print(this);
  }
}
