package com.spotify.wff;

import static java.util.Objects.requireNonNull;

public record Implies(Formula antecedent, Formula consequent) implements BinaryFormula {

  public Implies {
    requireNonNull(antecedent, "antecedent");
    requireNonNull(consequent, "consequent");
  }

  @Override
  public Type type() {
    return Type.IMPLIES;
  }

  @Override
  public Formula left() {
    return antecedent;
  }

  @Override
  public Formula right() {
    return consequent;
  }

  @Override
  public boolean apply(boolean left, boolean right) {
    return !left || right;
  }

  @Override
  public BinaryFormula with(Formula left, Formula right) {
    return new Implies(left, right);
  }

  @Override
  public Formula simplify() {
    final Formula a = antecedent.simplify();
    final Formula c = consequent.simplify();

    if (a.isFalse() || c.isTrue()) {
      return TRUE;
    } else if (a.isTrue()) {
      return c;
    } else if (c.isFalse()) {
      return Formula.not(a).simplify();
    } else if (a.equals(c)) {
      return TRUE;
    } else if (a.isNegationOf(c)) {
      // (~c -> c) -> c
      return c;
    } else if (c.isNegationOf(a)) {
      // (a -> ~a) -> ~a
      return c;
    }
    return with(a, c);
  }

  @Override
  public String toString() {
    return Printer.print(this);
  }
}
