package com.spotify.wff;

import static java.util.Objects.requireNonNull;

import java.util.List;

public record Not(Formula operand) implements Formula {

  public Not {
    requireNonNull(operand, "operand");
  }

  @Override
  public Type type() {
    return Type.NOT;
  }

  @Override
  public List<Formula> operands() {
    return List.of(operand);
  }

  @Override
  public Formula simplify() {
    final Formula simplified = operand.simplify();

    if (simplified instanceof Not inner) {
      // ~~a -> a
      return inner.operand();
    } else if (simplified.isConstant()) {
      return simplified.isTrue() ? FALSE : TRUE;
    }

    return Formula.not(simplified);
  }

  @Override
  public String toString() {
    return Printer.print(this);
  }
}
