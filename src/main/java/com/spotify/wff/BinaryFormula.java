package com.spotify.wff;

import java.util.List;

/** A node with exactly two children, combined by a binary truth function. */
public sealed interface BinaryFormula extends Formula
    permits And, Or, Implies, Iff, Xor, Nand, Nor {

  Formula left();

  Formula right();

  /** The truth function of this connective. */
  boolean apply(boolean left, boolean right);

  /** Builds a node of the same connective over new children. */
  BinaryFormula with(Formula left, Formula right);

  @Override
  default List<Formula> operands() {
    return List.of(left(), right());
  }
}
