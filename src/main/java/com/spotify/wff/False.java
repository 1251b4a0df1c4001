package com.spotify.wff;

import java.util.List;

record False() implements Formula {

  @Override
  public Type type() {
    return Type.FALSE;
  }

  @Override
  public List<Formula> operands() {
    return List.of();
  }

  @Override
  public String toString() {
    return Printer.print(this);
  }
}
