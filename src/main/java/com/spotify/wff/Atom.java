package com.spotify.wff;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A propositional variable. Two atoms denote the same variable exactly when their names are
 * equal; names are case-sensitive.
 */
public record Atom(String name) implements Formula {

  static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  public Atom {
    requireNonNull(name, "name");
    checkArgument(IDENTIFIER.matcher(name).matches(), "Invalid atom name '%s'", name);
    checkArgument(
        !Syntax.defaults().isKeyword(name), "Atom name '%s' is a reserved keyword", name);
  }

  @Override
  public Type type() {
    return Type.ATOM;
  }

  @Override
  public List<Formula> operands() {
    return List.of();
  }

  @Override
  public String toString() {
    return name;
  }
}
