package com.spotify.wff;

import static java.util.Objects.requireNonNull;

public class Exceptions {

  private Exceptions() {}

  /** Base of all failures signaled by the formula engine. */
  public abstract static class FormulaError extends RuntimeException {
    FormulaError(String message) {
      super(message);
    }
  }

  /** Formula text contains a character that starts no token. */
  public static class LexError extends FormulaError {
    private final int position;
    private final char unexpectedCharacter;

    public LexError(int position, char unexpectedCharacter) {
      super(
          String.format(
              "Unexpected character '%s' at position %d", unexpectedCharacter, position));
      this.position = position;
      this.unexpectedCharacter = unexpectedCharacter;
    }

    public int position() {
      return position;
    }

    public char unexpectedCharacter() {
      return unexpectedCharacter;
    }
  }

  /** A token sequence that does not form a formula. */
  public static class SyntaxError extends FormulaError {
    private final int position;
    private final String expected;
    private final Token found;

    public SyntaxError(String expected, Token found) {
      super(
          String.format(
              "Expected %s but found %s at position %d", expected, found, found.position()));
      this.position = found.position();
      this.expected = expected;
      this.found = found;
    }

    public int position() {
      return position;
    }

    /** Description of what would have been accepted at {@link #position()}. */
    public String expected() {
      return expected;
    }

    public Token found() {
      return found;
    }
  }

  /** A formula could not be evaluated under the given assignment. */
  public static class EvaluationError extends FormulaError {

    public enum Reason {
      UNBOUND_ATOM
    }

    private final Reason reason;
    private final String atom;

    private EvaluationError(Reason reason, String atom, String message) {
      super(message);
      this.reason = requireNonNull(reason);
      this.atom = requireNonNull(atom);
    }

    public static EvaluationError unboundAtom(String atom) {
      return new EvaluationError(
          Reason.UNBOUND_ATOM,
          atom,
          String.format("Atom '%s' is not bound by the assignment", atom));
    }

    public Reason reason() {
      return reason;
    }

    public String atom() {
      return atom;
    }
  }
}
