package com.spotify.wff;

import static java.util.Objects.requireNonNull;

/**
 * A lexical unit of formula text.
 *
 * @param kind what the token is
 * @param text the source text the token was read from, empty for {@link Kind#END}
 * @param position zero-based offset of the first character of the token in the input
 */
public record Token(Kind kind, String text, int position) {

  public enum Kind {
    ATOM("an atom"),
    TRUE("TRUE"),
    FALSE("FALSE"),
    NOT("NOT"),
    AND("AND"),
    OR("OR"),
    IMPLIES("IMPLIES"),
    IFF("IFF"),
    XOR("XOR"),
    NAND("NAND"),
    NOR("NOR"),
    LPAREN("'('"),
    RPAREN("')'"),
    END("end of input");

    private final String description;

    Kind(String description) {
      this.description = description;
    }

    /** Whether the spellings of this kind are taken from a {@link Syntax}. */
    public boolean isConfigurable() {
      return this != ATOM && this != LPAREN && this != RPAREN && this != END;
    }

    public String description() {
      return description;
    }
  }

  public Token {
    requireNonNull(kind, "kind");
    requireNonNull(text, "text");
  }

  static Token end(int position) {
    return new Token(Kind.END, "", position);
  }

  @Override
  public String toString() {
    return kind == Kind.END ? kind.description() : "'" + text + "'";
  }
}
