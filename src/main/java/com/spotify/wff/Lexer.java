package com.spotify.wff;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.spotify.wff.Exceptions.LexError;
import com.spotify.wff.Token.Kind;
import java.util.List;
import java.util.Map;

/** Splits formula text into {@link Token}s according to a {@link Syntax}. */
public class Lexer {

  private final Syntax syntax;

  public Lexer(Syntax syntax) {
    this.syntax = requireNonNull(syntax);
  }

  /**
   * Tokenizes {@code text} with the default syntax.
   *
   * @see #tokenize(String)
   */
  public static List<Token> tokenizeDefault(String text) {
    return new Lexer(Syntax.defaults()).tokenize(text);
  }

  /**
   * Tokenizes formula text. Whitespace separates tokens and is otherwise ignored.
   *
   * @param text the formula text
   * @return the tokens, always ending with a single {@link Kind#END} token
   * @throws LexError if a character starts no token
   */
  public List<Token> tokenize(String text) {
    requireNonNull(text, "text");
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();

    int pos = 0;
    while (pos < text.length()) {
      final char c = text.charAt(pos);
      if (Character.isWhitespace(c)) {
        pos++;
      } else if (c == '(') {
        tokens.add(new Token(Kind.LPAREN, "(", pos++));
      } else if (c == ')') {
        tokens.add(new Token(Kind.RPAREN, ")", pos++));
      } else if (Syntax.isIdentifierStart(c)) {
        final int start = pos;
        while (pos < text.length() && Syntax.isIdentifierPart(text.charAt(pos))) {
          pos++;
        }
        final String word = text.substring(start, pos);
        tokens.add(new Token(syntax.keyword(word).orElse(Kind.ATOM), word, start));
      } else {
        final Token symbol = matchSymbol(text, pos);
        tokens.add(symbol);
        pos += symbol.text().length();
      }
    }

    tokens.add(Token.end(text.length()));
    return tokens.build();
  }

  private Token matchSymbol(String text, int pos) {
    for (Map.Entry<String, Kind> symbol : syntax.symbols()) {
      if (text.startsWith(symbol.getKey(), pos)) {
        return new Token(symbol.getValue(), symbol.getKey(), pos);
      }
    }
    throw new LexError(pos, text.charAt(pos));
  }
}
