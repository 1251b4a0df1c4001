package com.spotify.wff;

import static java.util.Objects.requireNonNull;

import com.spotify.wff.Exceptions.SyntaxError;
import com.spotify.wff.Token.Kind;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for propositional formulas.
 *
 * <p>Precedence, from loosest to tightest binding:
 *
 * <pre>
 *   formula := iff
 *   iff     := implies ( IFF implies )*     left-associative
 *   implies := or ( IMPLIES implies )?      right-associative
 *   or      := xor ( ( OR | NOR ) xor )*    left-associative
 *   xor     := and ( XOR and )*             left-associative
 *   and     := not ( ( AND | NAND ) not )*  left-associative
 *   not     := NOT not | atomic
 *   atomic  := ATOM | TRUE | FALSE | '(' formula ')'
 * </pre>
 *
 * <p>So {@code p IMPLIES q IMPLIES r} reads as {@code p IMPLIES (q IMPLIES r)} and {@code p IFF q
 * IFF r} as {@code (p IFF q) IFF r}. The parser reads the tokens once, left to right, with a
 * single token of lookahead.
 *
 * <p>Negations, parentheses and implication chains nest at most {@value #MAX_NESTING} levels
 * deep; deeper input is rejected with a {@link SyntaxError} rather than exhausting the stack.
 */
public class Parser {

  private static final Logger log = LoggerFactory.getLogger(Parser.class);

  /** Maximum nesting of negations, parentheses and implications in parsed text. */
  public static final int MAX_NESTING = 256;

  private static final String EXPECTED_OPERAND = "an atom, a constant, a negation or '('";
  private static final String EXPECTED_SHALLOWER =
      "at most " + MAX_NESTING + " levels of nesting";

  private final Lexer lexer;

  public Parser(Syntax syntax) {
    this.lexer = new Lexer(requireNonNull(syntax));
  }

  /**
   * Parses {@code text} with the default syntax.
   *
   * @see #parse(String)
   */
  public static Formula parseDefault(String text) {
    return new Parser(Syntax.defaults()).parse(text);
  }

  /**
   * Parses a complete formula.
   *
   * @param text the formula text
   * @return the formula
   * @throws Exceptions.LexError if the text contains a character that starts no token
   * @throws SyntaxError if the tokens do not form exactly one formula
   */
  public Formula parse(String text) {
    final List<Token> tokens = lexer.tokenize(text);
    log.trace("Parsing {} tokens", tokens.size());
    return new TokenCursor(tokens).parseAll();
  }

  /** Parse state over one token list. */
  private static final class TokenCursor {

    private final List<Token> tokens;
    private int next = 0;
    private int depth = 0;

    private TokenCursor(List<Token> tokens) {
      this.tokens = tokens;
    }

    Formula parseAll() {
      final Formula formula = parseIff();
      expect(Kind.END, Kind.END.description());
      return formula;
    }

    private Formula parseIff() {
      Formula left = parseImplies();
      while (accept(Kind.IFF)) {
        left = Formula.iff(left, parseImplies());
      }
      return left;
    }

    private Formula parseImplies() {
      final Formula antecedent = parseOr();
      if (accept(Kind.IMPLIES)) {
        return Formula.implies(antecedent, nested(this::parseImplies));
      }
      return antecedent;
    }

    private Formula parseOr() {
      Formula left = parseXor();
      while (true) {
        if (accept(Kind.OR)) {
          left = Formula.or(left, parseXor());
        } else if (accept(Kind.NOR)) {
          left = Formula.nor(left, parseXor());
        } else {
          return left;
        }
      }
    }

    private Formula parseXor() {
      Formula left = parseAnd();
      while (accept(Kind.XOR)) {
        left = Formula.xor(left, parseAnd());
      }
      return left;
    }

    private Formula parseAnd() {
      Formula left = parseNot();
      while (true) {
        if (accept(Kind.AND)) {
          left = Formula.and(left, parseNot());
        } else if (accept(Kind.NAND)) {
          left = Formula.nand(left, parseNot());
        } else {
          return left;
        }
      }
    }

    private Formula parseNot() {
      if (accept(Kind.NOT)) {
        return Formula.not(nested(this::parseNot));
      }
      return parseAtomic();
    }

    private Formula parseAtomic() {
      final Token token = peek();
      return switch (token.kind()) {
        case ATOM -> {
          if (Syntax.defaults().isKeyword(token.text())) {
            // only reachable with a syntax that frees up a default keyword
            throw new SyntaxError("an atom name that is not a reserved keyword", token);
          }
          next++;
          yield Formula.atom(token.text());
        }
        case TRUE -> {
          next++;
          yield Formula.TRUE;
        }
        case FALSE -> {
          next++;
          yield Formula.FALSE;
        }
        case LPAREN -> {
          next++;
          final Formula inner = nested(this::parseIff);
          expect(Kind.RPAREN, Kind.RPAREN.description());
          yield inner;
        }
        default -> throw new SyntaxError(EXPECTED_OPERAND, token);
      };
    }

    // the token just consumed opened the new level
    private Formula nested(Supplier<Formula> parser) {
      if (depth == MAX_NESTING) {
        throw new SyntaxError(EXPECTED_SHALLOWER, tokens.get(next - 1));
      }
      depth++;
      try {
        return parser.get();
      } finally {
        depth--;
      }
    }

    private Token peek() {
      return tokens.get(next);
    }

    private boolean accept(Kind kind) {
      if (peek().kind() == kind) {
        next++;
        return true;
      }
      return false;
    }

    private void expect(Kind kind, String description) {
      if (!accept(kind)) {
        throw new SyntaxError(description, peek());
      }
    }
  }
}
