package com.spotify.wff;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Comparator.comparingInt;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spotify.wff.Token.Kind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The spellings of the connectives and constants of the formula language.
 *
 * <p>A syntax maps every configurable {@link Kind} (the constants and the connectives) to
 * one or more literal spellings. Spellings that are identifiers, such as {@code AND}, are
 * keywords: they are matched as whole words and can never be used as atom names. Other
 * spellings, such as {@code ->}, are symbols and are matched longest first. Keywords are
 * case-sensitive. Parentheses are always {@code (} and {@code )}.
 *
 * <p>The first spelling of every kind is its primary spelling, used by the {@link Printer}.
 *
 * <p>The default syntax accepts:
 *
 * <pre>
 *   NOT      NOT  ~  !
 *   AND      AND  &amp;
 *   OR       OR   |
 *   IMPLIES  IMPLIES  -&gt;
 *   IFF      IFF  &lt;-&gt;
 *   XOR      XOR  ^
 *   NAND     NAND @
 *   NOR      NOR  %
 *   TRUE     TRUE
 *   FALSE    FALSE
 * </pre>
 *
 * <p>Instances are immutable.
 */
public final class Syntax {

  private static final Syntax DEFAULTS =
      builder()
          .spell(Kind.NOT, "NOT", "~", "!")
          .spell(Kind.AND, "AND", "&")
          .spell(Kind.OR, "OR", "|")
          .spell(Kind.IMPLIES, "IMPLIES", "->")
          .spell(Kind.IFF, "IFF", "<->")
          .spell(Kind.XOR, "XOR", "^")
          .spell(Kind.NAND, "NAND", "@")
          .spell(Kind.NOR, "NOR", "%")
          .spell(Kind.TRUE, "TRUE")
          .spell(Kind.FALSE, "FALSE")
          .build();

  private static final Syntax SYMBOLIC =
      DEFAULTS.toBuilder()
          .spell(Kind.NOT, "~", "!", "NOT")
          .spell(Kind.AND, "&", "AND")
          .spell(Kind.OR, "|", "OR")
          .spell(Kind.IMPLIES, "->", "IMPLIES")
          .spell(Kind.IFF, "<->", "IFF")
          .spell(Kind.XOR, "^", "XOR")
          .spell(Kind.NAND, "@", "NAND")
          .spell(Kind.NOR, "%", "NOR")
          .build();

  private final ImmutableMap<Kind, ImmutableList<String>> spellings;
  private final ImmutableMap<String, Kind> keywords;
  private final ImmutableList<Map.Entry<String, Kind>> symbols;

  private Syntax(Map<Kind, ImmutableList<String>> spellings) {
    this.spellings = ImmutableMap.copyOf(spellings);

    final ImmutableMap.Builder<String, Kind> keywords = ImmutableMap.builder();
    final List<Map.Entry<String, Kind>> symbols = new ArrayList<>();
    this.spellings.forEach(
        (kind, words) ->
            words.forEach(
                word -> {
                  if (isIdentifier(word)) {
                    keywords.put(word, kind);
                  } else {
                    symbols.add(Map.entry(word, kind));
                  }
                }));
    this.keywords = keywords.build();
    // longest match first, so that "<->" wins over a shorter symbol sharing its prefix
    symbols.sort(comparingInt((Map.Entry<String, Kind> e) -> e.getKey().length()).reversed());
    this.symbols = ImmutableList.copyOf(symbols);
  }

  /**
   * The default syntax, printing with keyword spellings such as {@code NOT} and {@code IMPLIES}.
   *
   * @return the default syntax
   */
  public static Syntax defaults() {
    return DEFAULTS;
  }

  /**
   * A syntax accepting the same spellings as {@link #defaults()}, but printing with the symbolic
   * ones such as {@code ~} and {@code ->}.
   *
   * @return the symbolic syntax
   */
  public static Syntax symbolic() {
    return SYMBOLIC;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    final Builder builder = new Builder();
    builder.spellings.putAll(spellings);
    return builder;
  }

  /**
   * All accepted spellings of a configurable kind, primary spelling first.
   *
   * @param kind a kind for which {@link Kind#isConfigurable()} holds
   * @return the spellings
   */
  public List<String> spellings(Kind kind) {
    checkArgument(kind.isConfigurable(), "%s has no configurable spelling", kind);
    return spellings.get(kind);
  }

  /** The spelling the {@link Printer} uses for {@code kind}. */
  public String primary(Kind kind) {
    return spellings(kind).get(0);
  }

  /** Whether {@code word} is reserved by this syntax and hence not a valid atom name. */
  public boolean isKeyword(String word) {
    return keywords.containsKey(word);
  }

  Optional<Kind> keyword(String word) {
    return Optional.ofNullable(keywords.get(word));
  }

  /** Symbolic spellings, longest first. */
  List<Map.Entry<String, Kind>> symbols() {
    return symbols;
  }

  static boolean isIdentifier(String word) {
    return Atom.IDENTIFIER.matcher(word).matches();
  }

  static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || (c >= '0' && c <= '9');
  }

  @Override
  public String toString() {
    return "Syntax{" + "spellings=" + spellings + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final Syntax that = (Syntax) o;
    return spellings.equals(that.spellings);
  }

  @Override
  public int hashCode() {
    return spellings.hashCode();
  }

  /** Collects spellings per kind; later calls for the same kind replace earlier ones. */
  public static final class Builder {

    private final Map<Kind, ImmutableList<String>> spellings = new EnumMap<>(Kind.class);

    private Builder() {}

    /**
     * Sets the spellings of {@code kind}, primary spelling first.
     *
     * @param kind a configurable kind
     * @param spellings one or more spellings
     * @return this builder
     */
    public Builder spell(Kind kind, String... spellings) {
      checkNotNull(kind, "kind");
      checkArgument(kind.isConfigurable(), "%s has no configurable spelling", kind);
      checkArgument(spellings.length > 0, "%s needs at least one spelling", kind);
      for (String spelling : spellings) {
        checkSpelling(kind, spelling);
      }
      this.spellings.put(kind, ImmutableList.copyOf(Arrays.asList(spellings)));
      return this;
    }

    /**
     * Builds the syntax.
     *
     * @return a new syntax
     * @throws IllegalArgumentException if a kind has no spelling or a spelling is given twice
     */
    public Syntax build() {
      final Map<String, Kind> owners = new HashMap<>();
      for (Kind kind : Kind.values()) {
        if (!kind.isConfigurable()) {
          continue;
        }
        checkArgument(spellings.containsKey(kind), "No spelling given for %s", kind);
        for (String spelling : spellings.get(kind)) {
          final Kind previous = owners.put(spelling, kind);
          checkArgument(
              previous == null,
              "Spelling '%s' given more than once, for %s and %s",
              spelling,
              previous,
              kind);
        }
      }
      return new Syntax(spellings);
    }

    private static void checkSpelling(Kind kind, String spelling) {
      checkNotNull(spelling, "spelling of %s", kind);
      checkArgument(!spelling.isEmpty(), "Empty spelling for %s", kind);
      if (isIdentifier(spelling)) {
        return;
      }
      final char first = spelling.charAt(0);
      checkArgument(
          !isIdentifierPart(first), "Symbol '%s' for %s starts like an identifier", spelling, kind);
      for (char c : spelling.toCharArray()) {
        checkArgument(
            !Character.isWhitespace(c) && c != '(' && c != ')',
            "Symbol '%s' for %s contains whitespace or a parenthesis",
            spelling,
            kind);
      }
    }
  }
}
