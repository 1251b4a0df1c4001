package com.spotify.wff;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * An immutable binding of atom names to truth values.
 *
 * <p>An assignment is total over a formula if it binds every atom of {@link Formula#atoms()}; it
 * may bind additional atoms.
 */
public final class Assignment {

  private static final Assignment EMPTY = new Assignment(ImmutableSortedMap.of());

  private final ImmutableSortedMap<String, Boolean> values;

  private Assignment(ImmutableSortedMap<String, Boolean> values) {
    this.values = values;
  }

  public static Assignment empty() {
    return EMPTY;
  }

  /**
   * Creates an assignment from a map of atom names to values.
   *
   * @throws IllegalArgumentException if a key is not a valid atom name
   * @throws NullPointerException if a key or value is null
   */
  public static Assignment of(Map<String, Boolean> values) {
    requireNonNull(values, "values");
    values.keySet().forEach(Assignment::checkAtomName);
    return new Assignment(ImmutableSortedMap.copyOf(values));
  }

  public static Assignment of(String atom, boolean value) {
    return builder().put(atom, value).build();
  }

  public static Assignment of(String atom1, boolean value1, String atom2, boolean value2) {
    return builder().put(atom1, value1).put(atom2, value2).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The value bound to {@code atom}, or empty if the atom is unbound. */
  public Optional<Boolean> value(String atom) {
    return Optional.ofNullable(values.get(atom));
  }

  public boolean binds(String atom) {
    return values.containsKey(atom);
  }

  /** Whether every atom of {@code formula} is bound. */
  public boolean isTotalOver(Formula formula) {
    return values.keySet().containsAll(formula.atoms());
  }

  public SortedSet<String> atoms() {
    return values.keySet();
  }

  public int size() {
    return values.size();
  }

  public SortedMap<String, Boolean> asMap() {
    return values;
  }

  /** A copy of this assignment with {@code atom} bound to {@code value}. */
  public Assignment with(String atom, boolean value) {
    checkAtomName(atom);
    final Map<String, Boolean> copy = new TreeMap<>(values);
    copy.put(atom, value);
    return new Assignment(ImmutableSortedMap.copyOf(copy));
  }

  private static void checkAtomName(String atom) {
    requireNonNull(atom, "atom");
    checkArgument(Atom.IDENTIFIER.matcher(atom).matches(), "Invalid atom name '%s'", atom);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final Assignment that = (Assignment) o;
    return values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.entrySet().stream()
        .map(e -> e.getKey() + "=" + (e.getValue() ? "T" : "F"))
        .collect(Collectors.joining(", ", "{", "}"));
  }

  public static final class Builder {

    private final ImmutableSortedMap.Builder<String, Boolean> values =
        ImmutableSortedMap.naturalOrder();

    private Builder() {}

    public Builder put(String atom, boolean value) {
      checkAtomName(atom);
      values.put(atom, value);
      return this;
    }

    /**
     * Builds the assignment.
     *
     * @throws IllegalArgumentException if an atom was put more than once
     */
    public Assignment build() {
      return new Assignment(values.buildOrThrow());
    }
  }
}
