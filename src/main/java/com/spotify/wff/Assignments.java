package com.spotify.wff;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Streams;
import java.util.Collection;
import java.util.stream.Stream;

/**
 * Enumerates all total assignments over a set of atoms.
 *
 * <p>For {@code n} atoms in sorted order the sequence has {@code 2^n} elements. Element {@code i}
 * binds the atom at sorted index {@code k} to bit {@code n-1-k} of {@code i}, with {@code 0} for
 * false and {@code 1} for true: the alphabetically first atom is the most significant bit. For
 * atoms {@code p, q} the order is {@code (F,F) (F,T) (T,F) (T,T)}. With no atoms the sequence is
 * the single empty assignment.
 *
 * <p>The returned iterables are lazy and can be iterated any number of times; every iteration
 * starts over and produces fresh {@link Assignment} values.
 */
public final class Assignments {

  /** Largest atom count whose assignment count fits a {@code long}. */
  public static final int MAX_ATOMS = 62;

  private Assignments() {}

  /** All total assignments over the atoms of {@code formula}. */
  public static Iterable<Assignment> of(Formula formula) {
    return over(requireNonNull(formula, "formula").atoms());
  }

  /**
   * All total assignments over {@code atoms}. Duplicates are ignored and the atoms are sorted.
   *
   * @throws IllegalArgumentException if there are more than {@link #MAX_ATOMS} distinct atoms
   */
  public static Iterable<Assignment> over(Collection<String> atoms) {
    final ImmutableList<String> sorted =
        ImmutableSortedSet.copyOf(requireNonNull(atoms, "atoms")).asList();
    checkArgument(
        sorted.size() <= MAX_ATOMS,
        "Cannot enumerate assignments over %s atoms, at most %s are supported",
        sorted.size(),
        MAX_ATOMS);
    return () -> new AssignmentIterator(sorted);
  }

  public static Stream<Assignment> stream(Formula formula) {
    return Streams.stream(of(formula));
  }

  public static Stream<Assignment> stream(Collection<String> atoms) {
    return Streams.stream(over(atoms));
  }

  /** Number of total assignments over {@code atomCount} atoms. */
  public static long count(int atomCount) {
    checkArgument(atomCount >= 0 && atomCount <= MAX_ATOMS, "Invalid atom count %s", atomCount);
    return 1L << atomCount;
  }

  private static final class AssignmentIterator extends AbstractIterator<Assignment> {

    private final ImmutableList<String> atoms;
    private final long end;
    private long counter = 0;

    private AssignmentIterator(ImmutableList<String> atoms) {
      this.atoms = atoms;
      this.end = count(atoms.size());
    }

    @Override
    protected Assignment computeNext() {
      if (counter == end) {
        return endOfData();
      }
      final int n = atoms.size();
      final Assignment.Builder assignment = Assignment.builder();
      for (int k = 0; k < n; k++) {
        assignment.put(atoms.get(k), ((counter >>> (n - 1 - k)) & 1L) == 1L);
      }
      counter++;
      return assignment.build();
    }
  }
}
