package com.spotify.wff;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Streams;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.stream.Stream;

/**
 * The truth table of a formula: one {@link Row} per assignment over the formula's atoms, in the
 * order of {@link Assignments#of(Formula)}.
 *
 * <p>Rows are computed lazily on every iteration; a table over many atoms is only as expensive as
 * the rows that are actually consumed.
 */
public final class TruthTable implements Iterable<TruthTable.Row> {

  /** One assignment and the value of the formula under it. */
  public record Row(Assignment assignment, boolean value) {

    public Row {
      requireNonNull(assignment, "assignment");
    }

    @Override
    public String toString() {
      return assignment + " -> " + (value ? "T" : "F");
    }
  }

  private final Formula formula;
  private final Iterable<Assignment> assignments;

  private TruthTable(Formula formula) {
    this.formula = formula;
    this.assignments = Assignments.of(formula);
  }

  public static TruthTable of(Formula formula) {
    return new TruthTable(requireNonNull(formula, "formula"));
  }

  public Formula formula() {
    return formula;
  }

  /** The atoms heading the table, in column order. */
  public SortedSet<String> atoms() {
    return formula.atoms();
  }

  public long rowCount() {
    return Assignments.count(formula.atoms().size());
  }

  @Override
  public Iterator<Row> iterator() {
    return Iterables.transform(
            assignments, assignment -> new Row(assignment, Evaluator.evaluate(formula, assignment)))
        .iterator();
  }

  public Stream<Row> stream() {
    return Streams.stream(this);
  }

  /** The output column, top to bottom. */
  public ImmutableList<Boolean> column() {
    return stream().map(Row::value).collect(ImmutableList.toImmutableList());
  }

  /** All rows, computed eagerly. */
  public ImmutableList<Row> rows() {
    return ImmutableList.copyOf(this);
  }

  @Override
  public String toString() {
    return "TruthTable{" + "formula=" + formula + '}';
  }
}
