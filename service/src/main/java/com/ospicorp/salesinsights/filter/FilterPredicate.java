package com.ospicorp.salesinsights.filter;

import com.ospicorp.salesinsights.artifact.Cells;
import com.ospicorp.salesinsights.artifact.TabularDataset;
import java.util.Locale;
import java.util.Objects;

/**
 * One condition on one column. A predicate whose column is not in the dataset keeps every
 * row, so callers can pass predicates for optional columns without checking first.
 */
public sealed interface FilterPredicate
    permits FilterPredicate.Equals, FilterPredicate.Range, FilterPredicate.Contains {

  String column();

  /** True when the predicate cannot exclude any row of this dataset. */
  boolean isNoOp(TabularDataset dataset);

  /** Tests one cell of the predicate's column. Only called when {@link #isNoOp} is false. */
  boolean test(String cell);

  static Equals equalTo(String column, String value) {
    return new Equals(column, value);
  }

  static Range between(String column, Double min, Double max) {
    return new Range(column, min, max);
  }

  static Contains containing(String column, String substring) {
    return new Contains(column, substring);
  }

  /** String equality after trimming both sides; an absent cell reads as "". */
  record Equals(String column, String value) implements FilterPredicate {
    public Equals {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isNoOp(TabularDataset dataset) {
      return !dataset.hasColumn(column);
    }

    @Override
    public boolean test(String cell) {
      return Cells.text(cell).equals(value.trim());
    }
  }

  /** Inclusive numeric range; a null bound is open. Non-numeric cells never match. */
  record Range(String column, Double min, Double max) implements FilterPredicate {
    public Range {
      Objects.requireNonNull(column, "column");
      if (min != null && max != null && min > max) {
        throw new IllegalArgumentException("min must be less than or equal to max");
      }
    }

    @Override
    public boolean isNoOp(TabularDataset dataset) {
      return !dataset.hasColumn(column);
    }

    @Override
    public boolean test(String cell) {
      Double value = Cells.number(cell);
      if (value == null) return false;
      return (min == null || value >= min) && (max == null || value <= max);
    }
  }

  /** Case-insensitive, unanchored substring match. */
  record Contains(String column, String substring) implements FilterPredicate {
    public Contains {
      Objects.requireNonNull(column, "column");
    }

    @Override
    public boolean isNoOp(TabularDataset dataset) {
      return substring == null || substring.isBlank() || !dataset.hasColumn(column);
    }

    @Override
    public boolean test(String cell) {
      return cell != null
          && cell.toLowerCase(Locale.ROOT).contains(substring.trim().toLowerCase(Locale.ROOT));
    }
  }
}
