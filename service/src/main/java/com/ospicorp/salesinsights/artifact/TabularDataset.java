package com.ospicorp.salesinsights.artifact;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Immutable table of text cells with ordered, named columns.
 *
 * <p>Cells are kept as they were read; an empty or missing cell is {@code null}. Numeric and
 * date-like interpretation happens on demand through {@link Cells}. Every transformation
 * returns a new instance.
 */
public final class TabularDataset {
  private final List<String> columns;
  private final List<List<String>> rows;

  private TabularDataset(List<String> columns, List<List<String>> rows) {
    this.columns = columns;
    this.rows = rows;
  }

  /**
   * Builds a dataset, padding short rows with {@code null} cells.
   *
   * @throws IllegalArgumentException if a row is wider than the header
   */
  public static TabularDataset of(List<String> columns, List<? extends List<String>> rows) {
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(rows, "rows");
    List<String> header = List.copyOf(columns);
    List<List<String>> copied = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      if (row.size() > header.size()) {
        throw new IllegalArgumentException(
            "Row has " + row.size() + " cells but header has " + header.size());
      }
      List<String> cells = new ArrayList<>(header.size());
      for (String cell : row) {
        cells.add(cell == null || cell.isEmpty() ? null : cell);
      }
      while (cells.size() < header.size()) {
        cells.add(null);
      }
      copied.add(Collections.unmodifiableList(cells));
    }
    return new TabularDataset(header, Collections.unmodifiableList(copied));
  }

  public List<String> columns() {
    return columns;
  }

  public List<List<String>> rows() {
    return rows;
  }

  public int rowCount() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public boolean hasColumn(String column) {
    return columnIndex(column) >= 0;
  }

  /** Index of the column with exactly this name, or -1. */
  public int columnIndex(String column) {
    return column == null ? -1 : columns.indexOf(column);
  }

  public String value(int row, int columnIndex) {
    return rows.get(row).get(columnIndex);
  }

  public String value(int row, String column) {
    int index = columnIndex(column);
    if (index < 0) {
      throw new IllegalArgumentException("Unknown column: " + column);
    }
    return value(row, index);
  }

  public List<String> column(String column) {
    int index = columnIndex(column);
    if (index < 0) {
      throw new IllegalArgumentException("Unknown column: " + column);
    }
    List<String> values = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      values.add(row.get(index));
    }
    return Collections.unmodifiableList(values);
  }

  /** Keeps the rows at the given indexes, in the order given. */
  public TabularDataset selectRows(List<Integer> indexes) {
    List<List<String>> selected = new ArrayList<>(indexes.size());
    for (int index : indexes) {
      selected.add(rows.get(index));
    }
    return new TabularDataset(columns, Collections.unmodifiableList(selected));
  }

  /** Rewrites every cell of one column; unknown columns leave the dataset unchanged. */
  public TabularDataset mapColumn(String column, UnaryOperator<String> mapper) {
    int index = columnIndex(column);
    if (index < 0) {
      return this;
    }
    List<List<String>> mapped = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      List<String> cells = new ArrayList<>(row);
      String value = mapper.apply(row.get(index));
      cells.set(index, value == null || value.isEmpty() ? null : value);
      mapped.add(Collections.unmodifiableList(cells));
    }
    return new TabularDataset(columns, Collections.unmodifiableList(mapped));
  }

  /** Rows as column-ordered maps, for serializers that work on records. */
  public List<Map<String, String>> toRecords() {
    List<Map<String, String>> records = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      Map<String, String> record = new LinkedHashMap<>();
      for (int i = 0; i < columns.size(); i++) {
        record.put(columns.get(i), row.get(i));
      }
      records.add(record);
    }
    return records;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TabularDataset other)) {
      return false;
    }
    return columns.equals(other.columns) && rows.equals(other.rows);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns, rows);
  }

  @Override
  public String toString() {
    return "TabularDataset" + columns + " (" + rows.size() + " rows)";
  }
}
