package com.ospicorp.salesinsights.series.service;

import com.ospicorp.salesinsights.artifact.Cells;
import com.ospicorp.salesinsights.artifact.TabularDataset;
import com.ospicorp.salesinsights.schema.Concept;
import com.ospicorp.salesinsights.schema.SchemaResolver;
import com.ospicorp.salesinsights.series.model.BreakdownRow;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Sales totals per category or region, read from an aggregate or summed from raw orders. */
@Component
public class BreakdownAggregator {
  private static final Logger log = LoggerFactory.getLogger(BreakdownAggregator.class);
  static final String TOTAL_COLUMN = "total_sales";

  private final SchemaResolver resolver;

  public BreakdownAggregator(SchemaResolver resolver) {
    this.resolver = resolver;
  }

  public Optional<List<BreakdownRow>> totals(Optional<TabularDataset> precomputed,
      Optional<TabularDataset> raw, Concept dimension) {
    if (dimension != Concept.CATEGORY && dimension != Concept.REGION) {
      throw new IllegalArgumentException("Unsupported breakdown dimension: " + dimension);
    }
    if (precomputed.isPresent() && !precomputed.get().isEmpty()) {
      Optional<List<BreakdownRow>> rows = fromPrecomputed(precomputed.get(), dimension);
      if (rows.isPresent()) {
        return rows;
      }
    }
    return raw.flatMap(dataset -> fromRaw(dataset, dimension));
  }

  Optional<List<BreakdownRow>> fromPrecomputed(TabularDataset dataset, Concept dimension) {
    List<String> columns = dataset.columns();
    String exactKey = dimension.name().toLowerCase(Locale.ROOT);
    Optional<String> keyColumn = dataset.hasColumn(exactKey)
        ? Optional.of(exactKey)
        : resolver.resolve(dataset, dimension);
    Optional<String> totalColumn = dataset.hasColumn(TOTAL_COLUMN)
        ? Optional.of(TOTAL_COLUMN)
        : resolver.resolve(dataset, Concept.AMOUNT);
    if (keyColumn.isEmpty() && !columns.isEmpty()) {
      keyColumn = Optional.of(columns.get(0));
    }
    if (totalColumn.isEmpty() && columns.size() >= 2) {
      totalColumn = Optional.of(columns.get(1));
    }
    if (keyColumn.isEmpty() || totalColumn.isEmpty()) {
      log.info("Schema mismatch: {} aggregate has columns {}", exactKey, columns);
      return Optional.empty();
    }

    int keyIndex = dataset.columnIndex(keyColumn.get());
    int totalIndex = dataset.columnIndex(totalColumn.get());
    List<BreakdownRow> rows = new ArrayList<>(dataset.rowCount());
    for (int row = 0; row < dataset.rowCount(); row++) {
      String key = dataset.value(row, keyIndex);
      if (key != null) {
        rows.add(new BreakdownRow(key, Cells.number(dataset.value(row, totalIndex))));
      }
    }
    rows.sort((a, b) -> a.key().compareTo(b.key()));
    return rows.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(rows));
  }

  Optional<List<BreakdownRow>> fromRaw(TabularDataset dataset, Concept dimension) {
    Optional<String> keyColumn = resolver.resolve(dataset, dimension);
    Optional<String> amountColumn = resolver.resolve(dataset, Concept.AMOUNT);
    if (keyColumn.isEmpty() || amountColumn.isEmpty()) {
      log.info("Schema mismatch: raw records cannot be grouped by {} (columns {})",
          dimension, dataset.columns());
      return Optional.empty();
    }

    int keyIndex = dataset.columnIndex(keyColumn.get());
    int amountIndex = dataset.columnIndex(amountColumn.get());
    Map<String, Double> sums = new TreeMap<>();
    for (int row = 0; row < dataset.rowCount(); row++) {
      String key = dataset.value(row, keyIndex);
      if (key == null) {
        continue;
      }
      Double amount = Cells.number(dataset.value(row, amountIndex));
      sums.merge(key, amount == null ? 0d : amount, Double::sum);
    }
    if (sums.isEmpty()) {
      return Optional.empty();
    }
    List<BreakdownRow> rows = new ArrayList<>(sums.size());
    sums.forEach((key, total) -> rows.add(new BreakdownRow(key, total)));
    return Optional.of(List.copyOf(rows));
  }
}
