package com.ospicorp.salesinsights.series.service;

import com.ospicorp.salesinsights.artifact.Cells;
import com.ospicorp.salesinsights.artifact.TabularDataset;
import com.ospicorp.salesinsights.schema.Concept;
import com.ospicorp.salesinsights.schema.SchemaResolver;
import com.ospicorp.salesinsights.series.model.TimeSeriesPoint;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the canonical monthly (period, value) series. A precomputed monthly aggregate wins;
 * otherwise the series is derived from raw order records. Inability to produce a series is
 * reported as an empty result.
 */
@Component
public class MonthlyAggregator {
  private static final Logger log = LoggerFactory.getLogger(MonthlyAggregator.class);
  static final String PERIOD_COLUMN = "ds";
  static final String VALUE_COLUMN = "y";

  private final SchemaResolver resolver;

  public MonthlyAggregator(SchemaResolver resolver) {
    this.resolver = resolver;
  }

  public Optional<List<TimeSeriesPoint>> monthlySeries(Optional<TabularDataset> precomputed,
      Optional<TabularDataset> raw) {
    if (precomputed.isPresent()) {
      if (precomputed.get().columns().size() >= 2) {
        return fromPrecomputed(precomputed.get());
      }
      log.info("Schema mismatch: monthly aggregate has columns {}, deriving from raw records",
          precomputed.get().columns());
    }
    return raw.flatMap(this::fromRaw);
  }

  /** Normalizes an already-monthly table; re-flooring makes this safe for daily input too. */
  public Optional<List<TimeSeriesPoint>> fromPrecomputed(TabularDataset dataset) {
    List<String> columns = dataset.columns();
    String periodColumn;
    String valueColumn;
    if (dataset.hasColumn(PERIOD_COLUMN) && dataset.hasColumn(VALUE_COLUMN)) {
      periodColumn = PERIOD_COLUMN;
      valueColumn = VALUE_COLUMN;
    } else if (columns.size() >= 2) {
      periodColumn = columns.get(0);
      valueColumn = columns.get(1);
    } else {
      log.info("Schema mismatch: monthly aggregate needs two columns, found {}", columns);
      return Optional.empty();
    }

    int periodIndex = dataset.columnIndex(periodColumn);
    int valueIndex = dataset.columnIndex(valueColumn);
    Map<LocalDate, Double> buckets = new TreeMap<>();
    int dropped = 0;
    for (int row = 0; row < dataset.rowCount(); row++) {
      LocalDate date = Cells.date(dataset.value(row, periodIndex));
      if (date == null) {
        dropped++;
        continue;
      }
      LocalDate month = monthStart(date);
      Double value = Cells.number(dataset.value(row, valueIndex));
      // a month with only absent values stays absent
      buckets.put(month, buckets.containsKey(month) ? addNullable(buckets.get(month), value) : value);
    }
    logDropped(dropped, "monthly aggregate");
    return toSeries(buckets);
  }

  public Optional<List<TimeSeriesPoint>> fromRaw(TabularDataset dataset) {
    Optional<String> dateColumn = resolver.resolve(dataset, Concept.DATE);
    Optional<String> amountColumn = resolver.resolve(dataset, Concept.AMOUNT);
    if (dateColumn.isEmpty() || amountColumn.isEmpty()) {
      log.info("Schema mismatch: raw records lack a {} column (columns {})",
          dateColumn.isEmpty() ? "date" : "amount", dataset.columns());
      return Optional.empty();
    }

    int dateIndex = dataset.columnIndex(dateColumn.get());
    int amountIndex = dataset.columnIndex(amountColumn.get());
    Map<LocalDate, Double> buckets = new TreeMap<>();
    int dropped = 0;
    for (int row = 0; row < dataset.rowCount(); row++) {
      LocalDate date = Cells.date(dataset.value(row, dateIndex));
      if (date == null) {
        dropped++;
        continue;
      }
      Double amount = Cells.number(dataset.value(row, amountIndex));
      buckets.merge(monthStart(date), amount == null ? 0d : amount, Double::sum);
    }
    logDropped(dropped, "raw records");
    return toSeries(buckets);
  }

  /** Points whose period lies within [start, end]; null bounds are open. */
  public static List<TimeSeriesPoint> window(List<TimeSeriesPoint> series, LocalDate start,
      LocalDate end) {
    if (start != null && end != null && start.isAfter(end)) {
      throw new IllegalArgumentException("start must be before or equal to end");
    }
    List<TimeSeriesPoint> out = new ArrayList<>(series.size());
    for (TimeSeriesPoint point : series) {
      LocalDate period = point.period();
      if ((start == null || !period.isBefore(start)) && (end == null || !period.isAfter(end))) {
        out.add(point);
      }
    }
    return out;
  }

  public static LocalDate monthStart(LocalDate date) {
    return date.with(TemporalAdjusters.firstDayOfMonth());
  }

  private static Double addNullable(Double a, Double b) {
    if (a == null) return b;
    if (b == null) return a;
    return a + b;
  }

  private static Optional<List<TimeSeriesPoint>> toSeries(Map<LocalDate, Double> buckets) {
    if (buckets.isEmpty()) {
      return Optional.empty();
    }
    List<TimeSeriesPoint> out = new ArrayList<>(buckets.size());
    for (var e : buckets.entrySet()) {
      out.add(new TimeSeriesPoint(e.getKey(), e.getValue()));
    }
    return Optional.of(List.copyOf(out));
  }

  private static void logDropped(int dropped, String source) {
    if (dropped > 0) {
      log.info("Dropped {} rows with unparsable dates from {}", dropped, source);
    }
  }
}
