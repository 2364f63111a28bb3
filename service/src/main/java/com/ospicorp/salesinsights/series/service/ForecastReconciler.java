package com.ospicorp.salesinsights.series.service;

import com.ospicorp.salesinsights.artifact.Cells;
import com.ospicorp.salesinsights.artifact.TabularDataset;
import com.ospicorp.salesinsights.series.model.Forecast;
import com.ospicorp.salesinsights.series.model.ForecastPoint;
import com.ospicorp.salesinsights.series.model.ForecastSource;
import com.ospicorp.salesinsights.series.model.TimeSeriesPoint;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Chooses the forecast shown next to the actuals: an externally computed forecast when its
 * file has the expected shape, otherwise a flat rolling-mean extrapolation with a fixed band.
 *
 * <p>The fallback is a placeholder for a missing model.
 */
@Component
public class ForecastReconciler {
  private static final Logger log = LoggerFactory.getLogger(ForecastReconciler.class);

  static final String PERIOD = "ds";
  static final String ESTIMATE = "yhat";
  static final String LOWER = "yhat_lower";
  static final String UPPER = "yhat_upper";
  static final int BASELINE_WINDOW = 6;
  static final double LOWER_FACTOR = 0.95;
  static final double UPPER_FACTOR = 1.05;

  public Optional<Forecast> reconcile(Optional<TabularDataset> external,
      Optional<List<TimeSeriesPoint>> actuals, int horizon) {
    Optional<List<ForecastPoint>> validated = external.flatMap(this::validateExternal);
    if (validated.isPresent()) {
      return Optional.of(new Forecast(ForecastSource.EXTERNAL, validated.get()));
    }
    if (actuals.isPresent()) {
      return Optional.of(new Forecast(ForecastSource.FALLBACK,
          fallbackForecast(actuals.get(), horizon)));
    }
    log.info("No external forecast and no actuals; no forecast available");
    return Optional.empty();
  }

  public Optional<List<ForecastPoint>> validateExternal(TabularDataset dataset) {
    if (dataset == null) {
      return Optional.empty();
    }
    for (String required : List.of(PERIOD, ESTIMATE, LOWER, UPPER)) {
      if (!dataset.hasColumn(required)) {
        log.info("Schema mismatch: external forecast lacks column '{}' (columns {})", required,
            dataset.columns());
        return Optional.empty();
      }
    }

    int periodIndex = dataset.columnIndex(PERIOD);
    int estimateIndex = dataset.columnIndex(ESTIMATE);
    int lowerIndex = dataset.columnIndex(LOWER);
    int upperIndex = dataset.columnIndex(UPPER);
    List<ForecastPoint> points = new ArrayList<>(dataset.rowCount());
    int badDates = 0;
    int badValues = 0;
    for (int row = 0; row < dataset.rowCount(); row++) {
      LocalDate period = Cells.date(dataset.value(row, periodIndex));
      if (period == null) {
        badDates++;
        continue;
      }
      Double estimate = Cells.number(dataset.value(row, estimateIndex));
      Double lower = Cells.number(dataset.value(row, lowerIndex));
      Double upper = Cells.number(dataset.value(row, upperIndex));
      if (estimate == null || lower == null || upper == null
          || lower > estimate || estimate > upper) {
        badValues++;
        continue;
      }
      points.add(new ForecastPoint(period, estimate, lower, upper));
    }
    if (badDates > 0 || badValues > 0) {
      log.warn("External forecast: dropped {} rows with unparsable periods and {} rows with "
          + "missing or inverted bounds", badDates, badValues);
    }
    if (points.isEmpty()) {
      return Optional.empty();
    }
    points.sort(Comparator.comparing(ForecastPoint::period));
    return Optional.of(List.copyOf(points));
  }

  /**
   * Flat forecast at the mean of the last six observed values, with a +/-5% band.
   *
   * @throws InsufficientDataException if the series has no numeric value at all
   * @throws IllegalArgumentException if {@code horizon} is negative
   */
  public List<ForecastPoint> fallbackForecast(List<TimeSeriesPoint> series, int horizon) {
    if (horizon < 0) {
      throw new IllegalArgumentException("horizon must not be negative");
    }
    List<Double> observed = new ArrayList<>(series.size());
    LocalDate last = null;
    for (TimeSeriesPoint point : series) {
      if (point.value() != null && Double.isFinite(point.value())) {
        observed.add(point.value());
      }
      if (point.period() != null && (last == null || point.period().isAfter(last))) {
        last = point.period();
      }
    }
    if (observed.isEmpty() || last == null) {
      throw new InsufficientDataException(
          "Cannot compute a baseline forecast: the monthly series has no numeric values",
          series.size());
    }

    List<Double> window = observed.subList(Math.max(0, observed.size() - BASELINE_WINDOW),
        observed.size());
    double baseline = 0d;
    for (double value : window) {
      baseline += value;
    }
    baseline /= window.size();

    double low = baseline * LOWER_FACTOR;
    double high = baseline * UPPER_FACTOR;
    LocalDate start = MonthlyAggregator.monthStart(last).plusMonths(1);
    List<ForecastPoint> out = new ArrayList<>(horizon);
    for (int i = 0; i < horizon; i++) {
      out.add(new ForecastPoint(start.plusMonths(i), baseline, Math.min(low, high),
          Math.max(low, high)));
    }
    log.debug("Fallback forecast: baseline {} over {} values, {} months from {}", baseline,
        window.size(), horizon, start);
    return out;
  }
}
