package com.ospicorp.salesinsights.series.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.salesinsights.artifact.TabularDataset;
import com.ospicorp.salesinsights.schema.SchemaResolver;
import com.ospicorp.salesinsights.series.model.TimeSeriesPoint;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MonthlyAggregatorTest {

  private final MonthlyAggregator aggregator = new MonthlyAggregator(new SchemaResolver());

  private static TabularDataset rawOrders() {
    return TabularDataset.of(List.of("Order Date", "Category", "Sales"), List.of(
        List.of("2024-06-10", "Furniture", "30"),
        List.of("2024-01-05", "Furniture", "100"),
        List.of("2024-01-20", "Technology", "50")));
  }

  @Test
  void rawRecordsAreSummedPerMonthInAscendingOrder() {
    var series = aggregator.monthlySeries(Optional.empty(), Optional.of(rawOrders())).orElseThrow();

    assertThat(series).containsExactly(
        new TimeSeriesPoint(LocalDate.of(2024, 1, 1), 150d),
        new TimeSeriesPoint(LocalDate.of(2024, 6, 1), 30d));
  }

  @Test
  void precomputedAggregateWinsOverRawRecords() {
    var precomputed = TabularDataset.of(List.of("ds", "y"), List.of(List.of("2023-12-01", "7")));

    var series = aggregator.monthlySeries(Optional.of(precomputed), Optional.of(rawOrders()))
        .orElseThrow();

    assertThat(series).containsExactly(new TimeSeriesPoint(LocalDate.of(2023, 12, 1), 7d));
  }

  @Test
  void precomputedWithoutConventionalNamesUsesLeadingColumns() {
    var precomputed = TabularDataset.of(List.of("month", "total", "note"), List.of(
        List.of("2024-02-01", "10", "a"),
        List.of("2024-03-01", "20", "b")));

    var series = aggregator.fromPrecomputed(precomputed).orElseThrow();

    assertThat(series).extracting(TimeSeriesPoint::value).containsExactly(10d, 20d);
  }

  @Test
  void precomputedDailyRowsAreFlooredAndRegrouped() {
    var precomputed = TabularDataset.of(List.of("ds", "y"), List.of(
        List.of("2024-02-14", "10"),
        List.of("2024-02-28", "5"),
        List.of("2024-03-31", "1")));

    var series = aggregator.fromPrecomputed(precomputed).orElseThrow();

    assertThat(series).containsExactly(
        new TimeSeriesPoint(LocalDate.of(2024, 2, 1), 15d),
        new TimeSeriesPoint(LocalDate.of(2024, 3, 1), 1d));
  }

  @Test
  void monthWithOnlyAbsentValuesStaysAbsent() {
    var precomputed = TabularDataset.of(List.of("ds", "y"), List.of(
        Arrays.asList("2024-01-01", null),
        Arrays.asList("2024-02-01", "n/a"),
        Arrays.asList("2024-02-15", "4")));

    var series = aggregator.fromPrecomputed(precomputed).orElseThrow();

    assertThat(series).containsExactly(
        new TimeSeriesPoint(LocalDate.of(2024, 1, 1), null),
        new TimeSeriesPoint(LocalDate.of(2024, 2, 1), 4d));
  }

  @Test
  void aggregatingAnAlreadyMonthlySeriesIsIdempotent() {
    var first = aggregator.fromRaw(rawOrders()).orElseThrow();
    var asTable = TabularDataset.of(List.of("ds", "y"), first.stream()
        .map(p -> List.of(p.period().toString(), p.value().toString()))
        .toList());

    assertThat(aggregator.fromPrecomputed(asTable)).contains(first);
  }

  @Test
  void unparsableDatesAreDroppedAndNonNumericAmountsCountAsZero() {
    var raw = TabularDataset.of(List.of("date", "amount"), List.of(
        List.of("garbage", "99"),
        List.of("2024-04-02", "abc"),
        List.of("2024-04-03", "8")));

    var series = aggregator.fromRaw(raw).orElseThrow();

    assertThat(series).containsExactly(new TimeSeriesPoint(LocalDate.of(2024, 4, 1), 8d));
  }

  @Test
  void rawRecordsWithoutAmountYieldNoSeries() {
    var raw = TabularDataset.of(List.of("Order Date", "Quantity"), List.of(List.of("2024-01-01", "3")));

    assertThat(aggregator.monthlySeries(Optional.empty(), Optional.of(raw))).isEmpty();
  }

  @Test
  void singleColumnAggregateFallsBackToRaw() {
    var precomputed = TabularDataset.of(List.of("ds"), List.of(List.of("2024-01-01")));

    var series = aggregator.monthlySeries(Optional.of(precomputed), Optional.of(rawOrders()));

    assertThat(series).hasValueSatisfying(s -> assertThat(s).hasSize(2));
  }

  @Test
  void nothingAvailableYieldsNoSeries() {
    assertThat(aggregator.monthlySeries(Optional.empty(), Optional.empty())).isEmpty();
  }

  @Test
  void windowKeepsInclusiveRange() {
    var series = List.of(
        new TimeSeriesPoint(LocalDate.of(2024, 1, 1), 1d),
        new TimeSeriesPoint(LocalDate.of(2024, 2, 1), 2d),
        new TimeSeriesPoint(LocalDate.of(2024, 3, 1), 3d));

    assertThat(MonthlyAggregator.window(series, LocalDate.of(2024, 2, 1), LocalDate.of(2024, 3, 1)))
        .extracting(TimeSeriesPoint::value).containsExactly(2d, 3d);
    assertThat(MonthlyAggregator.window(series, null, LocalDate.of(2024, 1, 1))).hasSize(1);
    assertThatThrownBy(() -> MonthlyAggregator.window(series, LocalDate.of(2024, 3, 1),
        LocalDate.of(2024, 1, 1))).isInstanceOf(IllegalArgumentException.class);
  }
}
