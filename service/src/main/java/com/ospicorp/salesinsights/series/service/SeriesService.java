package com.ospicorp.salesinsights.series.service;

import com.ospicorp.salesinsights.artifact.ArtifactCatalog;
import com.ospicorp.salesinsights.artifact.ArtifactKind;
import com.ospicorp.salesinsights.schema.Concept;
import com.ospicorp.salesinsights.series.model.BreakdownRow;
import com.ospicorp.salesinsights.series.model.Forecast;
import com.ospicorp.salesinsights.series.model.TimeSeriesPoint;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class SeriesService {

  private final ArtifactCatalog catalog;
  private final MonthlyAggregator aggregator;
  private final BreakdownAggregator breakdowns;
  private final ForecastReconciler reconciler;

  public SeriesService(ArtifactCatalog catalog, MonthlyAggregator aggregator,
      BreakdownAggregator breakdowns, ForecastReconciler reconciler) {
    this.catalog = catalog;
    this.aggregator = aggregator;
    this.breakdowns = breakdowns;
    this.reconciler = reconciler;
  }

  public Optional<List<TimeSeriesPoint>> monthlyActuals() {
    return aggregator.monthlySeries(
        catalog.load(ArtifactKind.MONTHLY_AGGREGATE),
        catalog.load(ArtifactKind.RAW_TRANSACTIONS));
  }

  public Optional<List<TimeSeriesPoint>> monthlyActuals(LocalDate start, LocalDate end) {
    return monthlyActuals().map(series -> MonthlyAggregator.window(series, start, end));
  }

  /**
   * @throws InsufficientDataException when the fallback is needed but the actuals carry no
   *     numeric values
   */
  public Optional<Forecast> forecast(int horizon) {
    return reconciler.reconcile(catalog.load(ArtifactKind.EXTERNAL_FORECAST), monthlyActuals(),
        horizon);
  }

  public Optional<List<BreakdownRow>> breakdown(Concept dimension) {
    ArtifactKind aggregate = switch (dimension) {
      case CATEGORY -> ArtifactKind.CATEGORY_AGGREGATE;
      case REGION -> ArtifactKind.REGION_AGGREGATE;
      default -> throw new IllegalArgumentException("Unsupported breakdown dimension: " + dimension);
    };
    return breakdowns.totals(catalog.load(aggregate), catalog.load(ArtifactKind.RAW_TRANSACTIONS),
        dimension);
  }
}
