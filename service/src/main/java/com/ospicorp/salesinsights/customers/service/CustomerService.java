package com.ospicorp.salesinsights.customers.service;

import com.ospicorp.salesinsights.artifact.ArtifactCatalog;
import com.ospicorp.salesinsights.artifact.ArtifactKind;
import com.ospicorp.salesinsights.artifact.Cells;
import com.ospicorp.salesinsights.artifact.TabularDataset;
import com.ospicorp.salesinsights.customers.service.CustomerOverview.SegmentCount;
import com.ospicorp.salesinsights.filter.FilterPredicate;
import com.ospicorp.salesinsights.filter.RecordFilterEngine;
import com.ospicorp.salesinsights.schema.Concept;
import com.ospicorp.salesinsights.schema.SchemaResolver;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class CustomerService {

  private final ArtifactCatalog catalog;
  private final SchemaResolver resolver;
  private final RecordFilterEngine filterEngine;

  public CustomerService(ArtifactCatalog catalog, SchemaResolver resolver,
      RecordFilterEngine filterEngine) {
    this.catalog = catalog;
    this.resolver = resolver;
    this.filterEngine = filterEngine;
  }

  public Optional<TabularDataset> profiles() {
    return catalog.load(ArtifactKind.SEGMENT_PROFILE);
  }

  public Optional<TabularDataset> explore(CustomerQuery query) {
    return catalog.load(ArtifactKind.CUSTOMER_SEGMENTS)
        .map(customers -> explore(customers, query));
  }

  TabularDataset explore(TabularDataset customers, CustomerQuery query) {
    TabularDataset filtered = filterEngine.apply(customers, predicates(customers, query));
    Optional<String> lastOrder = resolver.resolve(filtered, Concept.LAST_ORDER);
    if (lastOrder.isEmpty()) {
      return filtered;
    }
    return filtered.mapColumn(lastOrder.get(), CustomerService::isoDate);
  }

  List<FilterPredicate> predicates(TabularDataset customers, CustomerQuery query) {
    List<FilterPredicate> predicates = new ArrayList<>();
    String segment = query.segment();
    if (StringUtils.hasText(segment) && !CustomerQuery.ALL_SEGMENTS.equals(segment)) {
      resolver.resolve(customers, Concept.SEGMENT)
          .ifPresent(column -> predicates.add(FilterPredicate.equalTo(column, segment)));
    }
    if (query.recencyMin() != null || query.recencyMax() != null) {
      resolver.resolve(customers, Concept.RECENCY).ifPresent(column -> predicates.add(
          FilterPredicate.between(column, query.recencyMin(), query.recencyMax())));
    }
    if (query.salesMin() != null || query.salesMax() != null) {
      resolver.resolve(customers, Concept.AMOUNT).ifPresent(column -> predicates.add(
          FilterPredicate.between(column, query.salesMin(), query.salesMax())));
    }
    if (StringUtils.hasText(query.search())) {
      resolver.resolve(customers, Concept.CUSTOMER_ID).ifPresent(column -> predicates.add(
          FilterPredicate.containing(column, query.search().trim())));
    }
    return predicates;
  }

  public Optional<FilterOptions> filterOptions() {
    return catalog.load(ArtifactKind.CUSTOMER_SEGMENTS).map(this::filterOptions);
  }

  FilterOptions filterOptions(TabularDataset customers) {
    List<String> segments = resolver.resolve(customers, Concept.SEGMENT)
        .map(column -> distinctSorted(customers.column(column)))
        .orElse(null);

    Integer recencyMin = null;
    Integer recencyMax = null;
    Optional<double[]> recency = resolver.resolve(customers, Concept.RECENCY)
        .flatMap(column -> numericBounds(customers.column(column)));
    if (recency.isPresent()) {
      recencyMin = (int) Math.max(0d, recency.get()[0]);
      recencyMax = (int) Math.max(recencyMin, recency.get()[1]);
    }

    Optional<double[]> sales = resolver.resolve(customers, Concept.AMOUNT)
        .flatMap(column -> numericBounds(customers.column(column)));
    return new FilterOptions(segments, recencyMin, recencyMax,
        sales.map(bounds -> bounds[0]).orElse(null),
        sales.map(bounds -> bounds[1]).orElse(null));
  }

  public CustomerOverview overview() {
    return catalog.load(ArtifactKind.CUSTOMER_SEGMENTS)
        .map(this::overview)
        .orElseGet(() -> new CustomerOverview(null, null, null, null));
  }

  CustomerOverview overview(TabularDataset customers) {
    Double totalSales = resolver.resolve(customers, Concept.AMOUNT)
        .map(column -> sum(customers.column(column)))
        .orElse(null);
    Long totalOrders = resolver.resolve(customers, Concept.ORDER_COUNT)
        .map(column -> Math.round(sum(customers.column(column))))
        .orElse(null);
    List<SegmentCount> share = resolver.resolve(customers, Concept.SEGMENT)
        .map(column -> segmentCounts(customers.column(column)))
        .orElse(null);
    return new CustomerOverview(customers.rowCount(), totalSales, totalOrders, share);
  }

  private static List<String> distinctSorted(List<String> values) {
    TreeSet<String> distinct = new TreeSet<>();
    for (String value : values) {
      if (value != null) {
        distinct.add(value);
      }
    }
    return List.copyOf(distinct);
  }

  /** Min and max when every present cell is numeric and at least one is present. */
  private static Optional<double[]> numericBounds(List<String> values) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    boolean seen = false;
    for (String value : values) {
      if (value == null) {
        continue;
      }
      Double number = Cells.number(value);
      if (number == null) {
        return Optional.empty();
      }
      min = Math.min(min, number);
      max = Math.max(max, number);
      seen = true;
    }
    return seen ? Optional.of(new double[] {min, max}) : Optional.empty();
  }

  private static double sum(List<String> values) {
    double total = 0d;
    for (String value : values) {
      Double number = Cells.number(value);
      if (number != null) {
        total += number;
      }
    }
    return total;
  }

  private static List<SegmentCount> segmentCounts(List<String> values) {
    Map<String, Integer> counts = new TreeMap<>();
    for (String value : values) {
      if (value != null) {
        counts.merge(value, 1, Integer::sum);
      }
    }
    List<SegmentCount> out = new ArrayList<>(counts.size());
    counts.forEach((segment, count) -> out.add(new SegmentCount(segment, count)));
    return out;
  }

  private static String isoDate(String cell) {
    LocalDate date = Cells.date(cell);
    return date == null ? null : date.toString();
  }
}
