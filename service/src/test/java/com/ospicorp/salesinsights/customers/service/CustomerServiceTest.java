package com.ospicorp.salesinsights.customers.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.salesinsights.artifact.ArtifactCache;
import com.ospicorp.salesinsights.artifact.ArtifactCatalog;
import com.ospicorp.salesinsights.artifact.ArtifactLoader;
import com.ospicorp.salesinsights.artifact.TabularDataset;
import com.ospicorp.salesinsights.customers.service.CustomerOverview.SegmentCount;
import com.ospicorp.salesinsights.filter.RecordFilterEngine;
import com.ospicorp.salesinsights.schema.SchemaResolver;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CustomerServiceTest {

  @TempDir
  Path dir;

  private CustomerService service() {
    var catalog = new ArtifactCatalog(new ArtifactCache(new ArtifactLoader()), dir.toString(),
        "outputs", "data");
    return new CustomerService(catalog, new SchemaResolver(), new RecordFilterEngine());
  }

  private static TabularDataset customers() {
    return TabularDataset.of(
        List.of("customer_id", "segment", "recency_days", "total_sales", "order_count", "last_order"),
        List.of(
            List.of("CG-12520", "Champions", "10", "1500.5", "12", "2024-06-01"),
            List.of("DV-13045", "At Risk", "200", "300", "3", "11/08/2023"),
            List.of("SO-20335", "Champions", "35", "900", "8", "2024-05-20"),
            List.of("BH-11710", "Hibernating", "400", "50", "1", "2023-01-15")));
  }

  @Test
  void allSegmentAndNoBoundsKeepsEveryCustomer() {
    var query = new CustomerQuery(CustomerQuery.ALL_SEGMENTS, null, null, null, null, "  ");

    assertThat(service().explore(customers(), query).rowCount()).isEqualTo(4);
  }

  @Test
  void segmentAndRecencyCombine() {
    var query = new CustomerQuery("Champions", null, 30d, null, null, null);

    TabularDataset out = service().explore(customers(), query);

    assertThat(out.column("customer_id")).containsExactly("CG-12520");
  }

  @Test
  void searchMatchesCustomerIdSubstring() {
    var query = new CustomerQuery(null, null, null, 100d, null, "0");

    assertThat(service().explore(customers(), query).column("customer_id"))
        .containsExactly("CG-12520", "DV-13045", "SO-20335");
  }

  @Test
  void lastOrderIsRenderedAsIsoDate() {
    TabularDataset out = service().explore(customers(), CustomerQuery.none());

    assertThat(out.column("last_order"))
        .containsExactly("2024-06-01", "2023-11-08", "2024-05-20", "2023-01-15");
  }

  @Test
  void orderDateColumnIsRenderedAsIsoDate() {
    var customers = TabularDataset.of(List.of("customer_id", "Order Date"), List.of(
        List.of("CG-12520", "06/01/2024"),
        List.of("DV-13045", "2023-11-08 00:00:00+00:00")));

    TabularDataset out = service().explore(customers, CustomerQuery.none());

    assertThat(out.column("Order Date")).containsExactly("2024-06-01", "2023-11-08");
  }

  @Test
  void filterOptionsCoverSegmentsAndNumericBounds() {
    FilterOptions options = service().filterOptions(customers());

    assertThat(options.segments()).containsExactly("At Risk", "Champions", "Hibernating");
    assertThat(options.recencyMin()).isEqualTo(10);
    assertThat(options.recencyMax()).isEqualTo(400);
    assertThat(options.salesMin()).isEqualTo(50d);
    assertThat(options.salesMax()).isEqualTo(1500.5d);
  }

  @Test
  void overviewSummarizesCustomers() {
    CustomerOverview overview = service().overview(customers());

    assertThat(overview.customers()).isEqualTo(4);
    assertThat(overview.totalSales()).isEqualTo(2750.5d);
    assertThat(overview.totalOrders()).isEqualTo(24L);
    assertThat(overview.segmentShare()).containsExactly(
        new SegmentCount("At Risk", 1),
        new SegmentCount("Champions", 2),
        new SegmentCount("Hibernating", 1));
  }

  @Test
  void missingArtifactsYieldAbsence() {
    CustomerService service = service();

    assertThat(service.explore(CustomerQuery.none())).isEmpty();
    assertThat(service.filterOptions()).isEmpty();
    assertThat(service.profiles()).isEmpty();
    assertThat(service.overview().customers()).isNull();
  }
}
