package com.ospicorp.salesinsights.web;

import com.ospicorp.salesinsights.artifact.ArtifactCatalog;
import com.ospicorp.salesinsights.artifact.ArtifactInfo;
import com.ospicorp.salesinsights.schema.AliasTable;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {
  private final ArtifactCatalog catalog;

  public RootController(ArtifactCatalog catalog) {
    this.catalog = catalog;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    long present = catalog.describe().stream().filter(ArtifactInfo::present).count();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", "sales-insights");
    body.put("status", "ok");
    body.put("alias_table_version", AliasTable.VERSION);
    body.put("artifacts_present", present);
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
