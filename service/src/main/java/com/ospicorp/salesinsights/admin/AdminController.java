package com.ospicorp.salesinsights.admin;

import com.ospicorp.salesinsights.artifact.ArtifactCatalog;
import com.ospicorp.salesinsights.artifact.ArtifactInfo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@Tag(name = "Admin")
public class AdminController {
  private static final Logger log = LoggerFactory.getLogger(AdminController.class);

  private final ArtifactCatalog catalog;

  public AdminController(ArtifactCatalog catalog) {
    this.catalog = catalog;
  }

  @PostMapping("/reload")
  @Operation(summary = "Reload data", description = "Drops every cached artifact load.")
  public ResponseEntity<Map<String, String>> reload() {
    log.info("Reload requested");
    catalog.reload();
    return ResponseEntity.accepted().body(Map.of("status", "artifact cache cleared"));
  }

  @GetMapping("/artifacts")
  @Operation(summary = "Artifact status", description = "Location, presence and load status of every input file.")
  public ResponseEntity<List<ArtifactInfo>> artifacts() {
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(catalog.describe());
  }
}
