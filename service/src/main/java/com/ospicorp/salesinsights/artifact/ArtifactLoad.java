package com.ospicorp.salesinsights.artifact;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/** Outcome of reading one artifact: a dataset, or the reason there is none. */
public record ArtifactLoad(Path path, ArtifactStatus status, TabularDataset dataset,
    String detail) {

  public ArtifactLoad {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(status, "status");
    if ((status == ArtifactStatus.LOADED) != (dataset != null)) {
      throw new IllegalArgumentException("dataset must be present exactly when status is LOADED");
    }
  }

  public static ArtifactLoad loaded(Path path, TabularDataset dataset) {
    return new ArtifactLoad(path, ArtifactStatus.LOADED, dataset, null);
  }

  public static ArtifactLoad missing(Path path) {
    return new ArtifactLoad(path, ArtifactStatus.MISSING, null, "file not found");
  }

  public static ArtifactLoad malformed(Path path, String detail) {
    return new ArtifactLoad(path, ArtifactStatus.MALFORMED, null, detail);
  }

  public Optional<TabularDataset> asOptional() {
    return Optional.ofNullable(dataset);
  }
}
