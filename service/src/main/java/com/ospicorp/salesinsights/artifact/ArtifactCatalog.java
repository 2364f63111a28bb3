package com.ospicorp.salesinsights.artifact;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class ArtifactCatalog {
  private static final Logger log = LoggerFactory.getLogger(ArtifactCatalog.class);

  private final ArtifactCache cache;
  private final Map<ArtifactKind, Path> paths = new EnumMap<>(ArtifactKind.class);

  public ArtifactCatalog(ArtifactCache cache,
      @Value("${insights.base-dir:.}") String baseDir,
      @Value("${insights.outputs-dir:outputs}") String outputsDir,
      @Value("${insights.data-dir:data}") String dataDir) {
    this.cache = cache;
    Path base = Path.of(baseDir);
    Path outputs = base.resolve(outputsDir);
    Path data = base.resolve(dataDir);
    for (ArtifactKind kind : ArtifactKind.values()) {
      Path dir = kind.location() == ArtifactKind.Location.DATA ? data : outputs;
      paths.put(kind, dir.resolve(kind.fileName()).toAbsolutePath().normalize());
    }
    log.info("Reading artifacts from {} (outputs) and {} (data)",
        outputs.toAbsolutePath().normalize(), data.toAbsolutePath().normalize());
  }

  public Path path(ArtifactKind kind) {
    return paths.get(kind);
  }

  public ArtifactLoad inspect(ArtifactKind kind) {
    return cache.getOrLoad(path(kind));
  }

  public Optional<TabularDataset> load(ArtifactKind kind) {
    return inspect(kind).asOptional();
  }

  public List<ArtifactInfo> describe() {
    List<ArtifactInfo> infos = new ArrayList<>(paths.size());
    for (ArtifactKind kind : ArtifactKind.values()) {
      Path path = path(kind);
      FileTime modified = ArtifactCache.lastModified(path);
      ArtifactLoad load = inspect(kind);
      infos.add(new ArtifactInfo(
          kind,
          kind.label(),
          path.toString().replace('\\', '/'),
          modified != null,
          modified != null ? modified.toInstant() : null,
          load.status(),
          load.detail()));
    }
    return infos;
  }

  /** Drops every cached load; the next access re-reads from disk. */
  public void reload() {
    cache.invalidateAll();
  }
}
