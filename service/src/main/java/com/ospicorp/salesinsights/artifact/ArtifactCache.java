package com.ospicorp.salesinsights.artifact;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Memoizes artifact loads by (path, last-modified time). The only mutation besides lazy
 * population is {@link #invalidateAll()}, which runs under the write lock so that no reader
 * sees a partially cleared cache.
 */
@Component
public class ArtifactCache {
  private static final Logger log = LoggerFactory.getLogger(ArtifactCache.class);

  private final ArtifactLoader loader;
  private final Map<CacheKey, ArtifactLoad> entries = new ConcurrentHashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  public ArtifactCache(ArtifactLoader loader) {
    this.loader = loader;
  }

  public ArtifactLoad getOrLoad(Path path) {
    Path absolute = path.toAbsolutePath().normalize();
    FileTime modified = lastModified(absolute);
    if (modified == null) {
      // never cached, so a file that appears later is picked up
      return loader.inspect(absolute);
    }
    lock.readLock().lock();
    try {
      return entries.computeIfAbsent(new CacheKey(absolute, modified), key -> loader.inspect(key.path()));
    } finally {
      lock.readLock().unlock();
    }
  }

  public void invalidateAll() {
    lock.writeLock().lock();
    try {
      int size = entries.size();
      entries.clear();
      log.info("Artifact cache invalidated ({} entries dropped)", size);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public int size() {
    return entries.size();
  }

  static FileTime lastModified(Path path) {
    if (!Files.isRegularFile(path)) {
      return null;
    }
    try {
      return Files.getLastModifiedTime(path);
    } catch (IOException ex) {
      log.debug("Cannot read modification time of {}: {}", path, ex.getMessage());
      return null;
    }
  }

  private record CacheKey(Path path, FileTime modified) {}
}
