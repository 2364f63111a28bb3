package com.ospicorp.salesinsights.artifact;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactCacheTest {

  @TempDir
  Path dir;

  private final CountingLoader loader = new CountingLoader();
  private final ArtifactCache cache = new ArtifactCache(loader);

  @Test
  void unchangedFileIsLoadedOnce() throws IOException {
    Path file = Files.writeString(dir.resolve("a.csv"), "x\n1\n");

    ArtifactLoad first = cache.getOrLoad(file);
    ArtifactLoad second = cache.getOrLoad(file);

    assertThat(second).isSameAs(first);
    assertThat(loader.calls.get()).isEqualTo(1);
    assertThat(cache.size()).isEqualTo(1);
  }

  @Test
  void modifiedFileIsReloaded() throws IOException {
    Path file = Files.writeString(dir.resolve("a.csv"), "x\n1\n");
    Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-01-01T00:00:00Z")));
    TabularDataset before = cache.getOrLoad(file).dataset();

    Files.writeString(file, "x\n2\n");
    Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-02-01T00:00:00Z")));
    TabularDataset after = cache.getOrLoad(file).dataset();

    assertThat(before.column("x")).containsExactly("1");
    assertThat(after.column("x")).containsExactly("2");
    assertThat(loader.calls.get()).isEqualTo(2);
  }

  @Test
  void missingFileIsNeverCached() throws IOException {
    Path file = dir.resolve("late.csv");

    assertThat(cache.getOrLoad(file).status()).isEqualTo(ArtifactStatus.MISSING);
    assertThat(cache.size()).isZero();

    Files.writeString(file, "x\n1\n");
    assertThat(cache.getOrLoad(file).status()).isEqualTo(ArtifactStatus.LOADED);
  }

  @Test
  void invalidateAllForcesReload() throws IOException {
    Path file = Files.writeString(dir.resolve("a.csv"), "x\n1\n");
    cache.getOrLoad(file);

    cache.invalidateAll();
    cache.getOrLoad(file);

    assertThat(loader.calls.get()).isEqualTo(2);
  }

  private static final class CountingLoader extends ArtifactLoader {
    final AtomicInteger calls = new AtomicInteger();

    @Override
    public ArtifactLoad inspect(Path path) {
      calls.incrementAndGet();
      return super.inspect(path);
    }
  }
}
