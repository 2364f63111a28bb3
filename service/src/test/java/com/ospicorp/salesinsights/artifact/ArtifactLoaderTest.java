package com.ospicorp.salesinsights.artifact;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.salesinsights.series.model.ForecastPoint;
import com.ospicorp.salesinsights.series.service.ForecastReconciler;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactLoaderTest {

  @TempDir
  Path dir;

  private final ArtifactLoader loader = new ArtifactLoader();

  @Test
  void missingFileIsAbsent() {
    ArtifactLoad load = loader.inspect(dir.resolve("nope.csv"));

    assertThat(load.status()).isEqualTo(ArtifactStatus.MISSING);
    assertThat(loader.load(dir.resolve("nope.csv"))).isEmpty();
  }

  @Test
  void directoryIsTreatedAsMissing() {
    assertThat(loader.inspect(dir).status()).isEqualTo(ArtifactStatus.MISSING);
  }

  @Test
  void keepsColumnAndRowOrder() throws IOException {
    Path file = write("b.csv", "zeta,alpha,mid\n3,x,\n1,y,z\n");

    TabularDataset dataset = loader.load(file).orElseThrow();

    assertThat(dataset.columns()).containsExactly("zeta", "alpha", "mid");
    assertThat(dataset.rows()).containsExactly(
        Arrays.asList("3", "x", null),
        Arrays.asList("1", "y", "z"));
  }

  @Test
  void headerOnlyFileIsAnEmptyDataset() throws IOException {
    Path file = write("h.csv", "ds,y\n");

    TabularDataset dataset = loader.load(file).orElseThrow();

    assertThat(dataset.columns()).containsExactly("ds", "y");
    assertThat(dataset.isEmpty()).isTrue();
  }

  @Test
  void stripsByteOrderMarkAndSkipsBlankLines() throws IOException {
    Path file = write("bom.csv", "\uFEFFOrder Date,Sales\n\n2024-01-01,5\n\n");

    TabularDataset dataset = loader.load(file).orElseThrow();

    assertThat(dataset.columns()).containsExactly("Order Date", "Sales");
    assertThat(dataset.rowCount()).isEqualTo(1);
  }

  @Test
  void shortRowsArePadded() throws IOException {
    Path file = write("short.csv", "a,b,c\n1\n");

    assertThat(loader.load(file).orElseThrow().rows()).containsExactly(Arrays.asList("1", null, null));
  }

  @Test
  void emptyFileIsMalformed() throws IOException {
    Path file = write("empty.csv", "");

    assertThat(loader.inspect(file).status()).isEqualTo(ArtifactStatus.MALFORMED);
    assertThat(loader.load(file)).isEmpty();
  }

  @Test
  void rowWiderThanHeaderIsMalformed() throws IOException {
    Path file = write("wide.csv", "a,b\n1,2,3\n");

    ArtifactLoad load = loader.inspect(file);

    assertThat(load.status()).isEqualTo(ArtifactStatus.MALFORMED);
    assertThat(load.detail()).contains("line 2");
  }

  @Test
  void unlabeledIndexColumnIsNamedAndForecastStillValidates() throws IOException {
    Path file = write("forecast_prophet.csv",
        ",ds,yhat,yhat_lower,yhat_upper\n0,2024-07-01,11,9,13\n1,2024-08-01,12,10,14\n");

    ArtifactLoad load = loader.inspect(file);

    assertThat(load.status()).isEqualTo(ArtifactStatus.LOADED);
    assertThat(load.dataset().columns())
        .containsExactly("Unnamed: 0", "ds", "yhat", "yhat_lower", "yhat_upper");
    assertThat(new ForecastReconciler().validateExternal(load.dataset()))
        .hasValueSatisfying(points -> assertThat(points).extracting(ForecastPoint::period)
            .containsExactly(LocalDate.of(2024, 7, 1), LocalDate.of(2024, 8, 1)));
  }

  @Test
  void blankHeaderCellsAreNamedByPosition() throws IOException {
    Path file = write("blank.csv", "a,,c\n1,2,3\n");

    TabularDataset dataset = loader.load(file).orElseThrow();

    assertThat(dataset.columns()).containsExactly("a", "Unnamed: 1", "c");
    assertThat(dataset.value(0, "Unnamed: 1")).isEqualTo("2");
  }

  @Test
  void binaryContentIsMalformed() throws IOException {
    Path file = write("nul.csv", "a,b\n1,\u0000x\n");

    assertThat(loader.inspect(file).status()).isEqualTo(ArtifactStatus.MALFORMED);
  }

  @Test
  void invalidUtf8IsMalformed() throws IOException {
    Path file = dir.resolve("latin.csv");
    byte[] header = "a,b\n1,".getBytes(StandardCharsets.US_ASCII);
    byte[] bytes = Arrays.copyOf(header, header.length + 3);
    bytes[header.length] = (byte) 0xFF;
    bytes[header.length + 1] = (byte) 0xFE;
    bytes[header.length + 2] = '\n';
    Files.write(file, bytes);

    assertThat(loader.inspect(file).status()).isEqualTo(ArtifactStatus.MALFORMED);
  }

  @Test
  void imageBytesAreMalformedNotThrown() throws IOException {
    Path file = dir.resolve("chart.csv");
    Files.write(file, new byte[] {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0x0D,
        'I', 'H', 'D', 'R', (byte) 0xC3, 0x28, (byte) 0xFF});

    assertThat(loader.load(file)).isEmpty();
    assertThat(loader.inspect(file).status()).isEqualTo(ArtifactStatus.MALFORMED);
  }

  @Test
  void quotedFieldsMayContainDelimiters() throws IOException {
    Path file = write("q.csv", "name,total\n\"Smith, J\",10\n");

    assertThat(loader.load(file).orElseThrow().column("name")).isEqualTo(List.of("Smith, J"));
  }

  private Path write(String name, String content) throws IOException {
    Path file = dir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
