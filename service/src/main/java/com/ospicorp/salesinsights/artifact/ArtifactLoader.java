package com.ospicorp.salesinsights.artifact;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads optional CSV artifacts. Nothing here throws: a file that is absent or cannot be read
 * as a table comes back as {@link ArtifactStatus#MISSING} or {@link ArtifactStatus#MALFORMED}.
 */
@Component
public class ArtifactLoader {
  private static final Logger log = LoggerFactory.getLogger(ArtifactLoader.class);
  private static final char BOM = '\uFEFF';
  static final String UNNAMED_PREFIX = "Unnamed: ";

  private final CsvMapper mapper;

  public ArtifactLoader() {
    this.mapper = new CsvMapper();
    mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
  }

  public Optional<TabularDataset> load(Path path) {
    return inspect(path).asOptional();
  }

  public ArtifactLoad inspect(Path path) {
    if (path == null || !Files.isRegularFile(path)) {
      log.debug("Artifact {} is missing", path);
      return ArtifactLoad.missing(path == null ? Path.of("") : path);
    }
    try {
      TabularDataset dataset = parse(path);
      log.debug("Loaded artifact {}: {} columns, {} rows", path, dataset.columns().size(),
          dataset.rowCount());
      return ArtifactLoad.loaded(path, dataset);
    } catch (MalformedArtifactException ex) {
      log.warn("Artifact {} is malformed: {}", path, ex.getMessage());
      return ArtifactLoad.malformed(path, ex.getMessage());
    } catch (IOException | RuntimeException ex) {
      String detail = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getName();
      log.warn("Artifact {} could not be parsed as CSV: {}", path, detail);
      return ArtifactLoad.malformed(path, detail);
    }
  }

  private TabularDataset parse(Path path) throws IOException {
    List<String[]> lines;
    try (InputStream in = Files.newInputStream(path);
        MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(in)) {
      lines = it.readAll();
    }
    if (lines.isEmpty()) {
      throw new MalformedArtifactException("no header row");
    }

    List<String> header = new ArrayList<>(Arrays.asList(lines.get(0)));
    if (!header.isEmpty() && header.get(0) != null && !header.get(0).isEmpty()
        && header.get(0).charAt(0) == BOM) {
      header.set(0, header.get(0).substring(1));
    }
    for (int i = 0; i < header.size(); i++) {
      String name = header.get(i);
      if (name == null || name.isBlank()) {
        // an unlabeled index column, as written by pandas to_csv
        header.set(i, UNNAMED_PREFIX + i);
        continue;
      }
      checkText(name, 1);
    }

    List<List<String>> rows = new ArrayList<>(lines.size() - 1);
    for (int i = 1; i < lines.size(); i++) {
      String[] cells = lines.get(i);
      if (cells.length > header.size()) {
        throw new MalformedArtifactException("line " + (i + 1) + " has " + cells.length
            + " fields, expected " + header.size());
      }
      for (String cell : cells) {
        checkText(cell, i + 1);
      }
      rows.add(Arrays.asList(cells));
    }
    return TabularDataset.of(header, rows);
  }

  private static void checkText(String cell, int line) {
    if (cell != null && cell.indexOf('\u0000') >= 0) {
      throw new MalformedArtifactException("binary content on line " + line);
    }
  }

  private static final class MalformedArtifactException extends RuntimeException {
    MalformedArtifactException(String message) {
      super(message);
    }
  }
}
