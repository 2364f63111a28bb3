package com.ospicorp.salesinsights.artifact;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Tolerant interpretation of text cells. Failures yield {@code null}, never an exception. */
public final class Cells {
  private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
      DateTimeFormatter.ofPattern("uuuu/MM/dd").withResolverStyle(ResolverStyle.STRICT),
      DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT),
      DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT),
      DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT),
      DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT));

  // "2024-07-01 10:00", "2024-07-01 10:00:00.000", "2024-07-01 00:00:00+00:00"
  private static final DateTimeFormatter SPACED_DATE_TIME = new DateTimeFormatterBuilder()
      .appendPattern("uuuu-MM-dd HH:mm")
      .optionalStart()
      .appendPattern(":ss")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
      .optionalEnd()
      .optionalEnd()
      .optionalStart()
      .appendOffset("+HH:MM", "Z")
      .optionalEnd()
      .toFormatter()
      .withResolverStyle(ResolverStyle.STRICT);

  private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
      SPACED_DATE_TIME,
      DateTimeFormatter.ISO_LOCAL_DATE_TIME);

  private static final List<Function<String, LocalDate>> DATE_PARSERS = buildParsers();

  private Cells() {
  }

  private static List<Function<String, LocalDate>> buildParsers() {
    List<Function<String, LocalDate>> parsers = new ArrayList<>();
    parsers.add(LocalDate::parse);
    parsers.add(text -> OffsetDateTime.parse(text).toLocalDate());
    for (DateTimeFormatter format : DATE_TIME_FORMATS) {
      parsers.add(text -> LocalDateTime.parse(text, format).toLocalDate());
    }
    for (DateTimeFormatter format : DATE_FORMATS) {
      parsers.add(text -> LocalDate.parse(text, format));
    }
    parsers.add(text -> YearMonth.parse(text).atDay(1));
    return List.copyOf(parsers);
  }

  /** Finite decimal in the cell (exponent allowed, no suffix or hex), or {@code null}. */
  public static Double number(String cell) {
    if (cell == null) return null;
    String text = cell.trim();
    if (text.isEmpty()) return null;
    try {
      double value = new BigDecimal(text).doubleValue();
      return Double.isFinite(value) ? value : null;
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  /**
   * Calendar date in the cell, or {@code null}. Month-first slash dates win over day-first
   * ones when both readings are valid.
   */
  public static LocalDate date(String cell) {
    if (cell == null) return null;
    String text = cell.trim();
    if (text.isEmpty()) return null;

    for (Function<String, LocalDate> parser : DATE_PARSERS) {
      LocalDate parsed = parseOrNull(text, parser);
      if (parsed != null) {
        return parsed;
      }
    }
    return null;
  }

  private static LocalDate parseOrNull(String text, Function<String, LocalDate> parser) {
    try {
      return parser.apply(text);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  /** Trimmed text with absent cells read as the empty string. */
  public static String text(String cell) {
    return cell == null ? "" : cell.trim();
  }
}
