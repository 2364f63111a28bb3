package com.ospicorp.salesinsights.artifact;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class CellsTest {

  @Test
  void numberAcceptsFiniteValuesOnly() {
    assertEquals(12.5d, Cells.number(" 12.5 "));
    assertNull(Cells.number("abc"));
    assertNull(Cells.number("NaN"));
    assertNull(Cells.number("Infinity"));
    assertNull(Cells.number(""));
    assertNull(Cells.number(null));
  }

  @Test
  void numberRejectsJavaLiteralSyntax() {
    assertNull(Cells.number("5d"));
    assertNull(Cells.number("2.5f"));
    assertNull(Cells.number("0x10p0"));
    assertNull(Cells.number("1e400"));
    assertEquals(1500d, Cells.number("1.5e3"));
    assertEquals(-0.5d, Cells.number("-.5"));
  }

  @Test
  void dateAcceptsPandasTimestamps() {
    LocalDate expected = LocalDate.of(2024, 7, 1);
    assertEquals(expected, Cells.date("2024-07-01 00:00:00+00:00"));
    assertEquals(expected, Cells.date("2024-07-01 10:00:00.000"));
    assertEquals(expected, Cells.date("2024-07-01 10:00:00.123456789"));
    assertEquals(expected, Cells.date("2024-07-01 10:00"));
  }

  @Test
  void dateAcceptsCommonLayouts() {
    LocalDate expected = LocalDate.of(2024, 3, 7);
    assertEquals(expected, Cells.date("2024-03-07"));
    assertEquals(expected, Cells.date("2024-03-07 13:45:00"));
    assertEquals(expected, Cells.date("2024-03-07T13:45:00"));
    assertEquals(expected, Cells.date("2024/03/07"));
    assertEquals(expected, Cells.date("3/7/2024"));
    assertEquals(LocalDate.of(2024, 3, 1), Cells.date("2024-03"));
  }

  @Test
  void monthFirstWinsForAmbiguousSlashDates() {
    assertEquals(LocalDate.of(2024, 2, 3), Cells.date("02/03/2024"));
    assertEquals(LocalDate.of(2024, 5, 25), Cells.date("25/05/2024"));
  }

  @Test
  void unparsableDatesAreNull() {
    assertNull(Cells.date("not a date"));
    assertNull(Cells.date("2024-02-30"));
    assertNull(Cells.date(null));
  }

  @Test
  void textTrimsAndReadsAbsentAsEmpty() {
    assertEquals("A", Cells.text("  A "));
    assertEquals("", Cells.text(null));
  }
}
