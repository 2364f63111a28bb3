package com.ospicorp.salesinsights.schema;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Versioned mapping from {@link Concept} to the literal column names accepted for it.
 *
 * <p>Names are stored normalized (trimmed, lower case). Bump {@link #VERSION} whenever the
 * default entries change, since resolution results depend on them.
 */
public final class AliasTable {
  public static final int VERSION = 2;

  private static final AliasTable DEFAULTS = new AliasTable(VERSION, defaultEntries());

  private final int version;
  private final Map<Concept, Set<String>> aliases;

  public AliasTable(int version, Map<Concept, List<String>> entries) {
    Objects.requireNonNull(entries, "entries");
    this.version = version;
    Map<Concept, Set<String>> normalized = new EnumMap<>(Concept.class);
    for (Concept concept : Concept.values()) {
      Set<String> names = new LinkedHashSet<>();
      for (String name : entries.getOrDefault(concept, List.of())) {
        names.add(normalize(name));
      }
      normalized.put(concept, Collections.unmodifiableSet(names));
    }
    this.aliases = Collections.unmodifiableMap(normalized);
  }

  public static AliasTable defaults() {
    return DEFAULTS;
  }

  public int version() {
    return version;
  }

  /** Normalized aliases in declaration order. */
  public Set<String> aliases(Concept concept) {
    return aliases.get(concept);
  }

  public boolean matches(Concept concept, String columnName) {
    return columnName != null && aliases.get(concept).contains(normalize(columnName));
  }

  public static String normalize(String columnName) {
    return columnName.trim().toLowerCase(Locale.ROOT);
  }

  private static Map<Concept, List<String>> defaultEntries() {
    Map<Concept, List<String>> entries = new EnumMap<>(Concept.class);
    entries.put(Concept.DATE, List.of("order date", "order_date", "date"));
    entries.put(Concept.AMOUNT, List.of("sales", "revenue", "amount", "total_sales"));
    entries.put(Concept.CATEGORY, List.of("category"));
    entries.put(Concept.REGION, List.of("region"));
    entries.put(Concept.SEGMENT, List.of("segment", "label"));
    entries.put(Concept.CUSTOMER_ID, List.of("customer_id", "customer id", "id"));
    entries.put(Concept.RECENCY, List.of("recency_days", "recency", "days_since"));
    entries.put(Concept.ORDER_COUNT, List.of("order_count", "orders"));
    entries.put(Concept.LAST_ORDER, List.of("last_order", "last order", "order_date", "order date"));
    return entries;
  }
}
