package com.ospicorp.salesinsights.schema;

import com.ospicorp.salesinsights.artifact.TabularDataset;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Finds the column standing for a concept. The first column, in dataset order, whose
 * normalized name is an alias wins. Only column names are consulted, never values.
 */
@Component
public class SchemaResolver {
  private final AliasTable aliases;

  public SchemaResolver() {
    this(AliasTable.defaults());
  }

  public SchemaResolver(AliasTable aliases) {
    this.aliases = aliases;
  }

  public Optional<String> resolve(TabularDataset dataset, Concept concept) {
    if (dataset == null || concept == null) {
      return Optional.empty();
    }
    for (String column : dataset.columns()) {
      if (aliases.matches(concept, column)) {
        return Optional.of(column);
      }
    }
    return Optional.empty();
  }

  public AliasTable aliases() {
    return aliases;
  }
}
