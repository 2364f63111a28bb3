package com.ospicorp.salesinsights.filter;

import com.ospicorp.salesinsights.artifact.TabularDataset;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps the rows that satisfy every predicate. Row order is preserved and the input dataset is
 * left untouched; the result does not depend on the order of the predicates.
 */
@Component
public class RecordFilterEngine {
  private static final Logger log = LoggerFactory.getLogger(RecordFilterEngine.class);

  public TabularDataset apply(TabularDataset dataset, List<? extends FilterPredicate> predicates) {
    List<FilterPredicate> active = new ArrayList<>(predicates.size());
    List<Integer> columnIndexes = new ArrayList<>(predicates.size());
    for (FilterPredicate predicate : predicates) {
      if (predicate.isNoOp(dataset)) {
        log.debug("Skipping no-op predicate {}", predicate);
        continue;
      }
      active.add(predicate);
      columnIndexes.add(dataset.columnIndex(predicate.column()));
    }

    List<Integer> kept = new ArrayList<>(dataset.rowCount());
    for (int row = 0; row < dataset.rowCount(); row++) {
      if (matchesAll(dataset, row, active, columnIndexes)) {
        kept.add(row);
      }
    }
    return dataset.selectRows(kept);
  }

  private static boolean matchesAll(TabularDataset dataset, int row,
      List<FilterPredicate> predicates, List<Integer> columnIndexes) {
    for (int i = 0; i < predicates.size(); i++) {
      if (!predicates.get(i).test(dataset.value(row, columnIndexes.get(i)))) {
        return false;
      }
    }
    return true;
  }
}
