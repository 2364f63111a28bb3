package com.ospicorp.salesinsights.schema;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AliasTableTest {

  @Test
  void defaultsCarryCurrentVersion() {
    assertEquals(AliasTable.VERSION, AliasTable.defaults().version());
  }

  @Test
  void everyConceptHasAtLeastOneAlias() {
    for (Concept concept : Concept.values()) {
      assertFalse(AliasTable.defaults().aliases(concept).isEmpty(), concept.name());
    }
  }

  @Test
  void aliasesAreStoredNormalized() {
    for (Concept concept : Concept.values()) {
      for (String alias : AliasTable.defaults().aliases(concept)) {
        assertEquals(AliasTable.normalize(alias), alias);
      }
    }
  }

  @Test
  void matchesIsCaseInsensitive() {
    var table = AliasTable.defaults();
    assertTrue(table.matches(Concept.SEGMENT, "Label"));
    assertTrue(table.matches(Concept.LAST_ORDER, "Last Order"));
    assertFalse(table.matches(Concept.SEGMENT, "segments"));
    assertFalse(table.matches(Concept.SEGMENT, null));
  }

  @Test
  void lastOrderAcceptsOrderDateNames() {
    var table = AliasTable.defaults();
    assertTrue(table.matches(Concept.LAST_ORDER, "Order Date"));
    assertTrue(table.matches(Concept.LAST_ORDER, "order_date"));
  }
}
