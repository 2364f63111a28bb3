package com.ospicorp.salesinsights.schema;

/** Domain fields located by meaning rather than by literal column name. */
public enum Concept {
  DATE,
  AMOUNT,
  CATEGORY,
  REGION,
  SEGMENT,
  CUSTOMER_ID,
  RECENCY,
  ORDER_COUNT,
  LAST_ORDER
}
