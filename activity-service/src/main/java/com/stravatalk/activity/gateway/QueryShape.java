package com.stravatalk.activity.gateway;

/**
 * Whether a statement summarises rows (aggregate functions or GROUP BY) or returns them.
 * Both shapes receive the tenant predicate in their own WHERE clause.
 */
public enum QueryShape {
    AGGREGATE,
    ROW_LEVEL
}
