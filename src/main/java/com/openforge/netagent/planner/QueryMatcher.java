package com.openforge.netagent.planner;

import java.util.List;

/**
 * Selects the patterns a query matches. Implementations must return matches
 * in pattern declaration order.
 */
public interface QueryMatcher {

    List<QueryPattern> match(String queryText, List<QueryPattern> patterns);
}
