package com.naag.docsync.search;

/**
 * Rewrites a query for a widened search attempt.
 */
@FunctionalInterface
public interface QueryExpansion {

    /**
     * @param attempt 1 for the first widening, 2 for the second, ...
     */
    String expand(String query, int attempt);
}
