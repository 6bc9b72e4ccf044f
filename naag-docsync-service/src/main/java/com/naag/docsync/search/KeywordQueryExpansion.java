package com.naag.docsync.search;

import java.util.List;
import java.util.Locale;

/**
 * Appends domain keywords to the query, one more per attempt, skipping terms the query
 * already contains.
 */
public class KeywordQueryExpansion implements QueryExpansion {

    private final List<String> terms;

    public KeywordQueryExpansion(List<String> terms) {
        this.terms = terms == null ? List.of() : List.copyOf(terms);
    }

    @Override
    public String expand(String query, int attempt) {
        if (terms.isEmpty()) return query;
        StringBuilder expanded = new StringBuilder(query.trim());
        String lower = query.toLowerCase(Locale.ROOT);
        int count = Math.min(Math.max(1, attempt), terms.size());
        for (int i = 0; i < count; i++) {
            String term = terms.get(i);
            if (!lower.contains(term.toLowerCase(Locale.ROOT))) {
                expanded.append(' ').append(term);
            }
        }
        return expanded.toString();
    }
}
