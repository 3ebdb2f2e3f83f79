package org.carball.docsim.model.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of parsing one query. Select fields written as {@code alias.name}
 * are already normalized to {@code collection.name}; an empty select list means
 * the whole document. {@code join} is null for single-collection queries.
 */
public record ParsedQuery(
        List<String> selectFields,
        Map<String, String> aliases,
        JoinPredicate join,
        List<FilterPredicate> filters,
        List<String> groupBy
) {

    public ParsedQuery {
        selectFields = List.copyOf(selectFields);
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        filters = List.copyOf(filters);
        groupBy = List.copyOf(groupBy);
    }

    public boolean hasJoin() {
        return join != null;
    }

    public boolean hasGroupBy() {
        return !groupBy.isEmpty();
    }

    /**
     * The collection named in the FROM clause.
     */
    public String baseCollection() {
        return aliases.get("");
    }

    public List<FilterPredicate> filtersOn(String collection) {
        return filters.stream()
                .filter(f -> f.collection().equals(collection))
                .toList();
    }
}
