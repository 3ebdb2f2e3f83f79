package org.carball.docsim.model.query;

/**
 * Equality predicate {@code field = value} on one collection.
 */
public record FilterPredicate(String collection, String field, Object value) {

    public FilterPredicate retarget(String newCollection, String newField) {
        return new FilterPredicate(newCollection, newField, value);
    }
}
