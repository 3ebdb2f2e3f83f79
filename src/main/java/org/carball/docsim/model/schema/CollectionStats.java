package org.carball.docsim.model.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record CollectionStats(
        long nbDocuments,
        Map<String, Long> distinctValues,
        Map<String, Double> avgArrayLengths,
        Map<String, Double> fieldSelectivity
) {

    public CollectionStats {
        distinctValues = Collections.unmodifiableMap(new LinkedHashMap<>(distinctValues));
        avgArrayLengths = Collections.unmodifiableMap(new LinkedHashMap<>(avgArrayLengths));
        fieldSelectivity = Collections.unmodifiableMap(new LinkedHashMap<>(fieldSelectivity));
    }

    public static CollectionStats of(long nbDocuments) {
        return new CollectionStats(nbDocuments, Map.of(), Map.of(), Map.of());
    }

    /**
     * Distinct values recorded for a field, 0 when unknown.
     */
    public long distinctValues(String field) {
        Long distinct = distinctValues.get(field);
        return distinct == null ? 0 : distinct;
    }

    /**
     * Equality selectivity for a field: explicit override first, then
     * 1/distinct, then 1.0 when nothing is known.
     */
    public double equalitySelectivity(String field) {
        Double override = fieldSelectivity.get(field);
        if (override != null) {
            return override;
        }
        long distinct = distinctValues(field);
        if (distinct > 0) {
            return 1.0 / distinct;
        }
        return 1.0;
    }
}
