package org.carball.docsim.model.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

public record CollectionSchema(String name, String primaryKey, Map<String, FieldSpec> fields) {

    public CollectionSchema {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Average size of one field, empty when the path is not part of this schema.
     */
    public OptionalInt fieldSizeBytes(String fieldPath, Map<String, Double> avgArrayLengths) {
        FieldSpec spec = fields.get(fieldPath);
        if (spec == null) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(spec.sizeBytes(avgArrayLengths));
    }

    public long documentSizeBytes(Map<String, Double> avgArrayLengths) {
        long total = 0;
        for (FieldSpec spec : fields.values()) {
            total += spec.sizeBytes(avgArrayLengths);
        }
        return total;
    }
}
