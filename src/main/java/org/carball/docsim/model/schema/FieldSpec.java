package org.carball.docsim.model.schema;

import java.util.Map;

/**
 * A single field of a collection. When {@code arrayPath} is set the field lives
 * inside a repeated structure and its size is multiplied by the average length
 * of that array.
 */
public record FieldSpec(String name, int avgSize, String arrayPath) {

    public FieldSpec(String name, int avgSize) {
        this(name, avgSize, null);
    }

    public int sizeBytes(Map<String, Double> avgArrayLengths) {
        double multiplier = 1.0;
        if (arrayPath != null) {
            multiplier = avgArrayLengths.getOrDefault(arrayPath, 1.0);
        }
        return (int) (avgSize * multiplier);
    }
}
