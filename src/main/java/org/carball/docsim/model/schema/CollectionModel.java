package org.carball.docsim.model.schema;

import java.util.OptionalInt;

/**
 * Schema, statistics and physical configuration of one collection in one
 * candidate design. Instances are never mutated; embedding produces a new model.
 */
public record CollectionModel(CollectionSchema schema, CollectionStats stats, CollectionConfig config) {

    public String name() {
        return schema.name();
    }

    public long nbDocuments() {
        return stats.nbDocuments();
    }

    public String shardingKey() {
        return config.shardingKey();
    }

    public long documentSizeBytes() {
        return schema.documentSizeBytes(stats.avgArrayLengths());
    }

    /**
     * Size of a field path, or {@code fallbackBytes} flagged as unresolved when
     * the schema does not know the path.
     */
    public FieldSize fieldSize(String fieldPath, int fallbackBytes) {
        OptionalInt size = schema.fieldSizeBytes(fieldPath, stats.avgArrayLengths());
        if (size.isPresent()) {
            return new FieldSize(fieldPath, size.getAsInt(), true);
        }
        return new FieldSize(fieldPath, fallbackBytes, false);
    }

    public record FieldSize(String fieldPath, int bytes, boolean resolved) {}
}
