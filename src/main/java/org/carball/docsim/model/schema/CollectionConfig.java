package org.carball.docsim.model.schema;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Physical layout of a collection: its sharding key and secondary indexes.
 * A blank sharding key means "use the primary key" and is resolved when the
 * design models are built.
 */
public record CollectionConfig(String shardingKey, Set<String> indexes) {

    public CollectionConfig {
        indexes = Collections.unmodifiableSet(new LinkedHashSet<>(indexes));
    }

    public boolean hasShardingKey() {
        return shardingKey != null && !shardingKey.isBlank();
    }

    public boolean isIndexed(String field) {
        return indexes.contains(field);
    }

    public CollectionConfig withShardingKey(String key) {
        return new CollectionConfig(key, indexes);
    }
}
