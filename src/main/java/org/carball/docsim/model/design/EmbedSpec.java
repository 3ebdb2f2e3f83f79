package org.carball.docsim.model.design;

/**
 * Denormalization edge: documents of {@code source} are nested inside
 * {@code target} under {@code path}. A MANY cardinality means the path holds an array.
 */
public record EmbedSpec(String source, String target, String path, EmbedCardinality cardinality) {

    public EmbedKey key() {
        return new EmbedKey(source, target);
    }

    public boolean isArray() {
        return cardinality == EmbedCardinality.MANY;
    }

    public String prefix(String field) {
        return path + "." + field;
    }
}
