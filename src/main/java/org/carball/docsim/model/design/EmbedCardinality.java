package org.carball.docsim.model.design;

public enum EmbedCardinality {
    ONE,
    MANY;

    public static EmbedCardinality fromName(String name) {
        if (name == null || name.isBlank()) {
            return ONE;
        }
        for (EmbedCardinality cardinality : values()) {
            if (cardinality.name().equalsIgnoreCase(name.trim())) {
                return cardinality;
            }
        }
        throw new IllegalArgumentException("Unknown embed cardinality: " + name + ". Use: one or many");
    }
}
