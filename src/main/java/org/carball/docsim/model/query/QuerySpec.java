package org.carball.docsim.model.query;

public record QuerySpec(String id, String sql, double frequency) {

    public static final double DEFAULT_FREQUENCY = 1.0;

    public QuerySpec(String id, String sql) {
        this(id, sql, DEFAULT_FREQUENCY);
    }
}
