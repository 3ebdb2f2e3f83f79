package org.carball.docsim.model.schema;

public record ClusterConfig(int nbServers, double shardingAccessFraction) {

    public static final int DEFAULT_NB_SERVERS = 1000;
    public static final double DEFAULT_SHARDING_ACCESS_FRACTION = 0.1;

    public static ClusterConfig defaults() {
        return new ClusterConfig(DEFAULT_NB_SERVERS, DEFAULT_SHARDING_ACCESS_FRACTION);
    }
}
