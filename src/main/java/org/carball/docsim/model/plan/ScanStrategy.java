package org.carball.docsim.model.plan;

/**
 * How a filter reaches its documents. Ranked: a lookup on the sharding key
 * beats a secondary index, which beats a full scan.
 */
public enum ScanStrategy {
    SHARD,
    INDEX,
    FULL;

    public String label() {
        return name().toLowerCase();
    }
}
