package org.carball.docsim.model.plan;

public enum OperatorKind {
    FILTER_WITH_SHARDING,
    FILTER_WITHOUT_SHARDING,
    NESTED_LOOP_WITH_SHARDING,
    NESTED_LOOP_WITHOUT_SHARDING,
    AGGREGATE_WITH_SHARDING,
    AGGREGATE_WITHOUT_SHARDING;

    public String label() {
        return name().toLowerCase();
    }

    public static OperatorKind filter(ScanStrategy strategy) {
        return strategy == ScanStrategy.SHARD ? FILTER_WITH_SHARDING : FILTER_WITHOUT_SHARDING;
    }

    public static OperatorKind nestedLoop(boolean aligned) {
        return aligned ? NESTED_LOOP_WITH_SHARDING : NESTED_LOOP_WITHOUT_SHARDING;
    }

    public static OperatorKind aggregate(boolean aligned) {
        return aligned ? AGGREGATE_WITH_SHARDING : AGGREGATE_WITHOUT_SHARDING;
    }
}
