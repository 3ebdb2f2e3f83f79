package org.carball.docsim.model.plan;

import org.carball.docsim.model.query.FilterPredicate;

import java.util.List;

public record FilterOperator(
        String name,
        String targetCollection,
        List<FilterPredicate> filters,
        List<String> outputFields,
        ScanStrategy scanStrategy,
        List<String> indexesUsed
) implements PlanOperator {

    public FilterOperator {
        filters = List.copyOf(filters);
        outputFields = List.copyOf(outputFields);
        indexesUsed = List.copyOf(indexesUsed);
    }

    @Override
    public OperatorKind kind() {
        return OperatorKind.filter(scanStrategy);
    }

    public boolean usesSharding() {
        return scanStrategy == ScanStrategy.SHARD;
    }

    @Override
    public <R> R accept(PlanOperatorVisitor<R> visitor) {
        return visitor.visitFilter(this);
    }
}
