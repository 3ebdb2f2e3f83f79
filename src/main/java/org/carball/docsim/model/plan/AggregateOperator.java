package org.carball.docsim.model.plan;

import org.carball.docsim.model.query.FilterPredicate;

import java.util.List;

/**
 * Single-stage map / shuffle / reduce group-by over one collection, with the
 * WHERE predicates applied during the map phase.
 */
public record AggregateOperator(
        String name,
        String targetCollection,
        List<FilterPredicate> filters,
        List<String> groupingKeys,
        List<String> outputFields,
        boolean useSharding
) implements PlanOperator {

    public AggregateOperator {
        if (groupingKeys == null || groupingKeys.isEmpty()) {
            throw new AggregateConfigException("Aggregate operator " + name + " requires grouping keys");
        }
        filters = List.copyOf(filters);
        groupingKeys = List.copyOf(groupingKeys);
        outputFields = List.copyOf(outputFields);
    }

    /**
     * Output fields, or the grouping keys when none were requested.
     */
    public List<String> effectiveOutputFields() {
        return outputFields.isEmpty() ? groupingKeys : outputFields;
    }

    @Override
    public OperatorKind kind() {
        return OperatorKind.aggregate(useSharding);
    }

    @Override
    public <R> R accept(PlanOperatorVisitor<R> visitor) {
        return visitor.visitAggregate(this);
    }
}
