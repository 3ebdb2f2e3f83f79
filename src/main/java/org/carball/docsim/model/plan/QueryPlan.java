package org.carball.docsim.model.plan;

import org.carball.docsim.model.query.QuerySpec;

import java.util.List;
import java.util.stream.Collectors;

public record QueryPlan(QuerySpec query, List<PlanOperator> operators, List<String> involvedCollections) {

    public QueryPlan {
        operators = List.copyOf(operators);
        involvedCollections = List.copyOf(involvedCollections);
    }

    /**
     * Operator kinds in execution order, e.g. {@code filter_without_sharding -> nested_loop_with_sharding}.
     */
    public String summary() {
        return operators.stream()
                .map(op -> op.kind().label())
                .collect(Collectors.joining(" -> "));
    }
}
