package org.carball.docsim.model.plan;

public interface PlanOperatorVisitor<R> {

    R visitFilter(FilterOperator filter);

    R visitJoin(JoinOperator join);

    R visitAggregate(AggregateOperator aggregate);
}
