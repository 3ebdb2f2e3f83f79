package org.carball.docsim.model.plan;

import java.util.List;

/**
 * A physical operator. The set of operators is closed; consumers dispatch
 * through {@link PlanOperatorVisitor} so a new operator cannot be silently ignored.
 */
public sealed interface PlanOperator permits FilterOperator, JoinOperator, AggregateOperator {

    String name();

    OperatorKind kind();

    /**
     * Canonical dotted field paths this operator returns; empty means whole documents.
     */
    List<String> outputFields();

    <R> R accept(PlanOperatorVisitor<R> visitor);
}
