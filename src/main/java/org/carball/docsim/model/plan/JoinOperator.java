package org.carball.docsim.model.plan;

import org.carball.docsim.model.query.JoinPredicate;

import java.util.List;
import java.util.OptionalInt;

/**
 * Nested-loop equality join. {@code leftInput} and {@code rightInput} point at
 * the plan positions of the filters feeding each side; an empty reference
 * means the side is read straight from the collection.
 */
public record JoinOperator(
        String name,
        JoinPredicate join,
        List<String> outputFields,
        boolean aligned,
        OptionalInt leftInput,
        OptionalInt rightInput
) implements PlanOperator {

    public JoinOperator {
        outputFields = List.copyOf(outputFields);
    }

    public String leftCollection() {
        return join.leftCollection();
    }

    public String rightCollection() {
        return join.rightCollection();
    }

    @Override
    public OperatorKind kind() {
        return OperatorKind.nestedLoop(aligned);
    }

    @Override
    public <R> R accept(PlanOperatorVisitor<R> visitor) {
        return visitor.visitJoin(this);
    }
}
