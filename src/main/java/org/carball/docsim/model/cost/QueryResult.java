package org.carball.docsim.model.cost;

import org.carball.docsim.model.plan.QueryPlan;

import java.util.List;

/**
 * Simulated outcome of one plan. Scan and shuffle volumes are summed over all
 * operators; output volumes describe the final operator's result set.
 */
public record QueryResult(
        QueryPlan plan,
        List<OperatorMetrics> operators,
        CostBreakdown totalCost,
        long scannedDocs,
        long outputDocs,
        long scannedBytes,
        long outputBytes,
        long shuffledBytes
) {

    public QueryResult {
        operators = List.copyOf(operators);
    }

    public String operatorPlanSummary() {
        return plan.summary();
    }
}
