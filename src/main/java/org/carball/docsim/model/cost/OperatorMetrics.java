package org.carball.docsim.model.cost;

import org.carball.docsim.model.plan.PlanOperator;

import java.util.List;

/**
 * Estimated volumes and cost of one operator. {@code details} keeps the
 * individual cost components (scan, shuffle, reduce...) that sum to {@code cost}.
 */
public record OperatorMetrics(
        PlanOperator operator,
        long scannedDocs,
        long outputDocs,
        long scannedBytes,
        long outputBytes,
        long shuffledBytes,
        long outputDocSizeBytes,
        CostBreakdown cost,
        List<CostBreakdown> details,
        List<String> notes
) {

    public OperatorMetrics {
        details = List.copyOf(details);
        notes = List.copyOf(notes);
    }
}
