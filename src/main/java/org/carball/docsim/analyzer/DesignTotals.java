package org.carball.docsim.analyzer;

import org.carball.docsim.model.cost.CostBreakdown;

/**
 * Frequency-weighted workload cost of one design. A design with failed queries
 * is incomplete: its totals cover only the queries it could serve.
 */
public record DesignTotals(String designId, double time, double carbon, double price,
                           int evaluatedQueries, int failedQueries) {

    public static DesignTotals empty(String designId) {
        return new DesignTotals(designId, 0.0, 0.0, 0.0, 0, 0);
    }

    public DesignTotals plus(CostBreakdown cost, double frequency) {
        return new DesignTotals(
                designId,
                time + cost.timeCost() * frequency,
                carbon + cost.carbonCost() * frequency,
                price + cost.priceCost() * frequency,
                evaluatedQueries + 1,
                failedQueries
        );
    }

    public DesignTotals withFailure() {
        return new DesignTotals(designId, time, carbon, price, evaluatedQueries, failedQueries + 1);
    }

    public boolean isComplete() {
        return failedQueries == 0;
    }
}
