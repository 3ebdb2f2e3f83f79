package org.carball.docsim.analyzer;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public record WorkloadReport(
        List<QueryEvaluation> evaluations,
        Map<String, DesignTotals> totals,
        List<EvaluationFailure> failures
) {

    public static final Comparator<DesignTotals> LEADERBOARD_ORDER = Comparator
            .comparingDouble(DesignTotals::price)
            .thenComparingDouble(DesignTotals::carbon)
            .thenComparingDouble(DesignTotals::time)
            .thenComparing(DesignTotals::designId);

    public WorkloadReport {
        evaluations = List.copyOf(evaluations);
        totals = Collections.unmodifiableMap(new LinkedHashMap<>(totals));
        failures = List.copyOf(failures);
    }

    /**
     * Designs from cheapest to most expensive: price, then carbon, then time.
     * Incomplete designs come after every complete one.
     */
    public List<DesignTotals> leaderboard() {
        return totals.values().stream()
                .sorted(Comparator.comparing((DesignTotals design) -> !design.isComplete())
                        .thenComparing(LEADERBOARD_ORDER))
                .collect(Collectors.toList());
    }

    /**
     * Evaluations grouped by query id, each keyed by design id, in run order.
     */
    public Map<String, Map<String, QueryEvaluation>> byQuery() {
        Map<String, Map<String, QueryEvaluation>> grouped = new LinkedHashMap<>();
        for (QueryEvaluation evaluation : evaluations) {
            grouped.computeIfAbsent(evaluation.query().id(), id -> new LinkedHashMap<>())
                    .put(evaluation.designId(), evaluation);
        }
        return grouped;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
