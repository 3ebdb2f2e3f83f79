package org.carball.docsim.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.docsim.config.FailurePolicy;
import org.carball.docsim.cost.CostModel;
import org.carball.docsim.loader.DesignModelBuilder;
import org.carball.docsim.loader.DesignModelException;
import org.carball.docsim.loader.Workload;
import org.carball.docsim.model.cost.QueryResult;
import org.carball.docsim.model.design.DenormalizationSpec;
import org.carball.docsim.model.design.DesignModels;
import org.carball.docsim.model.plan.QueryPlan;
import org.carball.docsim.model.query.QuerySpec;
import org.carball.docsim.planner.QueryPlanner;
import org.carball.docsim.simulator.CostSimulator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plans and simulates every query of a workload under every candidate design.
 * Each (design, query) pair is evaluated independently from read-only models.
 */
@Slf4j
public class WorkloadEvaluator {

    private final CostModel costModel;
    private final FailurePolicy failurePolicy;
    private final QueryPlanner planner;
    private final DesignModelBuilder modelBuilder;

    public WorkloadEvaluator(CostModel costModel, FailurePolicy failurePolicy) {
        this.costModel = costModel;
        this.failurePolicy = failurePolicy;
        this.planner = new QueryPlanner();
        this.modelBuilder = new DesignModelBuilder();
    }

    public WorkloadReport evaluate(Workload workload) {
        CostSimulator simulator = new CostSimulator(costModel, workload.cluster());
        List<QueryEvaluation> evaluations = new ArrayList<>();
        Map<String, DesignTotals> totals = new LinkedHashMap<>();
        List<EvaluationFailure> failures = new ArrayList<>();

        for (DenormalizationSpec design : workload.designs()) {
            DesignModels models;
            try {
                models = modelBuilder.build(workload, design);
            } catch (DesignModelException e) {
                recordFailure(failures, design.id(), null, e);
                continue;
            }

            log.info("Evaluating design {}: {}", design.id(), design.description());
            DesignTotals designTotals = DesignTotals.empty(design.id());

            for (QuerySpec query : workload.queries()) {
                QueryResult result;
                try {
                    QueryPlan plan = planner.plan(query, models);
                    result = simulator.simulate(plan, models);
                } catch (IllegalArgumentException | IllegalStateException e) {
                    recordFailure(failures, design.id(), query.id(), e);
                    designTotals = designTotals.withFailure();
                    continue;
                }

                evaluations.add(new QueryEvaluation(design.id(), query, result));
                designTotals = designTotals.plus(result.totalCost(), query.frequency());
                log.info("{} -> time={}, carbon={}, price={}, scanned_docs={}, output_docs={}",
                        query.id(),
                        String.format(Locale.ROOT, "%.6f", result.totalCost().timeCost()),
                        String.format(Locale.ROOT, "%.6f", result.totalCost().carbonCost()),
                        String.format(Locale.ROOT, "%.6f", result.totalCost().priceCost()),
                        result.scannedDocs(), result.outputDocs());
            }

            if (!designTotals.isComplete()) {
                log.warn("Design {} is incomplete: {} of {} queries failed, ranked after complete designs",
                        design.id(), designTotals.failedQueries(), workload.queries().size());
            }
            totals.put(design.id(), designTotals);
        }

        if (!failures.isEmpty()) {
            log.warn("{} evaluation(s) failed and were left out of the totals", failures.size());
        }
        return new WorkloadReport(evaluations, totals, failures);
    }

    private void recordFailure(List<EvaluationFailure> failures, String designId, String queryId, RuntimeException e) {
        if (failurePolicy == FailurePolicy.FAIL_FAST) {
            throw new WorkloadEvaluationException(designId, queryId, e);
        }
        if (queryId == null) {
            log.error("Skipping design {}: {}", designId, e.getMessage());
        } else {
            log.warn("Skipping query {} under design {}: {}", queryId, designId, e.getMessage());
        }
        failures.add(new EvaluationFailure(designId, queryId, e.getClass().getSimpleName(), e.getMessage()));
    }
}
