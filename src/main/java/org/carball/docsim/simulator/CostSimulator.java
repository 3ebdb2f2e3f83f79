package org.carball.docsim.simulator;

import lombok.extern.slf4j.Slf4j;
import org.carball.docsim.cost.CostModel;
import org.carball.docsim.cost.CostModelConfig;
import org.carball.docsim.model.cost.CostBreakdown;
import org.carball.docsim.model.cost.OperatorMetrics;
import org.carball.docsim.model.cost.QueryResult;
import org.carball.docsim.model.design.DesignModels;
import org.carball.docsim.model.plan.AggregateOperator;
import org.carball.docsim.model.plan.FilterOperator;
import org.carball.docsim.model.plan.JoinOperator;
import org.carball.docsim.model.plan.PlanOperator;
import org.carball.docsim.model.plan.PlanOperatorVisitor;
import org.carball.docsim.model.plan.QueryPlan;
import org.carball.docsim.model.plan.ScanStrategy;
import org.carball.docsim.model.query.FilterPredicate;
import org.carball.docsim.model.schema.ClusterConfig;
import org.carball.docsim.model.schema.CollectionModel;
import org.carball.docsim.planner.UnknownCollectionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Estimates scanned, shuffled and returned volumes for every operator of a
 * plan and prices them with the {@link CostModel}. Nothing is executed; all
 * figures come from collection statistics under uniformity and independence
 * assumptions.
 */
@Slf4j
public class CostSimulator {

    private final CostModel costModel;
    private final ClusterConfig cluster;

    public CostSimulator(CostModel costModel, ClusterConfig cluster) {
        this.costModel = costModel;
        this.cluster = cluster;
    }

    public QueryResult simulate(QueryPlan plan, DesignModels design) {
        return simulate(plan, design.collections());
    }

    public QueryResult simulate(QueryPlan plan, Map<String, CollectionModel> collections) {
        List<OperatorMetrics> results = new ArrayList<>();
        OperatorEstimator estimator = new OperatorEstimator(collections, results);

        for (PlanOperator operator : plan.operators()) {
            OperatorMetrics metrics = operator.accept(estimator);
            log.debug("{} [{}]: scanned {} docs / {} bytes, output {} docs, shuffled {} bytes",
                    operator.name(), operator.kind().label(), metrics.scannedDocs(),
                    metrics.scannedBytes(), metrics.outputDocs(), metrics.shuffledBytes());
            results.add(metrics);
        }

        String totalLabel = plan.query().id() + ":total";
        if (results.isEmpty()) {
            return new QueryResult(plan, results, CostBreakdown.zero(totalLabel), 0, 0, 0, 0, 0);
        }

        CostBreakdown total = costModel.aggregate(totalLabel,
                results.stream().map(OperatorMetrics::cost).toList());
        long scannedDocs = 0;
        long scannedBytes = 0;
        long shuffledBytes = 0;
        for (OperatorMetrics metrics : results) {
            scannedDocs += metrics.scannedDocs();
            scannedBytes += metrics.scannedBytes();
            shuffledBytes += metrics.shuffledBytes();
        }
        OperatorMetrics last = results.get(results.size() - 1);

        return new QueryResult(plan, results, total, scannedDocs, last.outputDocs(),
                scannedBytes, last.outputBytes(), shuffledBytes);
    }

    /**
     * Product of per-predicate equality selectivities.
     */
    static double selectivity(CollectionModel collection, List<FilterPredicate> filters) {
        double selectivity = 1.0;
        for (FilterPredicate predicate : filters) {
            selectivity *= collection.stats().equalitySelectivity(predicate.field());
        }
        return selectivity;
    }

    /**
     * Matching documents, never rounded down to zero while anything can match.
     */
    static long estimateOutputDocs(long baseDocs, double selectivity) {
        long output = Math.max(0L, (long) (baseDocs * selectivity));
        if (output == 0 && baseDocs > 0 && selectivity > 0) {
            return 1;
        }
        return output;
    }

    /**
     * Distinct groups: running product of key cardinalities, stopped once it
     * reaches the input size, clamped to [1, inputDocs]. Keys without
     * statistics are assumed unique per document.
     */
    static long estimateGroupCardinality(CollectionModel collection, List<String> groupingKeys, long inputDocs) {
        if (inputDocs <= 0) {
            return 0;
        }
        long total = 1;
        for (String key : groupingKeys) {
            long cardinality = collection.stats().distinctValues(key);
            if (cardinality <= 0) {
                cardinality = inputDocs;
            }
            total = cardinality > Long.MAX_VALUE / total ? Long.MAX_VALUE : total * cardinality;
            if (total >= inputDocs) {
                break;
            }
        }
        return Math.max(1, Math.min(total, inputDocs));
    }

    private final class OperatorEstimator implements PlanOperatorVisitor<OperatorMetrics> {

        private final Map<String, CollectionModel> collections;
        private final List<OperatorMetrics> upstream;
        private final CostModelConfig config;

        private OperatorEstimator(Map<String, CollectionModel> collections, List<OperatorMetrics> upstream) {
            this.collections = collections;
            this.upstream = upstream;
            this.config = costModel.getConfig();
        }

        @Override
        public OperatorMetrics visitFilter(FilterOperator filter) {
            CollectionModel collection = require(filter.targetCollection(), filter);
            double selectivity = selectivity(collection, filter.filters());

            long baseDocs = collection.nbDocuments();
            long outputDocs = estimateOutputDocs(baseDocs, selectivity);

            long scannedDocs;
            if (filter.scanStrategy() == ScanStrategy.INDEX) {
                scannedDocs = outputDocs;
            } else {
                double shardFraction = filter.scanStrategy() == ScanStrategy.SHARD
                        ? cluster.shardingAccessFraction()
                        : 1.0;
                scannedDocs = Math.max(0L, (long) (baseDocs * shardFraction));
                if (scannedDocs == 0 && baseDocs > 0) {
                    scannedDocs = 1;
                }
            }
            long scannedBytes = scannedDocs * collection.documentSizeBytes();

            List<String> notes = new ArrayList<>();
            long outputDocSize = outputDocSize(collection, filter.outputFields(), notes);
            long outputBytes = outputDocs * outputDocSize;

            CostBreakdown io = costModel.localIo(filter.name() + ":filter", scannedBytes);
            return new OperatorMetrics(filter, scannedDocs, outputDocs, scannedBytes, outputBytes, 0L,
                    outputDocSize, io.withNotes(notes), List.of(io), notes);
        }

        @Override
        public OperatorMetrics visitJoin(JoinOperator join) {
            CollectionModel left = require(join.leftCollection(), join);
            CollectionModel right = require(join.rightCollection(), join);
            OperatorMetrics leftInput = input(join.leftInput(), join);
            OperatorMetrics rightInput = input(join.rightInput(), join);

            long leftDocs = leftInput != null ? leftInput.outputDocs() : left.nbDocuments();
            long rightDocs = rightInput != null ? rightInput.outputDocs() : right.nbDocuments();
            long leftBytes = leftInput != null ? leftInput.outputBytes() : leftDocs * left.documentSizeBytes();
            long rightBytes = rightInput != null ? rightInput.outputBytes() : rightDocs * right.documentSizeBytes();

            long keyCardinality = Math.max(1, Math.max(
                    left.stats().distinctValues(join.join().leftField()),
                    right.stats().distinctValues(join.join().rightField())));
            double joinSelectivity = 1.0 / keyCardinality;

            long outputDocs = Math.max(0L, (long) (Math.min(leftDocs, rightDocs) * joinSelectivity));
            if (outputDocs == 0 && leftDocs > 0 && rightDocs > 0) {
                outputDocs = 1;
            }

            long scanBytes = leftBytes + rightBytes;
            long shuffleBytes = join.aligned() ? 0L : scanBytes;

            List<String> notes = new ArrayList<>();
            long outputDocSize = joinOutputDocSize(join.outputFields(), left, right, notes);
            long outputBytes = outputDocs * outputDocSize;

            CostBreakdown scanCost = costModel.localIo(join.name() + ":join_scan", scanBytes);
            CostBreakdown shuffleCost = costModel.io(join.name() + ":join_shuffle",
                    config.toGb(shuffleBytes), shuffleBytes > 0);
            CostBreakdown total = costModel.aggregate(join.name() + ":join_total", List.of(scanCost, shuffleCost));

            return new OperatorMetrics(join, leftDocs + rightDocs, outputDocs, scanBytes + shuffleBytes,
                    outputBytes, shuffleBytes, outputDocSize, total.withNotes(notes),
                    List.of(scanCost, shuffleCost), notes);
        }

        @Override
        public OperatorMetrics visitAggregate(AggregateOperator aggregate) {
            CollectionModel collection = require(aggregate.targetCollection(), aggregate);
            double filterSelectivity = selectivity(collection, aggregate.filters());

            long baseDocs = collection.nbDocuments();
            long inputDocs = baseDocs > 0 ? Math.max(1L, (long) (baseDocs * filterSelectivity)) : 0L;
            long groups = estimateGroupCardinality(collection, aggregate.groupingKeys(), inputDocs);

            List<String> notes = new ArrayList<>();
            long outputDocSize = outputDocSize(collection, aggregate.effectiveOutputFields(), notes);
            long outputBytes = groups * outputDocSize;

            boolean aligned = aggregate.useSharding()
                    && aggregate.groupingKeys().contains(collection.shardingKey());
            double shardFraction = aligned ? cluster.shardingAccessFraction() : 1.0;
            long mapBytes = (long) (collection.documentSizeBytes() * inputDocs * shardFraction);
            long shuffleBytes = aligned ? 0L : outputBytes * cluster.nbServers();

            CostBreakdown mapCost = costModel.localIo(aggregate.name() + ":map", mapBytes);
            CostBreakdown shuffleCost = costModel.io(aggregate.name() + ":shuffle",
                    config.toGb(shuffleBytes), shuffleBytes > 0);
            CostBreakdown reduceCost = costModel.localIo(aggregate.name() + ":reduce", shuffleBytes + outputBytes);
            CostBreakdown total = costModel.aggregate(aggregate.name() + ":aggregate_total",
                    List.of(mapCost, shuffleCost, reduceCost));

            return new OperatorMetrics(aggregate, inputDocs, groups, mapBytes + shuffleBytes, outputBytes,
                    shuffleBytes, outputDocSize, total.withNotes(notes),
                    List.of(mapCost, shuffleCost, reduceCost), notes);
        }

        private long outputDocSize(CollectionModel collection, List<String> fields, List<String> notes) {
            if (fields.isEmpty()) {
                return collection.documentSizeBytes();
            }
            long total = 0;
            for (String field : fields) {
                total += config.getKeyOverheadBytes() + fieldSize(collection, field, notes);
            }
            return total;
        }

        /**
         * Output fields arrive qualified ({@code collection.field}); an
         * unqualified or unknown qualifier is looked up on the left side.
         */
        private long joinOutputDocSize(List<String> fields, CollectionModel left, CollectionModel right,
                                       List<String> notes) {
            if (fields.isEmpty()) {
                return left.documentSizeBytes() + right.documentSizeBytes();
            }
            long total = 0;
            for (String field : fields) {
                CollectionModel side = left;
                String path = field;
                int dot = field.indexOf('.');
                if (dot > 0) {
                    String qualifier = field.substring(0, dot);
                    if (qualifier.equals(left.name())) {
                        path = field.substring(dot + 1);
                    } else if (qualifier.equals(right.name())) {
                        side = right;
                        path = field.substring(dot + 1);
                    }
                }
                total += config.getKeyOverheadBytes() + fieldSize(side, path, notes);
            }
            return total;
        }

        private int fieldSize(CollectionModel collection, String field, List<String> notes) {
            CollectionModel.FieldSize size = collection.fieldSize(field, config.getUnknownFieldSizeBytes());
            if (!size.resolved()) {
                notes.add("Unknown field " + collection.name() + "." + field
                        + ", assuming " + size.bytes() + " bytes");
            }
            return size.bytes();
        }

        private OperatorMetrics input(OptionalInt position, JoinOperator join) {
            if (position.isEmpty()) {
                return null;
            }
            int index = position.getAsInt();
            if (index < 0 || index >= upstream.size()) {
                throw new IllegalStateException("Join " + join.name() + " references operator #" + index
                        + " which has not been simulated");
            }
            return upstream.get(index);
        }

        private CollectionModel require(String name, PlanOperator operator) {
            CollectionModel collection = collections.get(name);
            if (collection == null) {
                throw new UnknownCollectionException(name, "operator " + operator.name());
            }
            return collection;
        }
    }
}
