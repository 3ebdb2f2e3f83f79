package org.carball.docsim.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.carball.docsim.analyzer.QueryEvaluation;
import org.carball.docsim.analyzer.WorkloadReport;
import org.carball.docsim.model.plan.AggregateOperator;
import org.carball.docsim.model.plan.FilterOperator;
import org.carball.docsim.model.plan.JoinOperator;
import org.carball.docsim.model.plan.PlanOperator;
import org.carball.docsim.model.plan.PlanOperatorVisitor;
import org.carball.docsim.model.plan.QueryPlan;
import org.carball.docsim.model.query.FilterPredicate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Physical plans of one query under every evaluated design.
 */
@Slf4j
public class PlanReport {

    private static final Pattern NUMBERED_QUERY = Pattern.compile("Q(\\d+)");

    private final String queryId;
    private final Map<String, QueryPlan> plansByDesign;
    private final ObjectMapper objectMapper;

    public PlanReport(String queryId, Map<String, QueryPlan> plansByDesign) {
        this.queryId = queryId;
        this.plansByDesign = new LinkedHashMap<>(plansByDesign);

        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public static List<PlanReport> fromWorkload(WorkloadReport report) {
        List<PlanReport> reports = new ArrayList<>();
        report.byQuery().forEach((queryId, byDesign) -> {
            Map<String, QueryPlan> plans = new LinkedHashMap<>();
            for (Map.Entry<String, QueryEvaluation> entry : byDesign.entrySet()) {
                plans.put(entry.getKey(), entry.getValue().result().plan());
            }
            reports.add(new PlanReport(queryId, plans));
        });
        return reports;
    }

    /**
     * File name stem for a query id: {@code Q3} becomes {@code query3}, anything else is lower-cased.
     */
    public static String fileStub(String queryId) {
        Matcher matcher = NUMBERED_QUERY.matcher(queryId);
        if (matcher.matches()) {
            return "query" + matcher.group(1);
        }
        return queryId.toLowerCase(Locale.ROOT);
    }

    public String getQueryId() {
        return queryId;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (IOException e) {
            log.error("Error generating plan report for {}", queryId, e);
            throw new IllegalStateException("Failed to generate plan report for " + queryId, e);
        }
    }

    public Path writeTo(Path plansDirectory) throws IOException {
        Files.createDirectories(plansDirectory);
        Path file = plansDirectory.resolve(fileStub(queryId) + ".plan.json");
        Files.writeString(file, toJson());
        log.debug("Wrote plan report {}", file);
        return file;
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.queryId = queryId;
        report.perDenorm = new LinkedHashMap<>();
        plansByDesign.forEach((designId, plan) -> report.perDenorm.put(designId, describePlan(plan)));
        return report;
    }

    private PlanData describePlan(QueryPlan plan) {
        PlanData data = new PlanData();
        data.queryId = plan.query().id();
        data.sql = plan.query().sql();
        data.involvedCollections = plan.involvedCollections();

        Set<String> requiredIndexes = new LinkedHashSet<>();
        OperatorDescriber describer = new OperatorDescriber();
        data.operators = new ArrayList<>();
        for (PlanOperator operator : plan.operators()) {
            data.operators.add(operator.accept(describer));
            if (operator instanceof FilterOperator filter) {
                filter.indexesUsed().forEach(index -> requiredIndexes.add(filter.targetCollection() + "." + index));
            }
        }
        data.requiredIndexes = new ArrayList<>(requiredIndexes);
        return data;
    }

    private static List<FilterData> describeFilters(List<FilterPredicate> filters) {
        return filters.stream()
                .map(predicate -> new FilterData(predicate.field(), predicate.value()))
                .collect(Collectors.toList());
    }

    private static final class OperatorDescriber implements PlanOperatorVisitor<OperatorData> {

        @Override
        public OperatorData visitFilter(FilterOperator filter) {
            OperatorData data = base(filter);
            data.targetCollection = filter.targetCollection();
            data.filters = describeFilters(filter.filters());
            data.scanStrategy = filter.scanStrategy().label();
            data.indexesUsed = filter.indexesUsed();
            return data;
        }

        @Override
        public OperatorData visitJoin(JoinOperator join) {
            OperatorData data = base(join);
            data.leftCollection = join.leftCollection();
            data.rightCollection = join.rightCollection();
            data.join = new JoinData(
                    join.leftCollection() + "." + join.join().leftField(),
                    join.rightCollection() + "." + join.join().rightField());
            return data;
        }

        @Override
        public OperatorData visitAggregate(AggregateOperator aggregate) {
            OperatorData data = base(aggregate);
            data.targetCollection = aggregate.targetCollection();
            data.filters = describeFilters(aggregate.filters());
            data.groupingKeys = aggregate.groupingKeys();
            data.outputFields = aggregate.effectiveOutputFields();
            return data;
        }

        private OperatorData base(PlanOperator operator) {
            OperatorData data = new OperatorData();
            data.name = operator.name();
            data.type = operator.kind().label();
            data.outputFields = operator.outputFields();
            return data;
        }
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        @JsonProperty("query_id")
        private String queryId;
        @JsonProperty("per_denorm")
        private Map<String, PlanData> perDenorm;
    }

    @lombok.Data
    private static class PlanData {
        @JsonProperty("query_id")
        private String queryId;
        private String sql;
        @JsonProperty("involved_collections")
        private List<String> involvedCollections;
        @JsonProperty("required_indexes")
        private List<String> requiredIndexes;
        private List<OperatorData> operators;
    }

    @lombok.Data
    private static class OperatorData {
        private String name;
        private String type;
        @JsonProperty("target_collection")
        private String targetCollection;
        @JsonProperty("left_collection")
        private String leftCollection;
        @JsonProperty("right_collection")
        private String rightCollection;
        private List<FilterData> filters;
        private JoinData join;
        @JsonProperty("grouping_keys")
        private List<String> groupingKeys;
        @JsonProperty("output_fields")
        private List<String> outputFields;
        @JsonProperty("scan_strategy")
        private String scanStrategy;
        @JsonProperty("indexes_used")
        private List<String> indexesUsed;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class FilterData {
        private String field;
        private Object value;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class JoinData {
        private String left;
        private String right;
    }
}
