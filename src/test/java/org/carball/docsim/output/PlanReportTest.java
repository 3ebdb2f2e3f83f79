package org.carball.docsim.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.docsim.WorkloadFixtures;
import org.carball.docsim.analyzer.WorkloadEvaluator;
import org.carball.docsim.analyzer.WorkloadReport;
import org.carball.docsim.config.FailurePolicy;
import org.carball.docsim.cost.CostModel;
import org.carball.docsim.cost.CostModelConfig;
import org.carball.docsim.loader.Workload;
import org.carball.docsim.model.query.QuerySpec;
import org.carball.docsim.model.schema.ClusterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlanReportTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private List<PlanReport> reports;

    @BeforeEach
    void setUp() {
        Workload workload = new Workload(WorkloadFixtures.schemas(), WorkloadFixtures.stats(), ClusterConfig.defaults(),
                List.of(WorkloadFixtures.normalized(), WorkloadFixtures.productInOrderLine()),
                List.of(
                        new QuerySpec("Q2", "SELECT ol.quantity, p.price FROM OrderLine ol JOIN Product p "
                                + "ON ol.IDP = p.IDP WHERE p.brand = 'apple' AND ol.IDC = 125;"),
                        new QuerySpec("Stock-By-Warehouse", "SELECT IDW FROM Stock GROUP BY IDW")));
        WorkloadReport report = new WorkloadEvaluator(new CostModel(CostModelConfig.defaults()), FailurePolicy.FAIL_FAST)
                .evaluate(workload);
        reports = PlanReport.fromWorkload(report);
    }

    @Test
    void shouldGroupPlansByQuery() {
        // Then
        assertThat(reports).extracting(PlanReport::getQueryId).containsExactly("Q2", "Stock-By-Warehouse");
    }

    @Test
    void shouldDescribeJoinPlanOperators() throws Exception {
        // When
        JsonNode root = mapper.readTree(reports.get(0).toJson());

        // Then
        assertThat(root.get("query_id").asText()).isEqualTo("Q2");
        JsonNode normalized = root.path("per_denorm").path("D1");
        assertThat(normalized.get("sql").asText()).startsWith("SELECT ol.quantity");
        assertThat(normalized.get("involved_collections")).extracting(JsonNode::asText)
                .containsExactly("OrderLine", "Product");
        assertThat(normalized.get("required_indexes")).extracting(JsonNode::asText)
                .containsExactly("Product.brand");

        JsonNode operators = normalized.get("operators");
        assertThat(operators).hasSize(3);
        assertThat(operators.get(0).get("type").asText()).isEqualTo("filter_with_sharding");
        assertThat(operators.get(0).get("scan_strategy").asText()).isEqualTo("shard");
        assertThat(operators.get(0).get("filters").get(0).get("field").asText()).isEqualTo("IDC");
        assertThat(operators.get(0).get("filters").get(0).get("value").asLong()).isEqualTo(125L);
        assertThat(operators.get(1).get("scan_strategy").asText()).isEqualTo("index");
        assertThat(operators.get(1).get("indexes_used")).extracting(JsonNode::asText).containsExactly("brand");

        JsonNode join = operators.get(2);
        assertThat(join.get("name").asText()).isEqualTo("Q2_join");
        assertThat(join.get("type").asText()).isEqualTo("nested_loop_without_sharding");
        assertThat(join.get("left_collection").asText()).isEqualTo("OrderLine");
        assertThat(join.get("right_collection").asText()).isEqualTo("Product");
        assertThat(join.get("join").get("left").asText()).isEqualTo("OrderLine.IDP");
        assertThat(join.get("join").get("right").asText()).isEqualTo("Product.IDP");
        assertThat(join.has("scan_strategy")).isFalse();
    }

    @Test
    void shouldDescribeCollapsedJoinAndAggregate() throws Exception {
        // When
        JsonNode embedded = mapper.readTree(reports.get(0).toJson()).path("per_denorm").path("D2");
        JsonNode aggregate = mapper.readTree(reports.get(1).toJson()).path("per_denorm").path("D1")
                .get("operators").get(0);

        // Then
        assertThat(embedded.get("operators")).hasSize(1);
        JsonNode filter = embedded.get("operators").get(0);
        assertThat(filter.get("target_collection").asText()).isEqualTo("OrderLine");
        assertThat(filter.get("scan_strategy").asText()).isEqualTo("full");
        assertThat(filter.has("join")).isFalse();
        assertThat(filter.get("output_fields")).extracting(JsonNode::asText)
                .containsExactly("quantity", "product.price");

        assertThat(aggregate.get("type").asText()).isEqualTo("aggregate_without_sharding");
        assertThat(aggregate.get("grouping_keys")).extracting(JsonNode::asText).containsExactly("IDW");
    }

    @Test
    void shouldNamePlanFilesAfterQueryIds() throws Exception {
        // When
        Path written = reports.get(0).writeTo(tempDir.resolve("plans"));
        Path other = reports.get(1).writeTo(tempDir.resolve("plans"));

        // Then
        assertThat(written).isEqualTo(tempDir.resolve("plans").resolve("query2.plan.json"));
        assertThat(other.getFileName().toString()).isEqualTo("stock-by-warehouse.plan.json");
        assertThat(mapper.readTree(Files.readString(written)).get("query_id").asText()).isEqualTo("Q2");
        assertThat(PlanReport.fileStub("Q12")).isEqualTo("query12");
        assertThat(PlanReport.fileStub("q1")).isEqualTo("q1");
    }
}
