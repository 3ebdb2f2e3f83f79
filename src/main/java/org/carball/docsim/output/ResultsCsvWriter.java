package org.carball.docsim.output;

import lombok.extern.slf4j.Slf4j;
import org.carball.docsim.analyzer.QueryEvaluation;
import org.carball.docsim.analyzer.WorkloadReport;
import org.carball.docsim.model.cost.CostBreakdown;
import org.carball.docsim.model.cost.QueryResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * One CSV row per (design, query) evaluation.
 */
@Slf4j
public class ResultsCsvWriter {

    static final List<String> HEADER = List.of(
            "denorm_id", "query_id", "operator_plan_summary",
            "time", "carbon", "price",
            "scanned_docs", "output_docs", "scanned_bytes", "returned_bytes");

    public String toCsv(WorkloadReport report) {
        StringBuilder csv = new StringBuilder();
        csv.append(String.join(",", HEADER)).append('\n');

        for (QueryEvaluation evaluation : report.evaluations()) {
            QueryResult result = evaluation.result();
            CostBreakdown cost = result.totalCost();
            csv.append(escape(evaluation.designId())).append(',')
                    .append(escape(evaluation.query().id())).append(',')
                    .append(escape(result.operatorPlanSummary())).append(',')
                    .append(cost.timeCost()).append(',')
                    .append(cost.carbonCost()).append(',')
                    .append(cost.priceCost()).append(',')
                    .append(result.scannedDocs()).append(',')
                    .append(result.outputDocs()).append(',')
                    .append(result.scannedBytes()).append(',')
                    .append(result.outputBytes()).append('\n');
        }
        return csv.toString();
    }

    public Path write(WorkloadReport report, Path file) throws IOException {
        Files.writeString(file, toCsv(report));
        log.debug("Wrote {} result rows to {}", report.evaluations().size(), file);
        return file;
    }

    static String escape(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
