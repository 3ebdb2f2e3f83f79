package org.carball.docsim.output;

import lombok.extern.slf4j.Slf4j;
import org.carball.docsim.analyzer.DesignTotals;
import org.carball.docsim.analyzer.EvaluationFailure;
import org.carball.docsim.analyzer.WorkloadReport;
import org.carball.docsim.cost.CostModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Markdown ranking of the candidate designs by frequency-weighted workload cost.
 */
@Slf4j
public class LeaderboardWriter {

    private final CostModel costModel;

    public LeaderboardWriter(CostModel costModel) {
        this.costModel = costModel;
    }

    public String toMarkdown(WorkloadReport report) {
        StringBuilder md = new StringBuilder();

        md.append("# Denormalization Leaderboard\n\n");
        md.append("| Rank | Denorm | Time | Carbon | Price | Weighted |\n");
        md.append("|------|--------|------|--------|-------|----------|\n");

        List<DesignTotals> ranking = report.leaderboard();
        int rank = 1;
        for (DesignTotals totals : ranking) {
            double weighted = costModel.weightedScore(totals.time(), totals.carbon(), totals.price());
            md.append("| ").append(rank++)
                    .append(" | ").append(totals.designId())
                    .append(totals.isComplete() ? "" : " (incomplete)")
                    .append(" | ").append(format(totals.time()))
                    .append(" | ").append(format(totals.carbon()))
                    .append(" | ").append(format(totals.price()))
                    .append(" | ").append(format(weighted))
                    .append(" |\n");
        }
        if (ranking.isEmpty()) {
            md.append("\n**No design could be evaluated.**\n");
        } else if (ranking.stream().anyMatch(totals -> !totals.isComplete())) {
            md.append("\n_Incomplete designs failed at least one query and are ranked last._\n");
        }

        md.append("\n## Weights\n\n");
        md.append("- Time: ").append(format(costModel.getConfig().getTimeWeight())).append("\n");
        md.append("- Carbon: ").append(format(costModel.getConfig().getCarbonWeight())).append("\n");
        md.append("- Price: ").append(format(costModel.getConfig().getPriceWeight())).append("\n");

        if (report.hasFailures()) {
            md.append("\n## Failed Evaluations\n\n");
            md.append("| Denorm | Query | Error |\n");
            md.append("|--------|-------|-------|\n");
            for (EvaluationFailure failure : report.failures()) {
                md.append("| ").append(failure.designId())
                        .append(" | ").append(failure.isDesignFailure() ? "(all)" : failure.queryId())
                        .append(" | ").append(failure.errorType()).append(": ")
                        .append(String.valueOf(failure.message()).replace("|", "\\|"))
                        .append(" |\n");
            }
        }

        return md.toString();
    }

    public Path write(WorkloadReport report, Path file) throws IOException {
        Files.writeString(file, toMarkdown(report));
        log.debug("Wrote leaderboard to {}", file);
        return file;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }
}
