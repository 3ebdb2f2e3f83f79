package org.carball.docsim.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.docsim.analyzer.DesignTotals;
import org.carball.docsim.analyzer.EvaluationFailure;
import org.carball.docsim.analyzer.WorkloadEvaluationException;
import org.carball.docsim.analyzer.WorkloadEvaluator;
import org.carball.docsim.analyzer.WorkloadReport;
import org.carball.docsim.config.ConfigurationLoader;
import org.carball.docsim.config.FailurePolicy;
import org.carball.docsim.config.SimulatorConfig;
import org.carball.docsim.cost.CostModel;
import org.carball.docsim.loader.Workload;
import org.carball.docsim.loader.WorkloadFormatException;
import org.carball.docsim.loader.WorkloadLoader;
import org.carball.docsim.output.LeaderboardWriter;
import org.carball.docsim.output.PlanReport;
import org.carball.docsim.output.ResultsCsvWriter;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

@Slf4j
public class DocSimCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          Denormalization Cost Simulator v%s                ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        int exitCode = run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length == 0 || isHelpRequested(args)) {
            printUsage();
            return args.length == 0 ? 1 : 0;
        }

        try {
            SimulatorConfig config = parseArgs(args);
            if (config.isVerbose()) {
                enableDebugLogging();
            }
            config.setCostModelConfig(new ConfigurationLoader().loadCostModel(config.getCostConfigFile(), args));

            System.out.println("\n🔍 Starting simulation...");
            System.out.println("   Schema: " + config.getSchemaFile());
            System.out.println("   Stats: " + config.getStatsFile());
            System.out.println("   Denormalizations: " + config.getDenormalizationsFile());
            System.out.println("   Queries: " + config.getQueriesFile());
            System.out.println("   Output directory: " + config.getOutputDirectory());
            System.out.println("   Cost model: " + config.getCostModelConfig().getConfigurationSummary());
            System.out.println();

            // Step 1: Load the workload
            System.out.print("📂 Loading workload... ");
            Workload workload = new WorkloadLoader().load(
                    config.getSchemaFile(),
                    config.getStatsFile(),
                    config.getDenormalizationsFile(),
                    config.getQueriesFile());
            System.out.println("✓");

            // Step 2: Plan and simulate every query under every design
            System.out.print("📊 Simulating " + workload.queries().size() + " queries under "
                    + workload.designs().size() + " designs... ");
            CostModel costModel = new CostModel(config.getCostModelConfig());
            WorkloadReport report = new WorkloadEvaluator(costModel, config.getFailurePolicy()).evaluate(workload);
            System.out.println("✓");

            // Step 3: Write plans, results and leaderboard
            System.out.print("📝 Writing results... ");
            List<Path> written = outputResults(report, costModel, config.getOutputDirectory());
            System.out.println("✓");

            printSummary(report, costModel);

            System.out.println("\n✅ Simulation complete!");
            System.out.println("   Output files:");
            written.forEach(path -> System.out.println("     - " + path));

            if (report.hasFailures()) {
                System.out.println("\n⚠️  " + report.failures().size() + " evaluation(s) failed, see leaderboard.md");
            }
            return 0;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (WorkloadEvaluationException e) {
            System.err.println("\n❌ Simulation failed: " + e.getMessage());
            System.err.println("\nUse --continue-on-error to skip failing evaluations.");
            log.debug("Simulation error details", e);
            return 2;
        } catch (WorkloadFormatException e) {
            System.err.println("\n❌ Invalid workload file: " + e.getMessage());
            log.debug("Workload format error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (RuntimeException e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar docsim.jar --schema <file> --stats <file> --denorm <file> --queries <file> [options]");
        System.out.println();
        System.out.println("Required:");
        System.out.println("  --schema            Collection schemas (JSON)");
        System.out.println("  --stats             Collection statistics and cluster settings (JSON)");
        System.out.println("  --denorm            Candidate denormalization designs (JSON)");
        System.out.println("  --queries           Query workload (JSON)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --out, -o           Output directory (default: results)");
        System.out.println("  --cost-config       YAML file with cost rates and leaderboard weights");
        System.out.println("  --continue-on-error Record failing evaluations and keep going");
        System.out.println("  --verbose, -v       Enable debug logging");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getCostHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar docsim.jar --schema schema.json --stats stats.json \\");
        System.out.println("      --denorm denormalizations.json --queries queries.json --out results");
        System.out.println();
        System.out.println("  # Double the network penalty");
        System.out.println("  java -jar docsim.jar ... --cost.network-multiplier 10");
    }

    static SimulatorConfig parseArgs(String[] args) {
        SimulatorConfig config = new SimulatorConfig();

        // Set defaults
        config.setOutputDirectory(Paths.get("results"));
        config.setFailurePolicy(FailurePolicy.FAIL_FAST);
        config.setVerbose(false);

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--schema":
                    config.setSchemaFile(Paths.get(requireValue(args, ++i, "Schema file")));
                    break;

                case "--stats":
                    config.setStatsFile(Paths.get(requireValue(args, ++i, "Stats file")));
                    break;

                case "--denorm":
                    config.setDenormalizationsFile(Paths.get(requireValue(args, ++i, "Denormalization file")));
                    break;

                case "--queries":
                    config.setQueriesFile(Paths.get(requireValue(args, ++i, "Query file")));
                    break;

                case "--out":
                case "-o":
                    config.setOutputDirectory(Paths.get(requireValue(args, ++i, "Output directory")));
                    break;

                case "--cost-config":
                    config.setCostConfigFile(Paths.get(requireValue(args, ++i, "Cost config file")));
                    break;

                case "--continue-on-error":
                    config.setFailurePolicy(FailurePolicy.CONTINUE);
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    if (args[i].startsWith("--cost.")) {
                        // Value is applied by ConfigurationLoader
                        String option = args[i];
                        requireValue(args, ++i, option);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int index, String what) {
        if (index >= args.length) {
            throw new IllegalArgumentException(what + " not specified");
        }
        return args[index];
    }

    private static void validateConfig(SimulatorConfig config) {
        requireFile(config.getSchemaFile(), "--schema");
        requireFile(config.getStatsFile(), "--stats");
        requireFile(config.getDenormalizationsFile(), "--denorm");
        requireFile(config.getQueriesFile(), "--queries");

        if (Files.exists(config.getOutputDirectory()) && !Files.isDirectory(config.getOutputDirectory())) {
            throw new IllegalArgumentException("Output path is not a directory: " + config.getOutputDirectory());
        }
    }

    private static void requireFile(Path file, String option) {
        if (file == null) {
            throw new IllegalArgumentException("Missing required option " + option);
        }
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("File not found for " + option + ": " + file);
        }
    }

    private static List<Path> outputResults(WorkloadReport report, CostModel costModel, Path outputDirectory)
            throws IOException {
        Files.createDirectories(outputDirectory);

        Path plansDirectory = outputDirectory.resolve("plans");
        for (PlanReport planReport : PlanReport.fromWorkload(report)) {
            planReport.writeTo(plansDirectory);
        }

        Path csv = new ResultsCsvWriter().write(report, outputDirectory.resolve("results.csv"));
        Path leaderboard = new LeaderboardWriter(costModel).write(report, outputDirectory.resolve("leaderboard.md"));
        return List.of(plansDirectory, csv, leaderboard);
    }

    private static void printSummary(WorkloadReport report, CostModel costModel) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 SIMULATION SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nEvaluations: " + report.evaluations().size());
        System.out.println("Designs ranked: " + report.totals().size());
        System.out.println("Failures: " + report.failures().size());

        System.out.println("\n🏆 Leaderboard:");
        System.out.println("-".repeat(60));
        int rank = 1;
        for (DesignTotals totals : report.leaderboard()) {
            System.out.printf("%2d. %-12s price=%.6f carbon=%.6f time=%.6f weighted=%.6f%s%n",
                    rank++, totals.designId(), totals.price(), totals.carbon(), totals.time(),
                    costModel.weightedScore(totals.time(), totals.carbon(), totals.price()),
                    totals.isComplete() ? "" : " (incomplete)");
        }

        for (EvaluationFailure failure : report.failures()) {
            System.out.printf("  └─ %s %s: %s%n", failure.designId(),
                    failure.isDesignFailure() ? "(design)" : failure.queryId(), failure.message());
        }
    }

    private static void enableDebugLogging() {
        Logger projectLogger = (Logger) LoggerFactory.getLogger("org.carball.docsim");
        projectLogger.setLevel(Level.DEBUG);
    }
}
