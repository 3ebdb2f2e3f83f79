package org.carball.docsim.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.docsim.config.FailurePolicy;
import org.carball.docsim.config.SimulatorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocSimCLITest {

    @TempDir
    Path tempDir;

    private Path workloadDir;

    @BeforeEach
    void setUp() throws Exception {
        workloadDir = Paths.get(getClass().getResource("/workload/schema.json").toURI()).getParent();
    }

    private String[] workloadArgs(String... extra) {
        String[] base = {
                "--schema", workloadDir.resolve("schema.json").toString(),
                "--stats", workloadDir.resolve("stats.json").toString(),
                "--denorm", workloadDir.resolve("denormalizations.json").toString(),
                "--queries", workloadDir.resolve("queries.json").toString()
        };
        String[] args = new String[base.length + extra.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(extra, 0, args, base.length, extra.length);
        return args;
    }

    @Test
    void shouldParseRequiredFilesWithDefaults() {
        // When
        SimulatorConfig config = DocSimCLI.parseArgs(workloadArgs());

        // Then
        assertThat(config.getSchemaFile()).isEqualTo(workloadDir.resolve("schema.json"));
        assertThat(config.getQueriesFile()).isEqualTo(workloadDir.resolve("queries.json"));
        assertThat(config.getOutputDirectory()).isEqualTo(Paths.get("results"));
        assertThat(config.getFailurePolicy()).isEqualTo(FailurePolicy.FAIL_FAST);
        assertThat(config.isVerbose()).isFalse();
        assertThat(config.getCostConfigFile()).isNull();
    }

    @Test
    void shouldParseOptionalFlagsAndSkipCostValues() {
        // When
        SimulatorConfig config = DocSimCLI.parseArgs(workloadArgs(
                "--cost.network-multiplier", "10",
                "--continue-on-error",
                "-o", tempDir.toString(),
                "-v"));

        // Then
        assertThat(config.getFailurePolicy()).isEqualTo(FailurePolicy.CONTINUE);
        assertThat(config.getOutputDirectory()).isEqualTo(tempDir);
        assertThat(config.isVerbose()).isTrue();
    }

    @Test
    void shouldRejectUnknownOption() {
        // When/Then
        assertThatThrownBy(() -> DocSimCLI.parseArgs(workloadArgs("--format", "xml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown option: --format");
    }

    @Test
    void shouldRequireEveryWorkloadFile() {
        // When/Then
        assertThatThrownBy(() -> DocSimCLI.parseArgs(new String[]{"--schema", "schema.json"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--schema");
        assertThatThrownBy(() -> DocSimCLI.parseArgs(new String[]{
                "--schema", workloadDir.resolve("schema.json").toString()}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required option --stats");
        assertThatThrownBy(() -> DocSimCLI.parseArgs(new String[]{"--schema"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Schema file not specified");
    }

    @Test
    void shouldRejectOutputPathThatIsAFile() throws Exception {
        // Given
        Path file = Files.writeString(tempDir.resolve("taken"), "x");

        // When/Then
        assertThatThrownBy(() -> DocSimCLI.parseArgs(workloadArgs("--out", file.toString())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a directory");
    }

    @Test
    void shouldWritePlansResultsAndLeaderboard() throws Exception {
        // Given
        Path out = tempDir.resolve("results");

        // When
        int exitCode = DocSimCLI.run(workloadArgs("--out", out.toString()));

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.resolve("plans")).isDirectory();
        assertThat(out.resolve("plans").resolve("query1.plan.json")).exists();
        assertThat(out.resolve("plans").resolve("query2.plan.json")).exists();
        assertThat(out.resolve("plans").resolve("query3.plan.json")).exists();

        List<String> rows = Files.readAllLines(out.resolve("results.csv"));
        assertThat(rows).hasSize(1 + 2 * 3);
        assertThat(rows.get(1)).startsWith("D1,Q1,");

        String leaderboard = Files.readString(out.resolve("leaderboard.md"));
        assertThat(leaderboard).contains("| 1 | D1 |").contains("| 2 | D2 |");

        JsonNode plan = new ObjectMapper().readTree(out.resolve("plans").resolve("query2.plan.json").toFile());
        assertThat(plan.get("per_denorm").fieldNames()).toIterable().containsExactly("D1", "D2");
    }

    @Test
    void shouldReturnErrorCodeForMissingFile() {
        // When
        int exitCode = DocSimCLI.run(new String[]{"--schema", tempDir.resolve("nope.json").toString()});

        // Then
        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void shouldShowHelpWithoutError() {
        // Then
        assertThat(DocSimCLI.run(new String[]{"--help"})).isZero();
        assertThat(DocSimCLI.run(new String[0])).isEqualTo(1);
    }
}
