package org.carball.docsim.config;

import lombok.Data;
import org.carball.docsim.cost.CostModelConfig;

import java.nio.file.Path;

@Data
public class SimulatorConfig {
    private Path schemaFile;
    private Path statsFile;
    private Path denormalizationsFile;
    private Path queriesFile;
    private Path outputDirectory;
    private Path costConfigFile;
    private FailurePolicy failurePolicy;
    private boolean verbose;
    private CostModelConfig costModelConfig;
}
