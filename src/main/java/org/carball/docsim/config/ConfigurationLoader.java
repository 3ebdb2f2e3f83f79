package org.carball.docsim.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.docsim.cost.CostModelConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Loads cost rates using the hierarchy: CLI args > env vars > YAML file > defaults.
     *
     * @param costConfigFile optional YAML file, may be null
     */
    public CostModelConfig loadCostModel(Path costConfigFile, String[] args) throws IOException {
        return loadCostModel(costConfigFile, args, System.getenv());
    }

    CostModelConfig loadCostModel(Path costConfigFile, String[] args, Map<String, String> env) throws IOException {
        log.debug("Loading cost model configuration");

        // Start with defaults, or the YAML file when one is given
        CostModelConfig.CostModelConfigBuilder builder = CostModelConfig.builder();
        if (costConfigFile != null) {
            applyYamlFile(builder, costConfigFile);
        }

        // Then environment variables, then CLI arguments (highest priority)
        applyEnvironmentVariables(builder, env);
        applyCLIArguments(builder, args);

        CostModelConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyYamlFile(CostModelConfig.CostModelConfigBuilder builder, Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Cost configuration file not found: " + file);
        }

        JsonNode root = yamlMapper.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            log.warn("Cost configuration file {} is empty or not a mapping, using defaults", file);
            return;
        }

        applyYamlDouble(root, "time_unit", builder::timeUnit);
        applyYamlDouble(root, "carbon_unit", builder::carbonUnit);
        applyYamlDouble(root, "price_unit", builder::priceUnit);
        applyYamlDouble(root, "network_multiplier", builder::networkMultiplier);
        applyYamlInt(root, "key_overhead_bytes", builder::keyOverheadBytes);
        applyYamlInt(root, "unknown_field_size_bytes", builder::unknownFieldSizeBytes);
        applyYamlPositiveLong(root, "bytes_per_gb", builder::bytesPerGb);

        JsonNode weights = root.path("weights");
        applyYamlDouble(weights, "time", builder::timeWeight);
        applyYamlDouble(weights, "carbon", builder::carbonWeight);
        applyYamlDouble(weights, "price", builder::priceWeight);

        log.info("Loaded cost configuration from: {}", file);
    }

    private void applyYamlDouble(JsonNode node, String key, Consumer<Double> setter) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return;
        }
        if (!value.isNumber()) {
            log.warn("Invalid numeric value for {}: {}", key, value.asText());
            return;
        }
        setter.accept(value.doubleValue());
    }

    private void applyYamlInt(JsonNode node, String key, Consumer<Integer> setter) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return;
        }
        if (!value.canConvertToInt()) {
            log.warn("Invalid integer value for {}: {}", key, value.asText());
            return;
        }
        setter.accept(value.intValue());
    }

    private void applyYamlPositiveLong(JsonNode node, String key, Consumer<Long> setter) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return;
        }
        if (!value.canConvertToLong() || value.longValue() <= 0) {
            log.warn("Invalid positive integer value for {}: {}", key, value.asText());
            return;
        }
        setter.accept(value.longValue());
    }

    private void applyEnvironmentVariables(CostModelConfig.CostModelConfigBuilder builder, Map<String, String> env) {
        applyEnvDouble(env, "DOCSIM_TIME_UNIT", builder::timeUnit);
        applyEnvDouble(env, "DOCSIM_CARBON_UNIT", builder::carbonUnit);
        applyEnvDouble(env, "DOCSIM_PRICE_UNIT", builder::priceUnit);
        applyEnvDouble(env, "DOCSIM_NETWORK_MULTIPLIER", builder::networkMultiplier);
    }

    private void applyEnvDouble(Map<String, String> env, String name, Consumer<Double> setter) {
        if (!env.containsKey(name)) {
            return;
        }
        try {
            setter.accept(Double.parseDouble(env.get(name)));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, env.get(name));
        }
    }

    private void applyCLIArguments(CostModelConfig.CostModelConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--cost.time-unit":
                        builder.timeUnit(Double.parseDouble(value));
                        break;
                    case "--cost.carbon-unit":
                        builder.carbonUnit(Double.parseDouble(value));
                        break;
                    case "--cost.price-unit":
                        builder.priceUnit(Double.parseDouble(value));
                        break;
                    case "--cost.network-multiplier":
                        builder.networkMultiplier(Double.parseDouble(value));
                        break;
                    case "--cost.key-overhead":
                        builder.keyOverheadBytes(Integer.parseInt(value));
                        break;
                    case "--cost.unknown-field-size":
                        builder.unknownFieldSizeBytes(Integer.parseInt(value));
                        break;
                    case "--cost.time-weight":
                        builder.timeWeight(Double.parseDouble(value));
                        break;
                    case "--cost.carbon-weight":
                        builder.carbonWeight(Double.parseDouble(value));
                        break;
                    case "--cost.price-weight":
                        builder.priceWeight(Double.parseDouble(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for cost configuration options.
     */
    public static String getCostHelp() {
        return """
            Cost Configuration Options:

            CLI Arguments:
              --cost.time-unit <num>            Time cost per GB scanned
              --cost.carbon-unit <num>          Carbon cost per GB scanned
              --cost.price-unit <num>           Price cost per GB scanned
              --cost.network-multiplier <num>   Multiplier applied to shuffled data
              --cost.key-overhead <num>         Per-field overhead in output documents (bytes)
              --cost.unknown-field-size <num>   Size assumed for unknown fields (bytes)
              --cost.time-weight <num>          Leaderboard weight of time
              --cost.carbon-weight <num>        Leaderboard weight of carbon
              --cost.price-weight <num>         Leaderboard weight of price

            Environment Variables:
              DOCSIM_TIME_UNIT                  Same as --cost.time-unit
              DOCSIM_CARBON_UNIT                Same as --cost.carbon-unit
              DOCSIM_PRICE_UNIT                 Same as --cost.price-unit
              DOCSIM_NETWORK_MULTIPLIER         Same as --cost.network-multiplier

            YAML file (--cost-config):
              time_unit, carbon_unit, price_unit, network_multiplier,
              key_overhead_bytes, unknown_field_size_bytes, bytes_per_gb,
              weights: { time, carbon, price }

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML file
              4. Built-in defaults
            """;
    }
}
