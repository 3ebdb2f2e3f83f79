package org.carball.docsim.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.docsim.model.design.DenormalizationSpec;
import org.carball.docsim.model.design.EmbedCardinality;
import org.carball.docsim.model.design.EmbedSpec;
import org.carball.docsim.model.query.QuerySpec;
import org.carball.docsim.model.schema.ClusterConfig;
import org.carball.docsim.model.schema.CollectionConfig;
import org.carball.docsim.model.schema.CollectionSchema;
import org.carball.docsim.model.schema.CollectionStats;
import org.carball.docsim.model.schema.FieldSpec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the schema, statistics, denormalization and query files of a workload.
 */
@Slf4j
public class WorkloadLoader {

    private static final int DEFAULT_FIELD_SIZE = 80;

    private static final Map<String, Integer> TYPE_SIZES = Map.of(
            "integer", 8,
            "number", 8,
            "boolean", 8,
            "date", 20,
            "string", 80
    );

    private final ObjectMapper objectMapper;

    public WorkloadLoader() {
        this(new ObjectMapper());
    }

    public WorkloadLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Workload load(Path schemaFile, Path statsFile, Path denormalizationFile, Path queryFile) throws IOException {
        Map<String, CollectionSchema> schemas = loadSchemas(schemaFile);
        StatsDocument stats = loadStats(statsFile);
        List<DenormalizationSpec> designs = loadDenormalizations(denormalizationFile);
        List<QuerySpec> queries = loadQueries(queryFile, stats.queryFrequencies());

        log.info("Loaded {} collections, {} designs and {} queries", schemas.size(), designs.size(), queries.size());
        return new Workload(schemas, stats.collections(), stats.cluster(), designs, queries);
    }

    public Map<String, CollectionSchema> loadSchemas(Path schemaFile) throws IOException {
        return parseSchemas(readJson(schemaFile));
    }

    public StatsDocument loadStats(Path statsFile) throws IOException {
        return parseStats(readJson(statsFile));
    }

    public List<DenormalizationSpec> loadDenormalizations(Path denormalizationFile) throws IOException {
        return parseDenormalizations(readJson(denormalizationFile));
    }

    public List<QuerySpec> loadQueries(Path queryFile, Map<String, Double> defaultFrequencies) throws IOException {
        return parseQueries(readJson(queryFile), defaultFrequencies);
    }

    /**
     * {@code {collections: {name: {primary_key, fields: {name: {type | avg_size}}}}}}
     */
    public Map<String, CollectionSchema> parseSchemas(JsonNode root) {
        Map<String, CollectionSchema> schemas = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : entries(root.path("collections"))) {
            String name = entry.getKey();
            JsonNode raw = entry.getValue();

            Map<String, FieldSpec> fields = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> field : entries(raw.path("fields"))) {
                fields.put(field.getKey(), new FieldSpec(field.getKey(), fieldSize(field.getValue())));
            }

            String primaryKey = requireText(raw, "primary_key", "collection " + name);
            schemas.put(name, new CollectionSchema(name, primaryKey, fields));
            log.debug("Schema {}: {} fields, primary key {}", name, fields.size(), primaryKey);
        }
        return schemas;
    }

    /**
     * {@code {cluster: {...}, collections: {name: {nb_documents, distinct_values,
     * avg_array_lengths, field_selectivity}}, query_frequencies: {id: freq}}}
     */
    public StatsDocument parseStats(JsonNode root) {
        JsonNode clusterNode = root.path("cluster");
        ClusterConfig cluster = new ClusterConfig(
                clusterNode.path("nb_servers").asInt(ClusterConfig.DEFAULT_NB_SERVERS),
                clusterNode.path("sharding_access_fraction").asDouble(ClusterConfig.DEFAULT_SHARDING_ACCESS_FRACTION)
        );

        Map<String, CollectionStats> collections = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : entries(root.path("collections"))) {
            String name = entry.getKey();
            JsonNode raw = entry.getValue();
            if (!raw.hasNonNull("nb_documents")) {
                throw new WorkloadFormatException("Missing nb_documents for collection " + name);
            }

            Map<String, Long> distinct = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> value : entries(raw.path("distinct_values"))) {
                distinct.put(value.getKey(), value.getValue().asLong());
            }
            collections.put(name, new CollectionStats(
                    raw.get("nb_documents").asLong(),
                    distinct,
                    doubles(raw.path("avg_array_lengths")),
                    doubles(raw.path("field_selectivity"))
            ));
        }

        return new StatsDocument(cluster, collections, doubles(root.path("query_frequencies")));
    }

    /**
     * {@code {denormalizations: [{id, description, collections: {name: {sharding_key, indexes}},
     * embeds: [{from, to, path, cardinality}]}]}}
     */
    public List<DenormalizationSpec> parseDenormalizations(JsonNode root) {
        List<DenormalizationSpec> designs = new ArrayList<>();
        for (JsonNode raw : root.path("denormalizations")) {
            String id = requireText(raw, "id", "denormalization");

            Map<String, CollectionConfig> collections = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> entry : entries(raw.path("collections"))) {
                JsonNode config = entry.getValue();
                Set<String> indexes = new LinkedHashSet<>();
                for (JsonNode index : config.path("indexes")) {
                    indexes.add(index.asText());
                }
                collections.put(entry.getKey(), new CollectionConfig(config.path("sharding_key").asText(""), indexes));
            }

            List<EmbedSpec> embeds = new ArrayList<>();
            for (JsonNode embed : raw.path("embeds")) {
                String context = "embed of design " + id;
                embeds.add(new EmbedSpec(
                        requireText(embed, "from", context),
                        requireText(embed, "to", context),
                        requireText(embed, "path", context),
                        cardinality(embed, context)
                ));
            }

            designs.add(new DenormalizationSpec(id, raw.path("description").asText(""), collections, embeds));
        }
        return designs;
    }

    /**
     * {@code {queries: [{id, sql, frequency?}]}}; a missing frequency falls back
     * to {@code defaultFrequencies}, then to 1.0.
     */
    public List<QuerySpec> parseQueries(JsonNode root, Map<String, Double> defaultFrequencies) {
        List<QuerySpec> queries = new ArrayList<>();
        for (JsonNode raw : root.path("queries")) {
            String id = requireText(raw, "id", "query");
            String sql = requireText(raw, "sql", "query " + id);
            double frequency = raw.hasNonNull("frequency")
                    ? raw.get("frequency").asDouble()
                    : defaultFrequencies.getOrDefault(id, QuerySpec.DEFAULT_FREQUENCY);
            queries.add(new QuerySpec(id, sql, frequency));
        }
        return queries;
    }

    private JsonNode readJson(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Workload file not found: " + file);
        }
        JsonNode root = objectMapper.readTree(Files.readString(file));
        if (root == null || !root.isObject()) {
            throw new WorkloadFormatException("Expected a JSON object in " + file);
        }
        return root;
    }

    private static int fieldSize(JsonNode field) {
        if (field.hasNonNull("avg_size")) {
            return field.get("avg_size").asInt();
        }
        String type = field.path("type").asText("string").toLowerCase();
        return TYPE_SIZES.getOrDefault(type, DEFAULT_FIELD_SIZE);
    }

    private static EmbedCardinality cardinality(JsonNode embed, String context) {
        try {
            return EmbedCardinality.fromName(embed.path("cardinality").asText("one"));
        } catch (IllegalArgumentException e) {
            throw new WorkloadFormatException(e.getMessage() + " in " + context);
        }
    }

    private static String requireText(JsonNode node, String key, String context) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            throw new WorkloadFormatException("Missing required field '" + key + "' in " + context);
        }
        return value.asText();
    }

    private static Map<String, Double> doubles(JsonNode node) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : entries(node)) {
            values.put(entry.getKey(), entry.getValue().asDouble());
        }
        return values;
    }

    private static List<Map.Entry<String, JsonNode>> entries(JsonNode node) {
        List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            entries.add(fields.next());
        }
        return entries;
    }
}
