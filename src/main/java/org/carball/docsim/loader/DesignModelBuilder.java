package org.carball.docsim.loader;

import lombok.extern.slf4j.Slf4j;
import org.carball.docsim.model.design.DenormalizationSpec;
import org.carball.docsim.model.design.DesignModels;
import org.carball.docsim.model.design.EmbedKey;
import org.carball.docsim.model.design.EmbedSpec;
import org.carball.docsim.model.schema.CollectionConfig;
import org.carball.docsim.model.schema.CollectionModel;
import org.carball.docsim.model.schema.CollectionSchema;
import org.carball.docsim.model.schema.CollectionStats;
import org.carball.docsim.model.schema.FieldSpec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Materializes the collections of one design. Each embedding copies the
 * source collection's fields and statistics into the target under the embed
 * path; the loaded schemas and statistics are never modified.
 */
@Slf4j
public class DesignModelBuilder {

    public DesignModels build(Workload workload, DenormalizationSpec design) {
        return build(workload.schemas(), workload.stats(), design);
    }

    public DesignModels build(Map<String, CollectionSchema> schemas,
                              Map<String, CollectionStats> stats,
                              DenormalizationSpec design) {
        Map<String, CollectionModel> models = new LinkedHashMap<>();

        for (Map.Entry<String, CollectionConfig> entry : design.collections().entrySet()) {
            String name = entry.getKey();
            CollectionSchema schema = schemas.get(name);
            if (schema == null) {
                throw new MissingSchemaException(design.id(), name);
            }
            CollectionStats collectionStats = stats.get(name);
            if (collectionStats == null) {
                throw new MissingStatsException(design.id(), name);
            }

            CollectionConfig config = entry.getValue();
            if (!config.hasShardingKey()) {
                config = config.withShardingKey(schema.primaryKey());
            }
            models.put(name, new CollectionModel(schema, collectionStats, config));
        }

        for (EmbedSpec embed : design.embeds()) {
            CollectionModel target = models.get(embed.target());
            if (target == null) {
                log.debug("Design {}: skipping embed {} -> {}, target not in design",
                        design.id(), embed.source(), embed.target());
                continue;
            }
            CollectionSchema sourceSchema = schemas.get(embed.source());
            if (sourceSchema == null) {
                throw new MissingSchemaException(design.id(), embed.source());
            }
            CollectionStats sourceStats = stats.get(embed.source());
            if (sourceStats == null) {
                throw new MissingStatsException(design.id(), embed.source());
            }

            models.put(embed.target(), new CollectionModel(
                    embedSchema(target.schema(), sourceSchema, embed),
                    embedStats(target.stats(), sourceStats, embed),
                    target.config()
            ));
            log.debug("Design {}: embedded {} into {} at '{}' ({})",
                    design.id(), embed.source(), embed.target(), embed.path(), embed.cardinality());
        }

        return new DesignModels(design, models, embedIndex(design, models));
    }

    /**
     * (source, target) to embed, restricted to embeds whose target exists in the design.
     */
    static Map<EmbedKey, EmbedSpec> embedIndex(DenormalizationSpec design, Map<String, CollectionModel> models) {
        Map<EmbedKey, EmbedSpec> index = new LinkedHashMap<>();
        for (EmbedSpec embed : design.embeds()) {
            if (models.containsKey(embed.target())) {
                index.put(embed.key(), embed);
            }
        }
        return index;
    }

    private static CollectionSchema embedSchema(CollectionSchema target, CollectionSchema source, EmbedSpec embed) {
        Map<String, FieldSpec> fields = new LinkedHashMap<>(target.fields());
        String arrayPath = embed.isArray() ? embed.path() : null;
        for (FieldSpec field : source.fields().values()) {
            String path = embed.prefix(field.name());
            fields.put(path, new FieldSpec(path, field.avgSize(), arrayPath));
        }
        return new CollectionSchema(target.name(), target.primaryKey(), fields);
    }

    private static CollectionStats embedStats(CollectionStats target, CollectionStats source, EmbedSpec embed) {
        Map<String, Long> distinct = new LinkedHashMap<>(target.distinctValues());
        Map<String, Double> selectivity = new LinkedHashMap<>(target.fieldSelectivity());
        source.distinctValues().forEach((field, value) -> distinct.put(embed.prefix(field), value));
        source.fieldSelectivity().forEach((field, value) -> selectivity.put(embed.prefix(field), value));
        return new CollectionStats(target.nbDocuments(), distinct, target.avgArrayLengths(), selectivity);
    }
}
