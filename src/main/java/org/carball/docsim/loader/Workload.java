package org.carball.docsim.loader;

import org.carball.docsim.model.design.DenormalizationSpec;
import org.carball.docsim.model.query.QuerySpec;
import org.carball.docsim.model.schema.ClusterConfig;
import org.carball.docsim.model.schema.CollectionSchema;
import org.carball.docsim.model.schema.CollectionStats;

import java.util.List;
import java.util.Map;

/**
 * All inputs of one simulation run, as read from the four workload files.
 */
public record Workload(
        Map<String, CollectionSchema> schemas,
        Map<String, CollectionStats> stats,
        ClusterConfig cluster,
        List<DenormalizationSpec> designs,
        List<QuerySpec> queries
) {}
