package org.carball.docsim.loader;

import org.carball.docsim.model.schema.ClusterConfig;
import org.carball.docsim.model.schema.CollectionStats;

import java.util.Map;

public record StatsDocument(
        ClusterConfig cluster,
        Map<String, CollectionStats> collections,
        Map<String, Double> queryFrequencies
) {}
