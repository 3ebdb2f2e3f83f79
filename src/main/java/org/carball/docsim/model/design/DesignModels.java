package org.carball.docsim.model.design;

import org.carball.docsim.model.schema.CollectionModel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the planner and simulator need about one design: the
 * materialized collections and the embeddings that are active in it.
 */
public record DesignModels(
        DenormalizationSpec design,
        Map<String, CollectionModel> collections,
        Map<EmbedKey, EmbedSpec> embeds
) {

    public DesignModels {
        collections = Collections.unmodifiableMap(new LinkedHashMap<>(collections));
        embeds = Collections.unmodifiableMap(new LinkedHashMap<>(embeds));
    }

    public String id() {
        return design.id();
    }
}
