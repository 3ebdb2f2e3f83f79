package org.carball.docsim.model.design;

import org.carball.docsim.model.schema.CollectionConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One candidate physical design: which collections exist, how each is sharded
 * and indexed, and which collections are embedded into which.
 */
public record DenormalizationSpec(
        String id,
        String description,
        Map<String, CollectionConfig> collections,
        List<EmbedSpec> embeds
) {

    public DenormalizationSpec {
        collections = Collections.unmodifiableMap(new LinkedHashMap<>(collections));
        embeds = List.copyOf(embeds);
    }
}
