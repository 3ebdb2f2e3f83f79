package org.carball.docsim.planner;

import org.carball.docsim.model.design.EmbedSpec;
import org.carball.docsim.model.query.FilterPredicate;
import org.carball.docsim.model.query.ParsedQuery;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps fields as written in a query onto paths inside the collection an
 * operator actually reads. Fields of an embedded collection gain the embed
 * path as prefix; fields of the outer collection lose their collection prefix.
 */
final class FieldRewriter {

    private final String baseCollection;
    private final String embeddedCollection;
    private final String embedPath;
    private final String defaultOwner;
    private final Set<String> queryCollections;

    private FieldRewriter(String baseCollection, String embeddedCollection, String embedPath, ParsedQuery parsed) {
        this.baseCollection = baseCollection;
        this.embeddedCollection = embeddedCollection;
        this.embedPath = embedPath;
        this.defaultOwner = parsed.baseCollection();
        this.queryCollections = new HashSet<>(parsed.aliases().values());
    }

    static FieldRewriter direct(String collection, ParsedQuery parsed) {
        return new FieldRewriter(collection, null, null, parsed);
    }

    static FieldRewriter embedded(EmbedSpec embed, ParsedQuery parsed) {
        return new FieldRewriter(embed.target(), embed.source(), embed.path(), parsed);
    }

    /**
     * Fields qualified with their owning collection, the form join operators carry.
     */
    static List<String> qualify(List<String> fields, ParsedQuery parsed) {
        FieldRewriter owners = direct(parsed.baseCollection(), parsed);
        return fields.stream()
                .map(owners::owner)
                .map(owned -> owned.collection() + "." + owned.path())
                .collect(Collectors.toList());
    }

    String baseCollection() {
        return baseCollection;
    }

    List<String> rewriteFields(List<String> fields) {
        return fields.stream()
                .map(this::owner)
                .map(owned -> relocate(owned.collection(), owned.path()))
                .collect(Collectors.toList());
    }

    List<FilterPredicate> rewriteFilters(List<FilterPredicate> filters) {
        return filters.stream()
                .map(f -> f.retarget(baseCollection, relocate(f.collection(), f.field())))
                .collect(Collectors.toList());
    }

    private String relocate(String owner, String path) {
        if (owner.equals(embeddedCollection)) {
            return embedPath + "." + path;
        }
        return path;
    }

    private OwnedField owner(String field) {
        int dot = field.indexOf('.');
        if (dot > 0 && queryCollections.contains(field.substring(0, dot))) {
            return new OwnedField(field.substring(0, dot), field.substring(dot + 1));
        }
        return new OwnedField(defaultOwner, field);
    }

    private record OwnedField(String collection, String path) {}
}
