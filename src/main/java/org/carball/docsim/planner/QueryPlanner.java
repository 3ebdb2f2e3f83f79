package org.carball.docsim.planner;

import lombok.extern.slf4j.Slf4j;
import org.carball.docsim.model.design.DesignModels;
import org.carball.docsim.model.design.EmbedKey;
import org.carball.docsim.model.design.EmbedSpec;
import org.carball.docsim.model.plan.AggregateOperator;
import org.carball.docsim.model.plan.FilterOperator;
import org.carball.docsim.model.plan.JoinOperator;
import org.carball.docsim.model.plan.PlanOperator;
import org.carball.docsim.model.plan.QueryPlan;
import org.carball.docsim.model.plan.ScanStrategy;
import org.carball.docsim.model.query.FilterPredicate;
import org.carball.docsim.model.query.JoinPredicate;
import org.carball.docsim.model.query.ParsedQuery;
import org.carball.docsim.model.query.QuerySpec;
import org.carball.docsim.model.schema.CollectionConfig;
import org.carball.docsim.model.schema.CollectionModel;
import org.carball.docsim.parser.QueryParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeSet;

/**
 * Turns a query into a physical plan for one design. Embedding is taken into
 * account: a query on an embedded collection is redirected to the collection
 * that holds it, and a join across an embedding edge collapses into a single
 * filter on the outer collection.
 */
@Slf4j
public class QueryPlanner {

    public QueryPlan plan(QuerySpec query, DesignModels design) {
        return plan(query, design.collections(), design.embeds());
    }

    public QueryPlan plan(QuerySpec query,
                          Map<String, CollectionModel> collections,
                          Map<EmbedKey, EmbedSpec> embeds) {
        ParsedQuery parsed = QueryParser.parse(query.sql());

        QueryPlan plan = parsed.hasJoin()
                ? planJoin(query, parsed, collections, embeds)
                : planSingleCollection(query, parsed, collections, embeds);

        log.debug("Planned {}: {} on {}", query.id(), plan.summary(), plan.involvedCollections());
        return plan;
    }

    /**
     * Scan strategy for a filter on {@code field}: sharding key, then index, then full scan.
     */
    public static ScanStrategy chooseScanStrategy(String field, CollectionConfig config) {
        if (field != null && field.equals(config.shardingKey())) {
            return ScanStrategy.SHARD;
        }
        if (field != null && config.isIndexed(field)) {
            return ScanStrategy.INDEX;
        }
        return ScanStrategy.FULL;
    }

    private QueryPlan planSingleCollection(QuerySpec query,
                                           ParsedQuery parsed,
                                           Map<String, CollectionModel> collections,
                                           Map<EmbedKey, EmbedSpec> embeds) {
        String source = parsed.baseCollection();
        FieldRewriter rewriter;

        if (collections.containsKey(source)) {
            rewriter = FieldRewriter.direct(source, parsed);
        } else {
            EmbedSpec embed = findHostingEmbed(source, collections, embeds)
                    .orElseThrow(() -> new UnknownCollectionException(source, "query " + query.id()));
            log.debug("Query {} reads {} through its embedding in {} at '{}'",
                    query.id(), source, embed.target(), embed.path());
            rewriter = FieldRewriter.embedded(embed, parsed);
        }

        String target = rewriter.baseCollection();
        CollectionModel model = collections.get(target);
        List<FilterPredicate> filters = rewriter.rewriteFilters(parsed.filters());
        List<String> outputFields = rewriter.rewriteFields(parsed.selectFields());

        PlanOperator operator;
        if (parsed.hasGroupBy()) {
            List<String> groupingKeys = rewriter.rewriteFields(parsed.groupBy());
            operator = new AggregateOperator(
                    query.id() + "_aggregate",
                    target,
                    filters,
                    groupingKeys,
                    outputFields,
                    groupingKeys.contains(model.shardingKey())
            );
        } else {
            operator = buildFilter(query.id() + "_filter", model, filters, outputFields);
        }

        return new QueryPlan(query, List.of(operator), List.of(target));
    }

    private QueryPlan planJoin(QuerySpec query,
                               ParsedQuery parsed,
                               Map<String, CollectionModel> collections,
                               Map<EmbedKey, EmbedSpec> embeds) {
        JoinPredicate join = parsed.join();
        String left = join.leftCollection();
        String right = join.rightCollection();

        Optional<EmbedSpec> leftInRight = activeEmbed(left, right, collections, embeds);
        Optional<EmbedSpec> rightInLeft = activeEmbed(right, left, collections, embeds);

        if (leftInRight.isPresent() || rightInLeft.isPresent()) {
            EmbedSpec embed = leftInRight.orElseGet(rightInLeft::get);
            return planEmbeddedJoin(query, parsed, collections, embed);
        }

        CollectionModel leftModel = requireCollection(collections, left, query);
        CollectionModel rightModel = requireCollection(collections, right, query);

        List<PlanOperator> operators = new ArrayList<>();
        OptionalInt leftInput = addSideFilter(query, parsed, leftModel, operators);
        OptionalInt rightInput = addSideFilter(query, parsed, rightModel, operators);

        boolean aligned = join.leftField().equals(leftModel.shardingKey())
                && join.rightField().equals(rightModel.shardingKey());

        List<String> outputFields = FieldRewriter.qualify(parsed.selectFields(), parsed);
        operators.add(new JoinOperator(query.id() + "_join", join, outputFields, aligned, leftInput, rightInput));

        List<String> involved = new ArrayList<>(new TreeSet<>(List.of(left, right)));
        return new QueryPlan(query, operators, involved);
    }

    private QueryPlan planEmbeddedJoin(QuerySpec query,
                                       ParsedQuery parsed,
                                       Map<String, CollectionModel> collections,
                                       EmbedSpec embed) {
        CollectionModel base = requireCollection(collections, embed.target(), query);
        log.debug("Join in {} eliminated: {} is embedded in {} at '{}'",
                query.id(), embed.source(), embed.target(), embed.path());

        FieldRewriter rewriter = FieldRewriter.embedded(embed, parsed);
        List<FilterPredicate> filters = rewriter.rewriteFilters(parsed.filters());
        List<String> outputFields = rewriter.rewriteFields(parsed.selectFields());

        FilterOperator filter = buildFilter(query.id() + "_filter", base, filters, outputFields);
        return new QueryPlan(query, List.of(filter), List.of(base.name()));
    }

    private OptionalInt addSideFilter(QuerySpec query,
                                      ParsedQuery parsed,
                                      CollectionModel side,
                                      List<PlanOperator> operators) {
        List<FilterPredicate> sideFilters = parsed.filtersOn(side.name());
        if (sideFilters.isEmpty()) {
            return OptionalInt.empty();
        }
        operators.add(buildFilter(query.id() + "_filter_" + side.name(), side, sideFilters, List.of()));
        return OptionalInt.of(operators.size() - 1);
    }

    private FilterOperator buildFilter(String name,
                                       CollectionModel collection,
                                       List<FilterPredicate> filters,
                                       List<String> outputFields) {
        String filterField = filters.isEmpty() ? null : filters.get(0).field();
        ScanStrategy strategy = chooseScanStrategy(filterField, collection.config());
        List<String> indexesUsed = strategy == ScanStrategy.INDEX ? List.of(filterField) : List.of();
        return new FilterOperator(name, collection.name(), filters, outputFields, strategy, indexesUsed);
    }

    /**
     * The embedding of {@code source} into a collection materialized in this design.
     */
    private Optional<EmbedSpec> findHostingEmbed(String source,
                                                 Map<String, CollectionModel> collections,
                                                 Map<EmbedKey, EmbedSpec> embeds) {
        return embeds.values().stream()
                .filter(e -> e.source().equals(source) && collections.containsKey(e.target()))
                .findFirst();
    }

    private Optional<EmbedSpec> activeEmbed(String source,
                                            String target,
                                            Map<String, CollectionModel> collections,
                                            Map<EmbedKey, EmbedSpec> embeds) {
        EmbedSpec embed = embeds.get(new EmbedKey(source, target));
        if (embed == null || !collections.containsKey(embed.target())) {
            return Optional.empty();
        }
        return Optional.of(embed);
    }

    private static CollectionModel requireCollection(Map<String, CollectionModel> collections,
                                                     String name,
                                                     QuerySpec query) {
        CollectionModel model = collections.get(name);
        if (model == null) {
            throw new UnknownCollectionException(name, "query " + query.id());
        }
        return model;
    }
}
