package com.studfee.harvester.crawl.service;

import com.studfee.harvester.crawl.io.FactRowWriter;
import com.studfee.harvester.crawl.model.EntityHarvestSummary;
import com.studfee.harvester.crawl.model.EntityQuery;
import com.studfee.harvester.crawl.model.FactRow;
import com.studfee.harvester.crawl.model.FeeFact;
import com.studfee.harvester.crawl.model.HarvestRunSummary;
import com.studfee.harvester.crawl.model.ResolvedEntity;
import com.studfee.harvester.crawl.resolve.EntityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the resolve and harvest pipeline over a list of sires, one sire at a time.
 */
@Service
public class HarvestOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(HarvestOrchestratorService.class);

    private final EntityResolver resolver;
    private final FactAggregator aggregator;
    private final Object runLock = new Object();

    public HarvestOrchestratorService(EntityResolver resolver, FactAggregator aggregator) {
        this.resolver = resolver;
        this.aggregator = aggregator;
    }

    public HarvestRunSummary run(List<EntityQuery> queries) {
        return run(queries, null);
    }

    /**
     * Harvests every query and hands the rows to {@code writer} once all sires are done.
     * Queries are validated up front so a malformed input produces no output at all. An
     * interrupted run stops at once and writes nothing.
     *
     * @throws InvalidInputSchemaException if a query has no sire name
     * @throws HarvestInterruptedException if the thread is interrupted during the run
     */
    public HarvestRunSummary run(List<EntityQuery> queries, FactRowWriter writer) {
        validate(queries);
        synchronized (runLock) {
            List<FactRow> rows = new ArrayList<>();
            List<EntityHarvestSummary> entities = new ArrayList<>();
            int resolvedCount = 0;
            int notFoundCount = 0;

            for (EntityQuery query : queries) {
                if (Thread.currentThread().isInterrupted()) {
                    throw interrupted(entities.size(), queries.size(), null);
                }
                log.info("Processing {} ({})", query.name(), query.contextYear());
                Optional<ResolvedEntity> resolved = resolver.resolve(query);
                if (resolved.isEmpty()) {
                    log.warn("  No stallion register record found for {}", query.name());
                    notFoundCount++;
                    entities.add(new EntityHarvestSummary(query.name(), null, null, 0));
                    continue;
                }
                resolvedCount++;
                ResolvedEntity entity = resolved.get();
                log.info("  id {} slug {}", entity.id(), entity.slug());

                List<FeeFact> facts;
                try {
                    facts = aggregator.harvest(entity);
                } catch (HarvestInterruptedException e) {
                    throw interrupted(entities.size(), queries.size(), e);
                }
                if (facts.isEmpty()) {
                    log.warn("  No stud fees found for {}", query.name());
                } else {
                    log.info("  {} fee years captured", facts.size());
                }
                for (FeeFact fact : facts) {
                    rows.add(new FactRow(query.name(), fact.year(), fact.amount()));
                }
                entities.add(new EntityHarvestSummary(query.name(), entity.id(), entity.slug(), facts.size()));
            }

            if (Thread.currentThread().isInterrupted()) {
                throw interrupted(entities.size(), queries.size(), null);
            }
            if (writer != null) {
                writer.write(rows);
            }
            log.info(
                "Harvest finished. requested={} resolved={} not_found={} rows={}",
                queries.size(),
                resolvedCount,
                notFoundCount,
                rows.size()
            );
            return new HarvestRunSummary(
                queries.size(),
                resolvedCount,
                notFoundCount,
                rows.size(),
                List.copyOf(entities),
                List.copyOf(rows)
            );
        }
    }

    private HarvestInterruptedException interrupted(int done, int total, HarvestInterruptedException cause) {
        log.warn("Harvest interrupted after {} of {} sires, no rows written", done, total);
        return cause != null ? cause : new HarvestInterruptedException(
            "harvest interrupted after " + done + " of " + total + " sires"
        );
    }

    public Optional<ResolvedEntity> resolve(String name) {
        return resolver.resolve(EntityQuery.of(name));
    }

    static void validate(List<EntityQuery> queries) {
        if (queries == null) {
            throw new InvalidInputSchemaException("sire list is required");
        }
        for (int i = 0; i < queries.size(); i++) {
            EntityQuery query = queries.get(i);
            if (query == null || query.name() == null || query.name().isBlank()) {
                throw new InvalidInputSchemaException("entry " + i + " is missing the sire name");
            }
        }
    }
}
