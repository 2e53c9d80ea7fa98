package com.studfee.harvester.crawl.resolve;

import com.studfee.harvester.config.HarvesterProperties;
import com.studfee.harvester.crawl.model.EntityQuery;
import com.studfee.harvester.crawl.model.ResolvedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tries the configured resolution strategies in order and returns the first match.
 */
@Service
public class EntityResolver {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    private final List<ResolutionStrategy> strategies;

    public EntityResolver(HarvesterProperties properties, List<ResolutionStrategy> available) {
        this.strategies = orderStrategies(properties.getResolution().getStrategies(), available);
    }

    public Optional<ResolvedEntity> resolve(EntityQuery query) {
        if (query == null || query.name() == null || query.name().isBlank()) {
            return Optional.empty();
        }
        for (ResolutionStrategy strategy : strategies) {
            Optional<ResolvedEntity> resolved = strategy.resolve(query);
            if (resolved.isPresent()) {
                log.debug("  {} resolved by {}", query.name(), strategy.method());
                return resolved;
            }
        }
        return Optional.empty();
    }

    public List<ResolutionMethod> methods() {
        return strategies.stream().map(ResolutionStrategy::method).toList();
    }

    private static List<ResolutionStrategy> orderStrategies(
        List<ResolutionMethod> order,
        List<ResolutionStrategy> available
    ) {
        Map<ResolutionMethod, ResolutionStrategy> byMethod = new EnumMap<>(ResolutionMethod.class);
        for (ResolutionStrategy strategy : available) {
            byMethod.put(strategy.method(), strategy);
        }
        List<ResolutionStrategy> ordered = new ArrayList<>();
        for (ResolutionMethod method : order) {
            ResolutionStrategy strategy = byMethod.get(method);
            if (strategy == null) {
                throw new IllegalStateException("No resolution strategy registered for " + method);
            }
            if (!ordered.contains(strategy)) {
                ordered.add(strategy);
            }
        }
        if (ordered.isEmpty()) {
            throw new IllegalStateException("harvester.resolution.strategies must name at least one strategy");
        }
        return List.copyOf(ordered);
    }
}
