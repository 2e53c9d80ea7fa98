package com.studfee.harvester.crawl.resolve;

import com.studfee.harvester.crawl.model.EntityQuery;
import com.studfee.harvester.crawl.model.ResolvedEntity;

import java.util.Optional;

public interface ResolutionStrategy {

    ResolutionMethod method();

    Optional<ResolvedEntity> resolve(EntityQuery query);
}
