package com.studfee.harvester.crawl.model;

import java.util.List;

public record HarvestRunSummary(
    int entitiesRequested,
    int entitiesResolved,
    int entitiesNotFound,
    int rowsWritten,
    List<EntityHarvestSummary> entities,
    List<FactRow> rows
) {
}
