package com.studfee.harvester.crawl.api;

import java.util.List;

public record HarvestRequest(
    List<SireEntry> sires
) {
    public record SireEntry(
        String name,
        Integer contextYear
    ) {
    }
}
