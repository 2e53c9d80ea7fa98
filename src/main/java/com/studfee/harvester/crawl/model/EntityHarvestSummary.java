package com.studfee.harvester.crawl.model;

public record EntityHarvestSummary(
    String name,
    String stallionId,
    String slug,
    int feeYearsCount
) {
    public boolean resolved() {
        return stallionId != null;
    }
}
