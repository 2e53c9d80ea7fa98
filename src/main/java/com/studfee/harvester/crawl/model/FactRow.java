package com.studfee.harvester.crawl.model;

public record FactRow(
    String name,
    int factYear,
    long amount
) {
}
