package com.studfee.harvester.crawl.model;

public record FeeFact(
    int year,
    long amount
) {
}
