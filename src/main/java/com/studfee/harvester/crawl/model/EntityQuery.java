package com.studfee.harvester.crawl.model;

public record EntityQuery(
    String name,
    Integer contextYear
) {
    public static EntityQuery of(String name) {
        return new EntityQuery(name, null);
    }
}
