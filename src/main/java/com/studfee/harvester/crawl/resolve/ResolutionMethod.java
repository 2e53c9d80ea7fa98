package com.studfee.harvester.crawl.resolve;

public enum ResolutionMethod {
    PROBE_REDIRECT,
    SEARCH_QUERY
}
