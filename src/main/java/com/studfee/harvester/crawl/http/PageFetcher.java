package com.studfee.harvester.crawl.http;

import com.studfee.harvester.crawl.model.HttpFetchResult;

import java.util.Optional;

public interface PageFetcher {

    /**
     * Fetches a page body, following redirects. Network and status failures are retried
     * internally; an empty result means the page could not be fetched.
     */
    Optional<String> fetch(String url);

    /**
     * Issues a single GET without following redirects so callers can inspect the
     * {@code Location} header.
     */
    HttpFetchResult probe(String url);
}
