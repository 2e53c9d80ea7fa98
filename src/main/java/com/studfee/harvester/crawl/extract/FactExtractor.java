package com.studfee.harvester.crawl.extract;

import com.studfee.harvester.crawl.model.PageFacts;

public interface FactExtractor {

    /**
     * Extracts fee facts from one fetched page. Pages without applicable data yield
     * {@link PageFacts#empty()}; this never fails on malformed markup.
     */
    PageFacts extract(String body);
}
