package com.studfee.harvester.crawl.model;

import java.util.Map;

/**
 * How facts found on an auction page are keyed by fee year.
 */
public enum FactYearMapping {
    /**
     * The year printed next to the fee is the fee year.
     */
    EMBEDDED_YEAR {
        @Override
        public Map<Integer, Long> apply(int pageYear, PageFacts facts) {
            return facts.amountsByYear();
        }
    },
    /**
     * Weanlings sold in a page year were conceived under the previous year's fee, so the page
     * contributes a single fact for {@code pageYear - 1} taken from its last fee match.
     */
    PRIOR_PAGE_YEAR {
        @Override
        public Map<Integer, Long> apply(int pageYear, PageFacts facts) {
            return facts.lastMatch()
                .map(fact -> Map.of(pageYear - 1, fact.amount()))
                .orElse(Map.of());
        }
    };

    public abstract Map<Integer, Long> apply(int pageYear, PageFacts facts);
}
