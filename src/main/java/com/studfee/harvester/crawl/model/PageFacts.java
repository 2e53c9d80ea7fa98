package com.studfee.harvester.crawl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fee facts found on a single auction page. A later match for a year already seen on the
 * same page replaces the earlier amount.
 */
public final class PageFacts {
    private static final PageFacts EMPTY = new PageFacts(Map.of(), null);

    private final Map<Integer, Long> amountsByYear;
    private final FeeFact lastMatch;

    private PageFacts(Map<Integer, Long> amountsByYear, FeeFact lastMatch) {
        this.amountsByYear = amountsByYear;
        this.lastMatch = lastMatch;
    }

    public static PageFacts empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<Integer, Long> amountsByYear() {
        return amountsByYear;
    }

    public Optional<FeeFact> lastMatch() {
        return Optional.ofNullable(lastMatch);
    }

    public boolean isEmpty() {
        return amountsByYear.isEmpty();
    }

    @Override
    public String toString() {
        return "PageFacts" + amountsByYear;
    }

    public static final class Builder {
        private final Map<Integer, Long> amountsByYear = new LinkedHashMap<>();
        private FeeFact lastMatch;

        private Builder() {
        }

        public Builder add(int year, long amount) {
            amountsByYear.put(year, amount);
            lastMatch = new FeeFact(year, amount);
            return this;
        }

        public PageFacts build() {
            if (amountsByYear.isEmpty()) {
                return EMPTY;
            }
            return new PageFacts(Collections.unmodifiableMap(new LinkedHashMap<>(amountsByYear)), lastMatch);
        }
    }
}
