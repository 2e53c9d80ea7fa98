package com.studfee.harvester.crawl.model;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fee facts for one stallion. The first amount recorded for a year is kept; later
 * assertions for the same year are ignored.
 */
public class FactTable {
    private final Map<Integer, Long> amountsByYear = new TreeMap<>();

    /**
     * @return true if the fact was recorded, false if the year was already present
     */
    public boolean mergeFirstWins(int year, long amount) {
        return amountsByYear.putIfAbsent(year, amount) == null;
    }

    public int mergeAll(Map<Integer, Long> facts) {
        int added = 0;
        for (Map.Entry<Integer, Long> entry : facts.entrySet()) {
            if (mergeFirstWins(entry.getKey(), entry.getValue())) {
                added++;
            }
        }
        return added;
    }

    public int size() {
        return amountsByYear.size();
    }

    public List<FeeFact> toSortedFacts() {
        return amountsByYear.entrySet().stream()
            .map(entry -> new FeeFact(entry.getKey(), entry.getValue()))
            .toList();
    }
}
