package com.studfee.harvester.crawl.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FactTableTest {

    @Test
    void keepsFirstAmountPerYear() {
        FactTable table = new FactTable();

        assertThat(table.mergeFirstWins(2015, 15000L)).isTrue();
        assertThat(table.mergeFirstWins(2015, 16000L)).isFalse();

        assertThat(table.toSortedFacts()).containsExactly(new FeeFact(2015, 15000L));
    }

    @Test
    void mergeAllCountsOnlyNewYearsAndSortsOutput() {
        FactTable table = new FactTable();
        Map<Integer, Long> first = new LinkedHashMap<>();
        first.put(2018, 40000L);
        first.put(2016, 25000L);
        Map<Integer, Long> second = new LinkedHashMap<>();
        second.put(2016, 1L);
        second.put(2017, 30000L);

        assertThat(table.mergeAll(first)).isEqualTo(2);
        assertThat(table.mergeAll(second)).isEqualTo(1);

        assertThat(table.size()).isEqualTo(3);
        assertThat(table.toSortedFacts()).containsExactly(
            new FeeFact(2016, 25000L),
            new FeeFact(2017, 30000L),
            new FeeFact(2018, 40000L)
        );
    }

    @Test
    void resolvedEntityRejectsMalformedIdsAndSlugs() {
        assertThatThrownBy(() -> new ResolvedEntity("12345", "test-horse")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResolvedEntity("12345a", "test-horse")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResolvedEntity("123456", "Test Horse")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResolvedEntity("123456", "")).isInstanceOf(IllegalArgumentException.class);
        assertThat(new ResolvedEntity("000123", "a-1").slug()).isEqualTo("a-1");
    }
}
