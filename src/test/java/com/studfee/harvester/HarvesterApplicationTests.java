package com.studfee.harvester;

import com.studfee.harvester.crawl.resolve.EntityResolver;
import com.studfee.harvester.crawl.resolve.ResolutionMethod;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class HarvesterApplicationTests {

    @Autowired
    private EntityResolver resolver;

    @Test
    void wiresResolutionStrategiesInConfiguredOrder() {
        assertThat(resolver.methods()).containsExactly(ResolutionMethod.PROBE_REDIRECT, ResolutionMethod.SEARCH_QUERY);
    }
}
