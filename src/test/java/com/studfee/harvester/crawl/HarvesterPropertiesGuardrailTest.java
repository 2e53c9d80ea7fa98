package com.studfee.harvester.crawl;

import com.studfee.harvester.config.HarvesterProperties;
import com.studfee.harvester.crawl.model.FactYearMapping;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HarvesterPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void attemptsAndDelaysAreClamped() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setRequestMaxAttempts(0);
        properties.setRetryDelayMinMs(-5);
        properties.setRetryDelayMaxMs(-10);
        properties.setPageDelayMinMs(300);
        properties.setPageDelayMaxMs(100);
        properties.setRequestTimeoutSeconds(0);

        assertEquals(1, properties.getRequestMaxAttempts());
        assertEquals(0, properties.getRetryDelayMinMs());
        assertEquals(0, properties.getRetryDelayMaxMs());
        assertEquals(300, properties.getPageDelayMaxMs());
        assertEquals(1, properties.getRequestTimeoutSeconds());

        properties.setRequestMaxAttempts(50);
        assertEquals(5, properties.getRequestMaxAttempts());
    }

    @Test
    void defaultsMatchTheAuctionCrawl() {
        HarvesterProperties properties = new HarvesterProperties();
        assertEquals(2006, properties.getCrawl().getFirstPageYear());
        assertEquals(2025, properties.getCrawl().getLastPageYear());
        assertEquals("Weanlings", properties.getCrawl().getSectionMarker());
        assertEquals(FactYearMapping.EMBEDDED_YEAR, properties.getCrawl().getFactYearMapping());
        assertEquals(3, properties.getRequestMaxAttempts());
    }

    @Test
    void baseUrlDropsTrailingSlash() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.getSite().setBaseUrl("http://localhost:8080/stallion-register/ ");
        assertEquals("http://localhost:8080/stallion-register", properties.getSite().getBaseUrl());
    }

    @Test
    void reversedPageYearRangeIsRejected() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.getCrawl().setFirstPageYear(2020);
        properties.getCrawl().setLastPageYear(2019);
        assertThatThrownBy(() -> properties.getCrawl().validateRange())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("first-page-year");
    }
}
