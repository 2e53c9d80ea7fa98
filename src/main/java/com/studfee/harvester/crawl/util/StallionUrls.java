package com.studfee.harvester.crawl.util;

import com.studfee.harvester.config.HarvesterProperties;
import com.studfee.harvester.crawl.model.ResolvedEntity;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds stallion register addresses from the configured site base url.
 */
@Component
public class StallionUrls {
    private static final String PROBE_ID = "0";

    private final HarvesterProperties properties;

    public StallionUrls(HarvesterProperties properties) {
        this.properties = properties;
    }

    public String auctionsPage(ResolvedEntity entity, int pageYear) {
        return auctionsPage(entity.id(), entity.slug(), pageYear);
    }

    public String probe(String slug) {
        return auctionsPage(PROBE_ID, slug, properties.getSite().getProbeYear());
    }

    public String search(String query) {
        String encoded = URLEncoder.encode(query == null ? "" : query.trim(), StandardCharsets.UTF_8)
            .replace("+", "%20");
        return properties.getSite().getBaseUrl() + "/search?keyword=" + encoded;
    }

    private String auctionsPage(String id, String slug, int pageYear) {
        return properties.getSite().getBaseUrl() + "/stallions/" + id + "/" + slug + "/auctions/" + pageYear;
    }
}
