package com.studfee.harvester.crawl.service;

import com.studfee.harvester.config.HarvesterProperties;
import com.studfee.harvester.crawl.extract.FactExtractor;
import com.studfee.harvester.crawl.http.DelayStrategy;
import com.studfee.harvester.crawl.http.PageFetcher;
import com.studfee.harvester.crawl.model.FactTable;
import com.studfee.harvester.crawl.model.FactYearMapping;
import com.studfee.harvester.crawl.model.FeeFact;
import com.studfee.harvester.crawl.model.PageFacts;
import com.studfee.harvester.crawl.model.ResolvedEntity;
import com.studfee.harvester.crawl.util.StallionUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks a stallion's auction pages in ascending page-year order and keeps the first fee seen
 * for every fee year. Iteration order matters: an earlier page's assertion wins over any later
 * correction.
 */
@Service
public class FactAggregator {
    private static final Logger log = LoggerFactory.getLogger(FactAggregator.class);

    private final HarvesterProperties properties;
    private final PageFetcher fetcher;
    private final FactExtractor extractor;
    private final DelayStrategy delayStrategy;
    private final StallionUrls urls;

    public FactAggregator(
        HarvesterProperties properties,
        PageFetcher fetcher,
        FactExtractor extractor,
        DelayStrategy delayStrategy,
        StallionUrls urls
    ) {
        properties.getCrawl().validateRange();
        this.properties = properties;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.delayStrategy = delayStrategy;
        this.urls = urls;
    }

    /**
     * @throws HarvestInterruptedException if a page pause is interrupted or the thread is
     *                                     interrupted while fetching; the partial table is discarded
     */
    public List<FeeFact> harvest(ResolvedEntity entity) {
        HarvesterProperties.Crawl crawl = properties.getCrawl();
        FactYearMapping mapping = crawl.getFactYearMapping();
        FactTable table = new FactTable();
        boolean firstRequest = true;

        for (int pageYear = crawl.getFirstPageYear(); pageYear <= crawl.getLastPageYear(); pageYear++) {
            if (!firstRequest && !delayStrategy.pause(properties.getPageDelayMinMs(), properties.getPageDelayMaxMs())) {
                throw new HarvestInterruptedException(
                    "harvest of " + entity.slug() + " interrupted before page " + pageYear
                );
            }
            firstRequest = false;

            Optional<String> body = fetcher.fetch(urls.auctionsPage(entity, pageYear));
            if (body.isEmpty()) {
                log.debug("    {}: page unavailable", pageYear);
                continue;
            }
            PageFacts pageFacts = extractor.extract(body.get());
            if (pageFacts.isEmpty()) {
                continue;
            }
            Map<Integer, Long> facts = mapping.apply(pageYear, pageFacts);
            int added = table.mergeAll(facts);
            log.debug("    {}: {} fee facts, {} new", pageYear, facts.size(), added);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new HarvestInterruptedException("harvest of " + entity.slug() + " interrupted");
        }
        log.debug("  {}: {} fee years kept", entity.slug(), table.size());
        return table.toSortedFacts();
    }
}
