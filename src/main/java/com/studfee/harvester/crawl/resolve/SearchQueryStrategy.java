package com.studfee.harvester.crawl.resolve;

import com.studfee.harvester.crawl.http.PageFetcher;
import com.studfee.harvester.crawl.model.EntityQuery;
import com.studfee.harvester.crawl.model.ResolvedEntity;
import com.studfee.harvester.crawl.util.StallionUrls;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Looks the sire up through the register search page, first with the name as given and then
 * with its slug forms, and takes the first stallion link in the results.
 */
@Component
public class SearchQueryStrategy implements ResolutionStrategy {
    private static final Logger log = LoggerFactory.getLogger(SearchQueryStrategy.class);
    static final Pattern STALLION_HREF = Pattern.compile(
        "/stallion-register/stallions/([0-9]{6})/([a-z0-9-]+)(?=[/?#\"]|$)"
    );

    private final PageFetcher fetcher;
    private final StallionUrls urls;

    public SearchQueryStrategy(PageFetcher fetcher, StallionUrls urls) {
        this.fetcher = fetcher;
        this.urls = urls;
    }

    @Override
    public ResolutionMethod method() {
        return ResolutionMethod.SEARCH_QUERY;
    }

    @Override
    public Optional<ResolvedEntity> resolve(EntityQuery query) {
        for (String keyword : searchKeywords(query.name())) {
            String searchUrl = urls.search(keyword);
            log.debug("  search query = {}", keyword);
            Optional<String> html = fetcher.fetch(searchUrl);
            if (html.isEmpty()) {
                continue;
            }
            Optional<ResolvedEntity> match = firstStallionLink(html.get(), searchUrl);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    static List<String> searchKeywords(String name) {
        Set<String> keywords = new LinkedHashSet<>();
        if (name != null && !name.isBlank()) {
            keywords.add(name.trim());
            keywords.addAll(SlugNormalizer.candidates(name));
        }
        return new ArrayList<>(keywords);
    }

    static Optional<ResolvedEntity> firstStallionLink(String html, String baseUri) {
        Document document = Jsoup.parse(html, baseUri);
        for (Element anchor : document.select("a[href]")) {
            Matcher matcher = STALLION_HREF.matcher(anchor.attr("href"));
            if (matcher.find()) {
                return Optional.of(new ResolvedEntity(matcher.group(1), matcher.group(2)));
            }
        }
        return Optional.empty();
    }
}
