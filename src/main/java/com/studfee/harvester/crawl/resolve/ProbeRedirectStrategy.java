package com.studfee.harvester.crawl.resolve;

import com.studfee.harvester.crawl.http.PageFetcher;
import com.studfee.harvester.crawl.model.EntityQuery;
import com.studfee.harvester.crawl.model.HttpFetchResult;
import com.studfee.harvester.crawl.model.ResolvedEntity;
import com.studfee.harvester.crawl.util.StallionUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Requests the auctions page of the placeholder stallion id {@code 0} with a guessed slug.
 * The register answers with a redirect to the canonical page, whose address carries the real
 * id and the corrected slug.
 */
@Component
public class ProbeRedirectStrategy implements ResolutionStrategy {
    private static final Logger log = LoggerFactory.getLogger(ProbeRedirectStrategy.class);
    static final Pattern REDIRECT_TARGET = Pattern.compile("/stallions/([0-9]{6})/([a-z0-9-]+)(?=[/?#]|$)");

    private final PageFetcher fetcher;
    private final StallionUrls urls;

    public ProbeRedirectStrategy(PageFetcher fetcher, StallionUrls urls) {
        this.fetcher = fetcher;
        this.urls = urls;
    }

    @Override
    public ResolutionMethod method() {
        return ResolutionMethod.PROBE_REDIRECT;
    }

    @Override
    public Optional<ResolvedEntity> resolve(EntityQuery query) {
        for (String slug : SlugNormalizer.candidates(query.name())) {
            String probeUrl = urls.probe(slug);
            HttpFetchResult result = fetcher.probe(probeUrl);
            if (result == null || !result.isRedirect()) {
                log.debug(
                    "  probe {} not redirected (status={}, error={})",
                    probeUrl,
                    result == null ? 0 : result.statusCode(),
                    result == null ? null : result.errorCode()
                );
                continue;
            }
            Optional<ResolvedEntity> parsed = parseLocation(result.location());
            if (parsed.isPresent()) {
                return parsed;
            }
            log.debug("  probe {} redirected to unrecognised location {}", probeUrl, result.location());
        }
        return Optional.empty();
    }

    static Optional<ResolvedEntity> parseLocation(String location) {
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = REDIRECT_TARGET.matcher(location);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new ResolvedEntity(matcher.group(1), matcher.group(2)));
    }
}
