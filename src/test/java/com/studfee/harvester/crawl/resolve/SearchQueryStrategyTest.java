package com.studfee.harvester.crawl.resolve;

import com.studfee.harvester.config.HarvesterProperties;
import com.studfee.harvester.crawl.http.PageFetcher;
import com.studfee.harvester.crawl.model.EntityQuery;
import com.studfee.harvester.crawl.model.ResolvedEntity;
import com.studfee.harvester.crawl.util.StallionUrls;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchQueryStrategyTest {
    private static final String BASE = "https://register.test/stallion-register";

    @Mock
    private PageFetcher fetcher;

    private SearchQueryStrategy strategy;

    @BeforeEach
    void setUp() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.getSite().setBaseUrl(BASE);
        strategy = new SearchQueryStrategy(fetcher, new StallionUrls(properties));
    }

    @Test
    void takesFirstStallionLinkFromResults() throws IOException {
        when(fetcher.fetch(BASE + "/search?keyword=Yoshida%20%28JPN%29")).thenReturn(Optional.of(fixture("search-results.html")));

        Optional<ResolvedEntity> resolved = strategy.resolve(EntityQuery.of("Yoshida (JPN)"));

        assertThat(resolved).contains(new ResolvedEntity("261354", "yoshida-jpn"));
        verify(fetcher, times(1)).fetch(anyString());
    }

    @Test
    void retriesWithSlugVariantWhenExactNameHasNoHit() {
        when(fetcher.fetch(BASE + "/search?keyword=Yoshida%20%28JPN%29"))
            .thenReturn(Optional.of("<html><body><p>No results</p></body></html>"));
        when(fetcher.fetch(BASE + "/search?keyword=yoshida-jpn"))
            .thenReturn(Optional.of("<a href=\"/stallion-register/stallions/261354/yoshida-jpn/auctions/2020\">Yoshida</a>"));

        Optional<ResolvedEntity> resolved = strategy.resolve(EntityQuery.of("Yoshida (JPN)"));

        assertThat(resolved).contains(new ResolvedEntity("261354", "yoshida-jpn"));
        InOrder order = inOrder(fetcher);
        order.verify(fetcher).fetch(BASE + "/search?keyword=Yoshida%20%28JPN%29");
        order.verify(fetcher).fetch(BASE + "/search?keyword=yoshida-jpn");
    }

    @Test
    void failedSearchFetchMovesOnToNextQuery() {
        when(fetcher.fetch(BASE + "/search?keyword=Gio%20Ponti")).thenReturn(Optional.empty());
        when(fetcher.fetch(BASE + "/search?keyword=gio-ponti"))
            .thenReturn(Optional.of("<a href='/stallion-register/stallions/111222/gio-ponti'>Gio Ponti</a>"));

        assertThat(strategy.resolve(EntityQuery.of("Gio Ponti"))).contains(new ResolvedEntity("111222", "gio-ponti"));
    }

    @Test
    void notFoundWhenNoQueryMatches() {
        when(fetcher.fetch(anyString())).thenReturn(Optional.of("<a href='/stallion-register/news/123'>News</a>"));

        assertThat(strategy.resolve(EntityQuery.of("Nobody Famous"))).isEmpty();
        verify(fetcher, times(2)).fetch(anyString());
    }

    @Test
    void keywordsStartWithExactName() {
        assertThat(SearchQueryStrategy.searchKeywords(" Yoshida (JPN) "))
            .containsExactly("Yoshida (JPN)", "yoshida-jpn", "yoshida");
        assertThat(SearchQueryStrategy.searchKeywords("gio-ponti")).containsExactly("gio-ponti");
    }

    private String fixture(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
