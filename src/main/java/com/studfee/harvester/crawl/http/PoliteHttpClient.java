package com.studfee.harvester.crawl.http;

import com.studfee.harvester.config.HarvesterProperties;
import com.studfee.harvester.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Service
public class PoliteHttpClient implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final HarvesterProperties properties;
    private final DelayStrategy delayStrategy;
    private final HttpClient client;
    private final HttpClient probeClient;

    public PoliteHttpClient(HarvesterProperties properties, DelayStrategy delayStrategy) {
        this.properties = properties;
        this.delayStrategy = delayStrategy;
        Duration connectTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(connectTimeout)
            .version(HttpClient.Version.HTTP_1_1)
            .build();
        this.probeClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(connectTimeout)
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public Optional<String> fetch(String url) {
        HttpFetchResult result = send(client, url, true);
        if (result != null && result.isSuccessful()) {
            return Optional.ofNullable(result.body());
        }
        log.warn(
            "Failed to fetch {} after {} attempts (status={}, error={}: {})",
            url,
            properties.getRequestMaxAttempts(),
            result == null ? 0 : result.statusCode(),
            result == null ? null : result.errorCode(),
            result == null ? null : result.errorMessage()
        );
        return Optional.empty();
    }

    @Override
    public HttpFetchResult probe(String url) {
        return send(probeClient, url, false);
    }

    private HttpFetchResult send(HttpClient httpClient, String url, boolean retryOnAnyStatus) {
        int maxAttempts = properties.getRequestMaxAttempts();
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(httpClient, url);
            if (!shouldRetry(lastResult, retryOnAnyStatus) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug(
                "  attempt {} for {} failed after {} ms (status={}, error={}), retrying",
                attempt,
                url,
                lastResult.duration().toMillis(),
                lastResult.statusCode(),
                lastResult.errorCode()
            );
            if (!delayStrategy.pause(properties.getRetryDelayMinMs(), properties.getRetryDelayMaxMs())) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(HttpClient httpClient, String url) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(startedAt, "invalid_url", "URL missing host or malformed");
        }
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", HTML_ACCEPT)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();
            log.debug("GET {}", uri);
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return new HttpFetchResult(
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Location").orElse(null),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(startedAt, "invalid_url", e.getMessage());
        } catch (Exception e) {
            return errorResult(startedAt, "http_error", e.getMessage());
        }
    }

    private boolean shouldRetry(HttpFetchResult result, boolean retryOnAnyStatus) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        int status = result.statusCode();
        if (retryOnAnyStatus) {
            return status < 200 || status >= 300;
        }
        return status == 408 || status == 429 || status >= 500;
    }

    private HttpFetchResult errorResult(Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            0,
            null,
            null,
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
