package com.studfee.harvester.crawl.model;

import java.time.Duration;

public record HttpFetchResult(
    int statusCode,
    String body,
    String location,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isRedirect() {
        return statusCode >= 300 && statusCode < 400 && errorCode == null;
    }
}
