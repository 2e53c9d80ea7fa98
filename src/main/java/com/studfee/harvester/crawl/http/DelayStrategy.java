package com.studfee.harvester.crawl.http;

public interface DelayStrategy {
    DelayStrategy NONE = (minMs, maxMs) -> true;

    /**
     * Pauses for a duration in {@code [minMs, maxMs]}.
     *
     * @return false if the pause was interrupted
     */
    boolean pause(long minMs, long maxMs);
}
