package com.studfee.harvester.crawl.http;

import java.util.concurrent.ThreadLocalRandom;

public class JitteredDelayStrategy implements DelayStrategy {

    @Override
    public boolean pause(long minMs, long maxMs) {
        long sleepMs = sample(minMs, maxMs);
        if (sleepMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static long sample(long minMs, long maxMs) {
        long low = Math.max(0, minMs);
        long high = Math.max(low, maxMs);
        if (high == low) {
            return low;
        }
        return ThreadLocalRandom.current().nextLong(low, high + 1);
    }
}
