package com.studfee.harvester.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when the harvesting thread is interrupted. The run is abandoned and nothing is written.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class HarvestInterruptedException extends RuntimeException {
    public HarvestInterruptedException(String message) {
        super(message);
    }
}
