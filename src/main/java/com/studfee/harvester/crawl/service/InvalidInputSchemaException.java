package com.studfee.harvester.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidInputSchemaException extends RuntimeException {
    public InvalidInputSchemaException(String message) {
        super(message);
    }

    public InvalidInputSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
