package com.studfee.harvester.crawl.api;

import com.studfee.harvester.crawl.service.HarvestInterruptedException;
import com.studfee.harvester.crawl.service.InvalidInputSchemaException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class HarvestExceptionHandler {

    @ExceptionHandler(InvalidInputSchemaException.class)
    public ResponseEntity<Map<String, String>> handleInvalidInput(InvalidInputSchemaException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "invalid_input_schema", "message", ex.getMessage()));
    }

    @ExceptionHandler(HarvestInterruptedException.class)
    public ResponseEntity<Map<String, String>> handleInterrupted(HarvestInterruptedException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("error", "harvest_interrupted", "message", ex.getMessage()));
    }
}
