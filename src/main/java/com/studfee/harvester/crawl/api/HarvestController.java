package com.studfee.harvester.crawl.api;

import com.studfee.harvester.crawl.model.EntityQuery;
import com.studfee.harvester.crawl.model.HarvestRunSummary;
import com.studfee.harvester.crawl.model.ResolvedEntity;
import com.studfee.harvester.crawl.service.HarvestOrchestratorService;
import com.studfee.harvester.crawl.service.InvalidInputSchemaException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class HarvestController {
    private final HarvestOrchestratorService orchestratorService;

    public HarvestController(HarvestOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @GetMapping("/resolve")
    public ResolvedEntity resolve(@RequestParam("name") String name) {
        if (name == null || name.isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "name is required");
        }
        return orchestratorService.resolve(name)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "no stallion register record for " + name));
    }

    @PostMapping("/harvest")
    public HarvestRunSummary harvest(@RequestBody(required = false) HarvestRequest request) {
        if (request == null || request.sires() == null) {
            throw new InvalidInputSchemaException("request must contain a sires list");
        }
        List<EntityQuery> queries = new ArrayList<>();
        for (HarvestRequest.SireEntry entry : request.sires()) {
            queries.add(entry == null ? null : new EntityQuery(entry.name(), entry.contextYear()));
        }
        return orchestratorService.run(queries);
    }
}
