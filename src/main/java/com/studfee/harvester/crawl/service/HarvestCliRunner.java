package com.studfee.harvester.crawl.service;

import com.studfee.harvester.config.HarvesterProperties;
import com.studfee.harvester.crawl.io.CsvFactRowWriter;
import com.studfee.harvester.crawl.io.SireFileLoader;
import com.studfee.harvester.crawl.model.EntityQuery;
import com.studfee.harvester.crawl.model.HarvestRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

@Component
public class HarvestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HarvestCliRunner.class);

    private final HarvesterProperties properties;
    private final SireFileLoader loader;
    private final HarvestOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public HarvestCliRunner(
        HarvesterProperties properties,
        SireFileLoader loader,
        HarvestOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.loader = loader;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        Path input = Path.of(properties.getCli().getInput());
        Path output = Path.of(properties.getCli().getOutput());
        int exitCode = 0;
        try {
            List<EntityQuery> queries = loader.load(input);
            HarvestRunSummary summary = orchestratorService.run(queries, new CsvFactRowWriter(output));
            log.info(
                "Finished. {} of {} sires resolved, {} total rows written to {}",
                summary.entitiesResolved(),
                summary.entitiesRequested(),
                summary.rowsWritten(),
                output
            );
        } catch (InvalidInputSchemaException e) {
            log.error("Invalid input {}: {}", input, e.getMessage());
            exitCode = 2;
        } catch (HarvestInterruptedException e) {
            log.error("Harvest aborted, nothing written to {}: {}", output, e.getMessage());
            exitCode = 3;
        }

        if (properties.getCli().isExitAfterRun()) {
            int code = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> code));
        } else if (exitCode == 2) {
            throw new IllegalStateException("harvest aborted: invalid input " + input);
        } else if (exitCode != 0) {
            throw new IllegalStateException("harvest aborted: interrupted");
        }
    }
}
