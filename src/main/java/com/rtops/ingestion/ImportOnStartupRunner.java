package com.rtops.ingestion;

import com.rtops.catalog.CatalogStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs one import pass at startup, after the default seed.
 */
@Component
@Order(1)
@ConditionalOnProperty(name = "rtops.import.on-startup", havingValue = "true")
public class ImportOnStartupRunner implements ApplicationRunner {
    
    private static final Logger log = LoggerFactory.getLogger(ImportOnStartupRunner.class);
    
    private final ImportOrchestrator orchestrator;
    
    public ImportOnStartupRunner(ImportOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        try {
            ImportReport report = orchestrator.runImport();
            log.info("Startup import: {}", report.getSummary());
        } catch (CatalogStoreException e) {
            // Don't throw - the catalog screens still serve what was committed
            log.error("Startup import aborted by catalog write failure", e);
        }
    }
}
