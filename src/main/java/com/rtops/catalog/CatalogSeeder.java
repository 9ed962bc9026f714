package com.rtops.catalog;

import com.rtops.domain.CatalogRecord;
import com.rtops.domain.Tactic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Seeds a handful of well-known techniques into an empty catalog so the
 * screens have something to show before the first import.
 * 
 * Seeding does not set the populated flag; only an import does.
 */
@Component
@Order(0)
public class CatalogSeeder implements ApplicationRunner {
    
    private static final Logger log = LoggerFactory.getLogger(CatalogSeeder.class);
    
    static final List<CatalogRecord> DEFAULT_RECORDS = List.of(
        CatalogRecord.builder()
            .techniqueId("T1059")
            .tactic(Tactic.EXECUTION)
            .name("Command and Scripting Interpreter")
            .description("Execute commands and scripts via shells/interpreters.")
            .references("https://attack.mitre.org/techniques/T1059/")
            .build(),
        CatalogRecord.builder()
            .techniqueId("T1021")
            .tactic(Tactic.LATERAL_MOVEMENT)
            .name("Remote Services")
            .description("RDP/SMB/SSH for lateral movement.")
            .references("https://attack.mitre.org/techniques/T1021/")
            .build(),
        CatalogRecord.builder()
            .techniqueId("T1003")
            .tactic(Tactic.CREDENTIAL_ACCESS)
            .name("OS Credential Dumping")
            .description("Dump creds from OS components.")
            .references("https://attack.mitre.org/techniques/T1003/")
            .build()
    );
    
    private final CatalogStore store;
    private final CatalogMerger merger;
    private final boolean enabled;
    
    public CatalogSeeder(
            CatalogStore store,
            CatalogMerger merger,
            @Value("${rtops.catalog.seed-defaults:true}") boolean enabled) {
        this.store = store;
        this.merger = merger;
        this.enabled = enabled;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        if (enabled) {
            seedIfEmpty();
        }
    }
    
    /**
     * Insert the default records when the catalog has no records at all
     * 
     * @return number of records inserted
     */
    public int seedIfEmpty() {
        if (store.count() > 0) {
            return 0;
        }
        MergeResult result = merger.merge(store, DEFAULT_RECORDS);
        log.info("Seeded empty catalog with {} default techniques", result.getInserted());
        return result.getInserted();
    }
}
