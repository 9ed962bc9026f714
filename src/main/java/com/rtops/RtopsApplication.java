package com.rtops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the RTOps technique catalog.
 * 
 * RTOps tracks adversary-emulation engagements. This service owns the
 * ATT&amp;CK technique catalog those engagements draw from:
 * - Import of ATT&amp;CK bundles, technique lists and Excel exports
 * - Enrich-only merging into a persistent (technique, tactic) catalog
 * - Tactic-grouped catalog queries for the engagement screens
 */
@SpringBootApplication
public class RtopsApplication {

    /**
     * Main entry point for the RTOps catalog service.
     * 
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(RtopsApplication.class, args);
    }
}
