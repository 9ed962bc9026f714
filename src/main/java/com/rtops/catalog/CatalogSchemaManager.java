package com.rtops.catalog;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the catalog tables on startup if they do not exist.
 */
@Component
@ConditionalOnProperty(name = "rtops.catalog.store", havingValue = "jdbc", matchIfMissing = true)
public class CatalogSchemaManager {
    private static final Logger logger = LoggerFactory.getLogger(CatalogSchemaManager.class);
    
    private final JdbcTemplate jdbcTemplate;
    
    public CatalogSchemaManager(@Qualifier("catalogJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }
    
    @PostConstruct
    public void createTables() {
        try {
            createRecordsTable();
            createSettingsTable();
            logger.info("Catalog schema initialized successfully");
        } catch (Exception e) {
            logger.error("Failed to initialize catalog schema", e);
            throw new CatalogStoreException("Catalog schema initialization failed", e);
        }
    }
    
    /**
     * One row per (technique, tactic); the unique key backs insert-if-absent
     */
    private void createRecordsTable() {
        String sql = """
            CREATE TABLE IF NOT EXISTS catalog_records (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                technique_id VARCHAR(16) NOT NULL,
                tactic_id VARCHAR(32) NOT NULL,
                name CLOB DEFAULT '' NOT NULL,
                description CLOB,
                refs CLOB,
                created_at TIMESTAMP NOT NULL,
                CONSTRAINT uq_catalog_technique_tactic UNIQUE (technique_id, tactic_id)
            )
            """;
        
        jdbcTemplate.execute(sql);
        logger.debug("Created table: catalog_records");
    }
    
    private void createSettingsTable() {
        String sql = """
            CREATE TABLE IF NOT EXISTS catalog_settings (
                setting_key VARCHAR(64) PRIMARY KEY,
                setting_value VARCHAR(256)
            )
            """;
        
        jdbcTemplate.execute(sql);
        logger.debug("Created table: catalog_settings");
    }
}
