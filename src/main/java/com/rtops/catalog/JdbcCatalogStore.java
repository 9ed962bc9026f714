package com.rtops.catalog;

import com.rtops.domain.CatalogRecord;
import com.rtops.domain.Tactic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Catalog store backed by the catalog_records and catalog_settings tables.
 * 
 * Inserts rely on the (technique_id, tactic_id) unique key: a duplicate insert
 * is reported as "not inserted" rather than as an error, which keeps replays of
 * an interrupted import harmless.
 */
@Repository
@ConditionalOnProperty(name = "rtops.catalog.store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcCatalogStore implements CatalogStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcCatalogStore.class);
    
    static final String POPULATED_KEY = "catalog_loaded";
    
    private static final String SELECT_COLUMNS =
        "SELECT technique_id, tactic_id, name, description, refs, created_at FROM catalog_records";
    
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    
    public JdbcCatalogStore(
            @Qualifier("catalogJdbcTemplate") JdbcTemplate jdbcTemplate,
            @Qualifier("catalogTransactionTemplate") TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }
    
    @Override
    public Optional<CatalogRecord> find(String techniqueId, Tactic tactic) {
        try {
            List<CatalogRecord> found = jdbcTemplate.query(
                SELECT_COLUMNS + " WHERE technique_id = ? AND tactic_id = ?",
                new CatalogRecordRowMapper(), techniqueId, tactic.getId());
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (DataAccessException e) {
            throw new CatalogStoreException("Failed to read catalog record " + techniqueId + "/" + tactic, e);
        }
    }
    
    @Override
    public boolean insertIfAbsent(CatalogRecord record) {
        String sql = """
            INSERT INTO catalog_records (technique_id, tactic_id, name, description, refs, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        Instant createdAt = record.getCreatedAt() != null ? record.getCreatedAt() : Instant.now();
        try {
            int rows = jdbcTemplate.update(sql,
                record.getTechniqueId(),
                record.getTactic().getId(),
                record.getName(),
                record.getDescription(),
                record.getReferences(),
                Timestamp.from(createdAt));
            return rows > 0;
        } catch (DuplicateKeyException e) {
            logger.debug("Record already present: {}/{}", record.getTechniqueId(), record.getTactic());
            return false;
        } catch (DataAccessException e) {
            throw new CatalogStoreException("Failed to insert catalog record " + record, e);
        }
    }
    
    @Override
    public boolean update(CatalogRecord record) {
        String sql = """
            UPDATE catalog_records
            SET name = ?, description = ?, refs = ?
            WHERE technique_id = ? AND tactic_id = ?
            """;
        try {
            return jdbcTemplate.update(sql,
                record.getName(),
                record.getDescription(),
                record.getReferences(),
                record.getTechniqueId(),
                record.getTactic().getId()) > 0;
        } catch (DataAccessException e) {
            throw new CatalogStoreException("Failed to update catalog record " + record, e);
        }
    }
    
    @Override
    public List<CatalogRecord> findAll() {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY id", new CatalogRecordRowMapper());
        } catch (DataAccessException e) {
            throw new CatalogStoreException("Failed to list catalog records", e);
        }
    }
    
    @Override
    public long count() {
        try {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM catalog_records", Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new CatalogStoreException("Failed to count catalog records", e);
        }
    }
    
    @Override
    public boolean isPopulated() {
        try {
            List<String> values = jdbcTemplate.queryForList(
                "SELECT setting_value FROM catalog_settings WHERE setting_key = ?",
                String.class, POPULATED_KEY);
            return !values.isEmpty() && "1".equals(values.get(0));
        } catch (DataAccessException e) {
            throw new CatalogStoreException("Failed to read catalog settings", e);
        }
    }
    
    @Override
    public void markPopulated() {
        try {
            jdbcTemplate.update(
                "MERGE INTO catalog_settings (setting_key, setting_value) KEY (setting_key) VALUES (?, ?)",
                POPULATED_KEY, "1");
        } catch (DataAccessException e) {
            throw new CatalogStoreException("Failed to write catalog settings", e);
        }
    }
    
    @Override
    public <T> T inTransaction(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (CatalogStoreException e) {
            throw e;
        } catch (DataAccessException e) {
            throw new CatalogStoreException("Catalog transaction failed", e);
        }
    }
    
    /**
     * Row mapper for catalog records; unknown tactic ids map to a null tactic
     */
    private static class CatalogRecordRowMapper implements RowMapper<CatalogRecord> {
        @Override
        public CatalogRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return CatalogRecord.builder()
                .techniqueId(rs.getString("technique_id"))
                .tactic(Tactic.fromId(rs.getString("tactic_id")).orElse(null))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .references(rs.getString("refs"))
                .createdAt(createdAt != null ? createdAt.toInstant() : null)
                .build();
        }
    }
}
