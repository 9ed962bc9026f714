package com.rtops.catalog;

import com.rtops.domain.CatalogRecord;
import com.rtops.domain.Tactic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for JdbcCatalogStore against an in-memory H2 database.
 */
@DisplayName("JdbcCatalogStore Tests")
class JdbcCatalogStoreTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T10:00:00Z");

    private JdbcTemplate jdbcTemplate;
    private JdbcCatalogStore store;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            "jdbc:h2:mem:catalog-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        jdbcTemplate = new JdbcTemplate(dataSource);
        new CatalogSchemaManager(jdbcTemplate).createTables();

        TransactionTemplate transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        store = new JdbcCatalogStore(jdbcTemplate, transactionTemplate);
    }

    private static CatalogRecord record(String id, Tactic tactic, String name) {
        return CatalogRecord.builder()
            .techniqueId(id)
            .tactic(tactic)
            .name(name)
            .createdAt(CREATED)
            .build();
    }

    @Test
    @DisplayName("Should insert once per technique and tactic")
    void shouldInsertIfAbsent() {
        assertThat(store.insertIfAbsent(record("T1059", Tactic.EXECUTION, "T1059"))).isTrue();
        assertThat(store.insertIfAbsent(record("T1059", Tactic.EXECUTION, "Other"))).isFalse();
        assertThat(store.insertIfAbsent(record("T1059", Tactic.PERSISTENCE, "T1059"))).isTrue();

        assertThat(store.count()).isEqualTo(2);
        CatalogRecord stored = store.find("T1059", Tactic.EXECUTION).orElseThrow();
        assertThat(stored.getName()).isEqualTo("T1059");
        assertThat(stored.getDescription()).isEmpty();
        assertThat(stored.getCreatedAt()).isEqualTo(CREATED);
    }

    @Test
    @DisplayName("Should update content but not createdAt")
    void shouldUpdateContent() {
        store.insertIfAbsent(record("T1059", Tactic.EXECUTION, "T1059"));

        CatalogRecord enriched = record("T1059", Tactic.EXECUTION, "Command and Scripting Interpreter");
        enriched.setDescription("Run commands.");
        enriched.setReferences("https://attack.mitre.org/techniques/T1059/");
        enriched.setCreatedAt(Instant.parse("2030-01-01T00:00:00Z"));

        assertThat(store.update(enriched)).isTrue();

        CatalogRecord stored = store.find("T1059", Tactic.EXECUTION).orElseThrow();
        assertThat(stored.sameContentAs(enriched)).isTrue();
        assertThat(stored.getCreatedAt()).isEqualTo(CREATED);
        assertThat(store.update(record("T9999", Tactic.EXECUTION, "x"))).isFalse();
    }

    @Test
    @DisplayName("Should list records in insertion order")
    void shouldListInInsertionOrder() {
        store.insertIfAbsent(record("T1566", Tactic.INITIAL_ACCESS, "Phishing"));
        store.insertIfAbsent(record("T1003", Tactic.CREDENTIAL_ACCESS, "OS Credential Dumping"));

        List<CatalogRecord> all = store.findAll();

        assertThat(all).extracting(CatalogRecord::getTechniqueId).containsExactly("T1566", "T1003");
    }

    @Test
    @DisplayName("Should map rows with unknown tactics to a null tactic")
    void shouldMapUnknownTacticToNull() {
        jdbcTemplate.update(
            "INSERT INTO catalog_records (technique_id, tactic_id, name, created_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
            "T1200", "weaponization", "Hardware Additions");

        assertThat(store.findAll()).singleElement()
            .satisfies(r -> assertThat(r.getTactic()).isNull());
    }

    @Test
    @DisplayName("Should persist the populated flag")
    void shouldPersistPopulatedFlag() {
        assertThat(store.isPopulated()).isFalse();

        store.markPopulated();
        store.markPopulated();

        assertThat(store.isPopulated()).isTrue();
        String value = jdbcTemplate.queryForObject(
            "SELECT setting_value FROM catalog_settings WHERE setting_key = ?", String.class,
            JdbcCatalogStore.POPULATED_KEY);
        assertThat(value).isEqualTo("1");
    }

    @Test
    @DisplayName("Should roll back every write of a failed transaction")
    void shouldRollBackTransaction() {
        store.insertIfAbsent(record("T1059", Tactic.EXECUTION, "T1059"));

        assertThatThrownBy(() -> store.inTransaction(() -> {
            store.insertIfAbsent(record("T1021", Tactic.LATERAL_MOVEMENT, "Remote Services"));
            store.update(record("T1059", Tactic.EXECUTION, "Command and Scripting Interpreter"));
            throw new CatalogStoreException("simulated");
        })).isInstanceOf(CatalogStoreException.class);

        assertThat(store.count()).isEqualTo(1);
        assertThat(store.find("T1059", Tactic.EXECUTION).orElseThrow().getName()).isEqualTo("T1059");
    }

    @Test
    @DisplayName("Should wrap database failures in CatalogStoreException")
    void shouldWrapDatabaseFailures() {
        jdbcTemplate.execute("DROP TABLE catalog_records");

        assertThatThrownBy(() -> store.count()).isInstanceOf(CatalogStoreException.class);
        assertThatThrownBy(() -> store.insertIfAbsent(record("T1059", Tactic.EXECUTION, "T1059")))
            .isInstanceOf(CatalogStoreException.class);
    }

    @Test
    @DisplayName("Should store names of any length")
    void shouldStoreLongNames() {
        String longName = "x".repeat(1500);

        assertThat(store.insertIfAbsent(record("T1059", Tactic.EXECUTION, longName))).isTrue();

        assertThat(store.find("T1059", Tactic.EXECUTION).orElseThrow().getName()).isEqualTo(longName);
    }
}
