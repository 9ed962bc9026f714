package com.rtops.catalog;

import com.rtops.domain.CatalogRecord;
import com.rtops.domain.Tactic;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for InMemoryCatalogStore
 */
class InMemoryCatalogStoreTest {

    private final InMemoryCatalogStore store = new InMemoryCatalogStore();

    @Test
    void testInsertIfAbsentKeepsFirstRecord() {
        assertThat(store.insertIfAbsent(new CatalogRecord("T1059", Tactic.EXECUTION, "First", ""))).isTrue();
        assertThat(store.insertIfAbsent(new CatalogRecord("T1059", Tactic.EXECUTION, "Second", ""))).isFalse();
        assertThat(store.insertIfAbsent(new CatalogRecord("T1059", Tactic.PERSISTENCE, "Second", ""))).isTrue();

        assertThat(store.count()).isEqualTo(2);
        assertThat(store.find("T1059", Tactic.EXECUTION).orElseThrow().getName()).isEqualTo("First");
    }

    @Test
    void testReturnedRecordsAreCopies() {
        store.insertIfAbsent(new CatalogRecord("T1059", Tactic.EXECUTION, "First", ""));

        store.find("T1059", Tactic.EXECUTION).orElseThrow().setName("changed");
        store.findAll().get(0).setName("changed");

        assertThat(store.find("T1059", Tactic.EXECUTION).orElseThrow().getName()).isEqualTo("First");
    }

    @Test
    void testUpdateOfMissingRecordReportsFalse() {
        assertThat(store.update(new CatalogRecord("T1059", Tactic.EXECUTION, "x", ""))).isFalse();
        assertThat(store.count()).isZero();
    }

    @Test
    void testTransactionRollsBackOnFailure() {
        store.insertIfAbsent(new CatalogRecord("T1059", Tactic.EXECUTION, "T1059", ""));

        assertThatThrownBy(() -> store.inTransaction(() -> {
            store.insertIfAbsent(new CatalogRecord("T1021", Tactic.LATERAL_MOVEMENT, "Remote Services", ""));
            store.update(new CatalogRecord("T1059", Tactic.EXECUTION, "Command and Scripting Interpreter", ""));
            throw new CatalogStoreException("simulated");
        })).isInstanceOf(CatalogStoreException.class);

        assertThat(store.count()).isEqualTo(1);
        assertThat(store.find("T1059", Tactic.EXECUTION).orElseThrow().getName()).isEqualTo("T1059");
    }

    @Test
    void testPopulatedFlagIsSticky() {
        assertThat(store.isPopulated()).isFalse();

        store.markPopulated();
        store.markPopulated();

        assertThat(store.isPopulated()).isTrue();
    }
}
