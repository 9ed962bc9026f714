package com.rtops.catalog;

import com.rtops.domain.CatalogRecord;
import com.rtops.domain.Tactic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Catalog store held in process memory, keyed by (technique, tactic).
 * 
 * Transactions are emulated by snapshotting the map and restoring it when the
 * work throws. Records are copied on the way in and out.
 */
@Repository
@ConditionalOnProperty(name = "rtops.catalog.store", havingValue = "memory")
public class InMemoryCatalogStore implements CatalogStore {
    
    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalogStore.class);
    
    private final Map<String, CatalogRecord> records = new LinkedHashMap<>();
    private boolean populated;
    
    @Override
    public synchronized Optional<CatalogRecord> find(String techniqueId, Tactic tactic) {
        CatalogRecord record = records.get(key(techniqueId, tactic));
        return record == null ? Optional.empty() : Optional.of(record.copy());
    }
    
    @Override
    public synchronized boolean insertIfAbsent(CatalogRecord record) {
        String key = key(record.getTechniqueId(), record.getTactic());
        if (records.containsKey(key)) {
            return false;
        }
        records.put(key, record.copy());
        return true;
    }
    
    @Override
    public synchronized boolean update(CatalogRecord record) {
        CatalogRecord stored = records.get(key(record.getTechniqueId(), record.getTactic()));
        if (stored == null) {
            return false;
        }
        stored.setName(record.getName());
        stored.setDescription(record.getDescription());
        stored.setReferences(record.getReferences());
        return true;
    }
    
    @Override
    public synchronized List<CatalogRecord> findAll() {
        List<CatalogRecord> all = new ArrayList<>(records.size());
        for (CatalogRecord record : records.values()) {
            all.add(record.copy());
        }
        return all;
    }
    
    @Override
    public synchronized long count() {
        return records.size();
    }
    
    @Override
    public synchronized boolean isPopulated() {
        return populated;
    }
    
    @Override
    public synchronized void markPopulated() {
        populated = true;
    }
    
    @Override
    public synchronized <T> T inTransaction(Supplier<T> work) {
        Map<String, CatalogRecord> snapshot = new LinkedHashMap<>();
        records.forEach((key, record) -> snapshot.put(key, record.copy()));
        try {
            return work.get();
        } catch (RuntimeException e) {
            log.debug("Rolling back in-memory transaction: {}", e.getMessage());
            records.clear();
            records.putAll(snapshot);
            throw e;
        }
    }
    
    private static String key(String techniqueId, Tactic tactic) {
        return techniqueId + "|" + (tactic == null ? "" : tactic.getId());
    }
}
