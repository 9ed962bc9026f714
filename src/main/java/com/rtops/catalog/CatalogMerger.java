package com.rtops.catalog;

import com.rtops.domain.CatalogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Applies normalized records to the catalog.
 * 
 * Absent pairs are inserted with createdAt stamped from the clock; present
 * pairs go through the {@link EnrichmentPolicy} and are written back only when
 * the resolved content differs. A batch runs in one store transaction, so a
 * replayed batch leaves the catalog as it was and reports zero changes.
 */
@Component
public class CatalogMerger {
    
    private static final Logger log = LoggerFactory.getLogger(CatalogMerger.class);
    
    private final EnrichmentPolicy policy;
    private final Clock clock;
    
    @Autowired
    public CatalogMerger(EnrichmentPolicy policy) {
        this(policy, Clock.systemUTC());
    }
    
    CatalogMerger(EnrichmentPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }
    
    /**
     * Merge a batch into the store as one transaction
     * 
     * @param store target catalog
     * @param records normalized records, applied in order
     * @return counts of inserted, enriched and unchanged records
     * @throws CatalogStoreException if the store fails; the batch is rolled back
     */
    public MergeResult merge(CatalogStore store, List<CatalogRecord> records) {
        if (records.isEmpty()) {
            return MergeResult.empty();
        }
        MergeResult result = store.inTransaction(() -> apply(store, records));
        log.debug("Merged batch of {}: {}", records.size(), result);
        return result;
    }
    
    private MergeResult apply(CatalogStore store, List<CatalogRecord> records) {
        int inserted = 0;
        int enriched = 0;
        int unchanged = 0;
        Instant now = clock.instant();
        
        for (CatalogRecord incoming : records) {
            Optional<CatalogRecord> existing = store.find(incoming.getTechniqueId(), incoming.getTactic());
            
            if (existing.isEmpty()) {
                CatalogRecord fresh = incoming.copy();
                fresh.setCreatedAt(now);
                if (store.insertIfAbsent(fresh)) {
                    inserted++;
                } else {
                    unchanged++;
                }
                continue;
            }
            
            CatalogRecord resolved = policy.resolve(existing.get(), incoming);
            if (resolved.sameContentAs(existing.get())) {
                unchanged++;
            } else if (store.update(resolved)) {
                enriched++;
            } else {
                unchanged++;
            }
        }
        return new MergeResult(inserted, enriched, unchanged);
    }
}
