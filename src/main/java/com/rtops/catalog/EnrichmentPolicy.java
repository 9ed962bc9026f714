package com.rtops.catalog;

import com.rtops.domain.CatalogRecord;

/**
 * Conflict resolution between a stored record and an incoming record of the
 * same (technique, tactic) pair.
 */
public interface EnrichmentPolicy {
    
    /**
     * Decide the stored content after seeing an incoming record
     * 
     * @param existing the stored record
     * @param incoming the newly imported record
     * @return the record to store; a copy equal in content to existing means no change
     */
    CatalogRecord resolve(CatalogRecord existing, CatalogRecord incoming);
}
