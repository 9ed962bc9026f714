package com.rtops.catalog;

import com.rtops.domain.CatalogRecord;
import org.springframework.stereotype.Component;

/**
 * Fills gaps, never overwrites.
 * 
 * The name is taken from the incoming record only while the stored name is a
 * placeholder (empty or equal to the technique id). Description and references
 * are taken only while the stored value is empty. An empty incoming value never
 * replaces anything. Identity fields and createdAt always come from the stored
 * record.
 */
@Component
public class EnrichOnlyPolicy implements EnrichmentPolicy {
    
    @Override
    public CatalogRecord resolve(CatalogRecord existing, CatalogRecord incoming) {
        CatalogRecord resolved = existing.copy();
        
        if (existing.hasPlaceholderName() && isPresent(incoming.getName())) {
            resolved.setName(incoming.getName());
        }
        if (existing.hasEmptyDescription() && isPresent(incoming.getDescription())) {
            resolved.setDescription(incoming.getDescription());
        }
        if (!isPresent(existing.getReferences()) && isPresent(incoming.getReferences())) {
            resolved.setReferences(incoming.getReferences());
        }
        return resolved;
    }
    
    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
