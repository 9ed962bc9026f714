package com.rtops.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Catalog status for display: whether an import ever populated it, and its size.
 */
public class CatalogStatus {
    
    @JsonProperty("populated")
    private final boolean populated;
    
    @JsonProperty("record_count")
    private final long recordCount;
    
    public CatalogStatus(boolean populated, long recordCount) {
        this.populated = populated;
        this.recordCount = recordCount;
    }
    
    public boolean isPopulated() {
        return populated;
    }
    
    public long getRecordCount() {
        return recordCount;
    }
}
