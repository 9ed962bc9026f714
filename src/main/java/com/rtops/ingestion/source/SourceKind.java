package com.rtops.ingestion.source;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The document shapes the import pipeline understands.
 */
public enum SourceKind {
    
    /**
     * Graph-style bundle: top-level "objects" of tagged entities
     */
    BUNDLE("bundle"),
    
    /**
     * Flat list of technique id / tactic pairs under "techniques"
     */
    FLAT_LIST("flat-list"),
    
    /**
     * Multi-sheet workbook
     */
    SPREADSHEET("spreadsheet");
    
    private final String value;
    
    SourceKind(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @Override
    public String toString() {
        return value;
    }
}
