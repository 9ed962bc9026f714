package com.rtops.ingestion.parsers;

import com.rtops.ingestion.source.SourceKind;

/**
 * Exception thrown when a source document cannot be read as its expected shape.
 * Carries the source kind and location to help diagnose the failing file.
 */
public class ParseException extends RuntimeException {
    
    private final SourceKind sourceKind;
    private final String sourcePath;
    
    public ParseException(String message) {
        super(message);
        this.sourceKind = null;
        this.sourcePath = null;
    }
    
    public ParseException(String message, Throwable cause) {
        super(message, cause);
        this.sourceKind = null;
        this.sourcePath = null;
    }
    
    public ParseException(String message, SourceKind sourceKind, String sourcePath) {
        super(message);
        this.sourceKind = sourceKind;
        this.sourcePath = sourcePath;
    }
    
    public ParseException(String message, Throwable cause, SourceKind sourceKind, String sourcePath) {
        super(message, cause);
        this.sourceKind = sourceKind;
        this.sourcePath = sourcePath;
    }
    
    public SourceKind getSourceKind() {
        return sourceKind;
    }
    
    public String getSourcePath() {
        return sourcePath;
    }
}
