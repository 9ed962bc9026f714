package com.rtops.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.rtops.ingestion.source.SourceKind;

/**
 * What happened to one candidate source file during an import pass.
 */
public class SourceOutcome {
    
    public enum Status {
        /**
         * Parsed and merged; change count may still be zero
         */
        IMPORTED("imported"),
        
        /**
         * Path does not exist; not an error
         */
        MISSING("missing"),
        
        /**
         * Exists but could not be read as its expected shape
         */
        FAILED("failed");
        
        private final String value;
        
        Status(String value) {
            this.value = value;
        }
        
        @JsonValue
        public String getValue() {
            return value;
        }
    }
    
    @JsonProperty("path")
    private final String path;
    
    @JsonProperty("kind")
    private final SourceKind kind;
    
    @JsonProperty("status")
    private final Status status;
    
    @JsonProperty("changes")
    private final int changes;
    
    @JsonProperty("error")
    private final String error;
    
    private SourceOutcome(String path, SourceKind kind, Status status, int changes, String error) {
        this.path = path;
        this.kind = kind;
        this.status = status;
        this.changes = changes;
        this.error = error;
    }
    
    public static SourceOutcome imported(String path, SourceKind kind, int changes) {
        return new SourceOutcome(path, kind, Status.IMPORTED, changes, null);
    }
    
    public static SourceOutcome missing(String path) {
        return new SourceOutcome(path, null, Status.MISSING, 0, null);
    }
    
    public static SourceOutcome failed(String path, SourceKind kind, String error) {
        return new SourceOutcome(path, kind, Status.FAILED, 0, error);
    }
    
    public String getPath() {
        return path;
    }
    
    public SourceKind getKind() {
        return kind;
    }
    
    public Status getStatus() {
        return status;
    }
    
    public int getChanges() {
        return changes;
    }
    
    public String getError() {
        return error;
    }
    
    @Override
    public String toString() {
        return status.getValue() + " " + path + (changes > 0 ? " (" + changes + ")" : "");
    }
}
