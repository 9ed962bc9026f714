package com.rtops.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One (technique, tactic) entry of the technique catalog.
 * 
 * A technique that belongs to several tactics is stored as several records,
 * one per tactic. The pair (techniqueId, tactic) is unique in the catalog.
 * Name and description may be empty when the record is first created and
 * filled in by a later import; empty values are stored as empty strings.
 */
public class CatalogRecord {
    
    /**
     * Technique identifier, e.g. "T1059" or "T1059.001"
     */
    @JsonProperty("technique_id")
    private String techniqueId;
    
    @JsonProperty("tactic")
    private Tactic tactic;
    
    /**
     * Human-readable technique name; equal to the technique id while it is a placeholder
     */
    @JsonProperty("name")
    private String name;
    
    @JsonProperty("description")
    private String description;
    
    /**
     * Free text or links
     */
    @JsonProperty("references")
    private String references;
    
    /**
     * Set once, when the record is first inserted
     */
    @JsonProperty("created_at")
    private Instant createdAt;
    
    public CatalogRecord() {
        this.name = "";
        this.description = "";
        this.references = "";
    }
    
    public CatalogRecord(String techniqueId, Tactic tactic, String name, String description) {
        this();
        this.techniqueId = techniqueId;
        this.tactic = tactic;
        this.name = name == null ? "" : name;
        this.description = description == null ? "" : description;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private final CatalogRecord record;
        
        public Builder() {
            this.record = new CatalogRecord();
        }
        
        public Builder techniqueId(String techniqueId) {
            record.techniqueId = techniqueId;
            return this;
        }
        
        public Builder tactic(Tactic tactic) {
            record.tactic = tactic;
            return this;
        }
        
        public Builder name(String name) {
            record.name = name == null ? "" : name;
            return this;
        }
        
        public Builder description(String description) {
            record.description = description == null ? "" : description;
            return this;
        }
        
        public Builder references(String references) {
            record.references = references == null ? "" : references;
            return this;
        }
        
        public Builder createdAt(Instant createdAt) {
            record.createdAt = createdAt;
            return this;
        }
        
        public CatalogRecord build() {
            return record;
        }
    }
    
    /**
     * Create an independent copy of this record
     * 
     * @return a new record with the same field values
     */
    public CatalogRecord copy() {
        return builder()
            .techniqueId(techniqueId)
            .tactic(tactic)
            .name(name)
            .description(description)
            .references(references)
            .createdAt(createdAt)
            .build();
    }
    
    /**
     * Check whether the name still needs enrichment.
     * 
     * A name is a placeholder when it is empty or equal to the technique id,
     * which is what identifier-only sources store until a richer source arrives.
     * 
     * @return true if the name may be replaced by an incoming name
     */
    public boolean hasPlaceholderName() {
        return name == null || name.isBlank() || name.equals(techniqueId);
    }
    
    public boolean hasEmptyDescription() {
        return description == null || description.isBlank();
    }
    
    /**
     * Check whether another record carries the same stored content.
     * createdAt is not compared.
     * 
     * @param other record to compare with
     * @return true if name, description and references are equal
     */
    public boolean sameContentAs(CatalogRecord other) {
        return other != null
            && Objects.equals(name, other.name)
            && Objects.equals(description, other.description)
            && Objects.equals(references, other.references);
    }
    
    // Getters and Setters
    
    public String getTechniqueId() {
        return techniqueId;
    }
    
    public void setTechniqueId(String techniqueId) {
        this.techniqueId = techniqueId;
    }
    
    public Tactic getTactic() {
        return tactic;
    }
    
    public void setTactic(Tactic tactic) {
        this.tactic = tactic;
    }
    
    public String getName() {
        return name;
    }
    
    public void setName(String name) {
        this.name = name;
    }
    
    public String getDescription() {
        return description;
    }
    
    public void setDescription(String description) {
        this.description = description;
    }
    
    public String getReferences() {
        return references;
    }
    
    public void setReferences(String references) {
        this.references = references;
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CatalogRecord)) {
            return false;
        }
        CatalogRecord that = (CatalogRecord) o;
        return Objects.equals(techniqueId, that.techniqueId) && tactic == that.tactic;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(techniqueId, tactic);
    }
    
    @Override
    public String toString() {
        return "CatalogRecord{" +
                "techniqueId='" + techniqueId + '\'' +
                ", tactic=" + tactic +
                ", name='" + name + '\'' +
                '}';
    }
}
