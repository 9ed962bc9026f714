package com.rtops.ingestion.parsers;

import java.util.Objects;

/**
 * Unvalidated (technique, tactic) pair as extracted from a source document.
 * 
 * Nothing is checked here: the id may be malformed and the tactic may be
 * outside the registry. Name and description may be null.
 */
public class RawCandidate {
    private final String techniqueId;
    private final String tacticId;
    private final String name;
    private final String description;

    public RawCandidate(String techniqueId, String tacticId, String name, String description) {
        this.techniqueId = techniqueId;
        this.tacticId = tacticId;
        this.name = name;
        this.description = description;
    }

    public String getTechniqueId() {
        return techniqueId;
    }

    public String getTacticId() {
        return tacticId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawCandidate)) {
            return false;
        }
        RawCandidate that = (RawCandidate) o;
        return Objects.equals(techniqueId, that.techniqueId)
            && Objects.equals(tacticId, that.tacticId)
            && Objects.equals(name, that.name)
            && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(techniqueId, tacticId, name, description);
    }

    @Override
    public String toString() {
        return "RawCandidate{" + techniqueId + "/" + tacticId + ", name='" + name + "'}";
    }
}
