package com.rtops.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Result of one import pass.
 */
public class ImportReport {
    private final int changeCount;
    private final boolean populatedTransitioned;
    private final boolean populated;
    private final List<SourceOutcome> sources;

    public ImportReport(int changeCount, boolean populatedTransitioned, boolean populated,
                        List<SourceOutcome> sources) {
        this.changeCount = changeCount;
        this.populatedTransitioned = populatedTransitioned;
        this.populated = populated;
        this.sources = sources == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(sources);
    }

    /**
     * Records inserted or enriched across all sources
     */
    @JsonProperty("change_count")
    public int getChangeCount() {
        return changeCount;
    }

    /**
     * True if this pass set the populated flag for the first time
     */
    @JsonProperty("populated_transitioned")
    public boolean isPopulatedTransitioned() {
        return populatedTransitioned;
    }

    @JsonProperty("populated")
    public boolean isPopulated() {
        return populated;
    }

    @JsonProperty("sources")
    public List<SourceOutcome> getSources() {
        return sources;
    }

    @JsonProperty("summary")
    public String getSummary() {
        if (changeCount > 0) {
            return "Imported/updated " + changeCount + " tactic-technique rows.";
        }
        return "No data imported: files missing or unrecognized.";
    }
}
