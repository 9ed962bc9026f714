package com.rtops.catalog;

/**
 * Outcome of merging one batch into the catalog.
 */
public class MergeResult {
    private final int inserted;
    private final int enriched;
    private final int unchanged;

    public MergeResult(int inserted, int enriched, int unchanged) {
        this.inserted = inserted;
        this.enriched = enriched;
        this.unchanged = unchanged;
    }

    public static MergeResult empty() {
        return new MergeResult(0, 0, 0);
    }

    public int getInserted() {
        return inserted;
    }

    public int getEnriched() {
        return enriched;
    }

    public int getUnchanged() {
        return unchanged;
    }

    /**
     * Records inserted or enriched
     */
    public int getChangeCount() {
        return inserted + enriched;
    }

    @Override
    public String toString() {
        return "MergeResult{inserted=" + inserted + ", enriched=" + enriched + ", unchanged=" + unchanged + '}';
    }
}
