package com.rtops.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Catalog records of one tactic, as returned by the grouped catalog view.
 */
public class TacticGroup {
    private final Tactic tactic;
    private final List<CatalogRecord> records;

    public TacticGroup(Tactic tactic, List<CatalogRecord> records) {
        this.tactic = tactic;
        this.records = records == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(records);
    }

    @JsonProperty("tactic_id")
    public String getTacticId() {
        return tactic.getId();
    }

    @JsonProperty("title")
    public String getTitle() {
        return tactic.getTitle();
    }

    @JsonProperty("records")
    public List<CatalogRecord> getRecords() {
        return records;
    }

    @JsonProperty("count")
    public int getCount() {
        return records.size();
    }

    @JsonIgnore
    public Tactic getTactic() {
        return tactic;
    }
}
