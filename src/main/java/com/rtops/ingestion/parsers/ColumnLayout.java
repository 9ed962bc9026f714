package com.rtops.ingestion.parsers;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Column indexes of the logical technique columns within one sheet.
 * 
 * Columns are resolved in the order ID, NAME, DESCRIPTION, TACTICS. For each,
 * the leftmost header cell matching one of its synonyms wins, skipping cells
 * already claimed by an earlier column; so "Technique Name" is still found as
 * the name column when "Technique ID" precedes it.
 */
public final class ColumnLayout {
    
    private final Map<HeaderSynonyms.Column, Integer> indexes;
    
    private ColumnLayout(Map<HeaderSynonyms.Column, Integer> indexes) {
        this.indexes = indexes;
    }
    
    /**
     * Resolve the layout of a sheet from its header row
     * 
     * @param header header row cells
     * @param synonyms header synonyms
     * @return the layout, or empty if a required column is missing
     */
    public static Optional<ColumnLayout> resolve(List<String> header, HeaderSynonyms synonyms) {
        Map<HeaderSynonyms.Column, Integer> indexes = new EnumMap<>(HeaderSynonyms.Column.class);
        Set<Integer> claimed = new HashSet<>();
        
        for (HeaderSynonyms.Column column : HeaderSynonyms.Column.values()) {
            for (int i = 0; i < header.size(); i++) {
                if (!claimed.contains(i) && synonyms.matches(column, header.get(i))) {
                    indexes.put(column, i);
                    claimed.add(i);
                    break;
                }
            }
            if (column.isRequired() && !indexes.containsKey(column)) {
                return Optional.empty();
            }
        }
        return Optional.of(new ColumnLayout(indexes));
    }
    
    /**
     * @param column logical column
     * @return the zero-based index, or empty if the sheet has no such column
     */
    public OptionalInt indexOf(HeaderSynonyms.Column column) {
        Integer index = indexes.get(column);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }
    
    @Override
    public String toString() {
        return "ColumnLayout" + indexes;
    }
}
