package com.rtops.ingestion.parsers;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Header substrings that identify the logical columns of a technique sheet.
 * 
 * Matching is case-insensitive substring containment. Synonyms are kept as
 * data so the matching policy can be configured and tested on its own.
 */
public class HeaderSynonyms {
    
    /**
     * Logical columns of a technique sheet
     */
    public enum Column {
        ID(true),
        NAME(true),
        DESCRIPTION(false),
        TACTICS(true);
        
        private final boolean required;
        
        Column(boolean required) {
            this.required = required;
        }
        
        /**
         * @return true if a sheet without this column is not technique data
         */
        public boolean isRequired() {
            return required;
        }
    }
    
    public static final List<String> DEFAULT_ID = List.of("technique id", "external id", "id", "external_id");
    public static final List<String> DEFAULT_NAME = List.of("technique name", "technique", "name");
    public static final List<String> DEFAULT_DESCRIPTION = List.of("description", "technique description");
    public static final List<String> DEFAULT_TACTICS = List.of("tactics", "tactic", "domain tactics");
    
    private final Map<Column, List<String>> synonyms;
    
    public HeaderSynonyms(Map<Column, List<String>> synonyms) {
        Map<Column, List<String>> copy = new EnumMap<>(Column.class);
        for (Column column : Column.values()) {
            List<String> values = synonyms == null ? null : synonyms.get(column);
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("No header synonyms configured for column " + column);
            }
            copy.put(column, values.stream()
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toUnmodifiableList()));
        }
        this.synonyms = Collections.unmodifiableMap(copy);
    }
    
    /**
     * Synonym lists matching the ATT&amp;CK Excel exports
     * 
     * @return default synonyms
     */
    public static HeaderSynonyms defaults() {
        Map<Column, List<String>> synonyms = new EnumMap<>(Column.class);
        synonyms.put(Column.ID, DEFAULT_ID);
        synonyms.put(Column.NAME, DEFAULT_NAME);
        synonyms.put(Column.DESCRIPTION, DEFAULT_DESCRIPTION);
        synonyms.put(Column.TACTICS, DEFAULT_TACTICS);
        return new HeaderSynonyms(synonyms);
    }
    
    public List<String> get(Column column) {
        return synonyms.get(column);
    }
    
    /**
     * Check whether a header cell names the given logical column
     * 
     * @param column logical column
     * @param headerText header cell text
     * @return true if the lowercased header contains any synonym of the column
     */
    public boolean matches(Column column, String headerText) {
        if (headerText == null) {
            return false;
        }
        String key = headerText.trim().toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            return false;
        }
        for (String synonym : synonyms.get(column)) {
            if (key.contains(synonym)) {
                return true;
            }
        }
        return false;
    }
}
