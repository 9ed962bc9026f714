package com.rtops.ingestion.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * A loaded source document, tagged with its shape.
 * 
 * The three variants are closed: the constructor is private to this file, so
 * callers handle every shape through {@link Visitor} instead of inspecting types.
 */
public abstract class ParsedSource {
    
    private final Path path;
    
    private ParsedSource(Path path) {
        this.path = path;
    }
    
    public Path getPath() {
        return path;
    }
    
    public abstract SourceKind getKind();
    
    public abstract <R> R accept(Visitor<R> visitor);
    
    public static ParsedSource bundle(Path path, JsonNode objects) {
        return new Bundle(path, objects);
    }
    
    public static ParsedSource flatList(Path path, JsonNode techniques) {
        return new FlatList(path, techniques);
    }
    
    public static ParsedSource spreadsheet(Path path, List<SheetData> sheets) {
        return new Spreadsheet(path, sheets);
    }
    
    /**
     * One handler per document shape
     */
    public interface Visitor<R> {
        R visitBundle(Bundle bundle);
        
        R visitFlatList(FlatList flatList);
        
        R visitSpreadsheet(Spreadsheet spreadsheet);
    }
    
    /**
     * Graph-style bundle; holds the top-level "objects" array
     */
    public static final class Bundle extends ParsedSource {
        private final JsonNode objects;
        
        private Bundle(Path path, JsonNode objects) {
            super(path);
            this.objects = objects;
        }
        
        public JsonNode getObjects() {
            return objects;
        }
        
        @Override
        public SourceKind getKind() {
            return SourceKind.BUNDLE;
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBundle(this);
        }
    }
    
    /**
     * Flat technique list; holds the top-level "techniques" array
     */
    public static final class FlatList extends ParsedSource {
        private final JsonNode techniques;
        
        private FlatList(Path path, JsonNode techniques) {
            super(path);
            this.techniques = techniques;
        }
        
        public JsonNode getTechniques() {
            return techniques;
        }
        
        @Override
        public SourceKind getKind() {
            return SourceKind.FLAT_LIST;
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFlatList(this);
        }
    }
    
    public static final class Spreadsheet extends ParsedSource {
        private final List<SheetData> sheets;
        
        private Spreadsheet(Path path, List<SheetData> sheets) {
            super(path);
            this.sheets = sheets == null ? Collections.emptyList() : Collections.unmodifiableList(sheets);
        }
        
        public List<SheetData> getSheets() {
            return sheets;
        }
        
        @Override
        public SourceKind getKind() {
            return SourceKind.SPREADSHEET;
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSpreadsheet(this);
        }
    }
}
