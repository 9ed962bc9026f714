package com.rtops.ingestion.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.rtops.ingestion.source.ParsedSource;
import com.rtops.ingestion.source.SourceKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parser for flat technique lists (Navigator-layer style).
 * 
 * Entries carry only {@code techniqueID} and {@code tactic}. The technique id is
 * used as a placeholder name so the record shows up as needing enrichment.
 */
@Component
public class FlatListParser implements CandidateParser<ParsedSource.FlatList> {
    
    @Override
    public List<RawCandidate> parse(ParsedSource.FlatList source) throws ParseException {
        JsonNode techniques = source.getTechniques();
        if (techniques == null || !techniques.isArray()) {
            throw new ParseException("Technique list is not an array",
                SourceKind.FLAT_LIST, String.valueOf(source.getPath()));
        }
        
        List<RawCandidate> candidates = new ArrayList<>();
        for (JsonNode entry : techniques) {
            String techniqueId = entry.path("techniqueID").asText("");
            String tactic = entry.path("tactic").asText("").toLowerCase(Locale.ROOT);
            if (techniqueId.isEmpty() || tactic.isEmpty()) {
                continue;
            }
            candidates.add(new RawCandidate(techniqueId, tactic, techniqueId, ""));
        }
        return candidates;
    }
    
    @Override
    public SourceKind getSourceKind() {
        return SourceKind.FLAT_LIST;
    }
}
