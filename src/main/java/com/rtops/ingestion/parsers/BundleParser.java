package com.rtops.ingestion.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.rtops.ingestion.source.ParsedSource;
import com.rtops.ingestion.source.SourceKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parser for graph-style ATT&amp;CK bundles.
 * 
 * Only "attack-pattern" objects are considered. The technique id comes from the
 * first external reference of the mitre-attack source whose external id starts
 * with "T"; tactics come from the mitre-attack kill chain phases. One candidate
 * is emitted per phase.
 */
@Component
public class BundleParser implements CandidateParser<ParsedSource.Bundle> {
    
    static final String TECHNIQUE_TYPE = "attack-pattern";
    static final String AUTHORITY = "mitre-attack";
    
    @Override
    public List<RawCandidate> parse(ParsedSource.Bundle source) throws ParseException {
        JsonNode objects = source.getObjects();
        if (objects == null || !objects.isArray()) {
            throw new ParseException("Bundle has no objects array",
                SourceKind.BUNDLE, String.valueOf(source.getPath()));
        }
        
        List<RawCandidate> candidates = new ArrayList<>();
        for (JsonNode object : objects) {
            if (!object.isObject() || !TECHNIQUE_TYPE.equals(text(object, "type"))) {
                continue;
            }
            
            String techniqueId = extractTechniqueId(object);
            if (techniqueId == null) {
                continue;
            }
            
            List<String> tactics = extractPhases(object);
            if (tactics.isEmpty()) {
                continue;
            }
            
            String name = text(object, "name");
            String description = text(object, "description");
            for (String tactic : tactics) {
                candidates.add(new RawCandidate(techniqueId, tactic, name,
                    description == null ? "" : description));
            }
        }
        return candidates;
    }
    
    @Override
    public SourceKind getSourceKind() {
        return SourceKind.BUNDLE;
    }
    
    /**
     * Find the technique id among the object's external references
     */
    private String extractTechniqueId(JsonNode object) {
        JsonNode references = object.path("external_references");
        if (!references.isArray()) {
            return null;
        }
        for (JsonNode reference : references) {
            String sourceName = text(reference, "source_name");
            String externalId = text(reference, "external_id");
            if (sourceName != null && AUTHORITY.equals(sourceName.toLowerCase(Locale.ROOT))
                    && externalId != null && externalId.startsWith("T")) {
                return externalId;
            }
        }
        return null;
    }
    
    /**
     * Collect the lowercased phase names of the mitre-attack kill chain
     */
    private List<String> extractPhases(JsonNode object) {
        List<String> phases = new ArrayList<>();
        JsonNode killChainPhases = object.path("kill_chain_phases");
        if (!killChainPhases.isArray()) {
            return phases;
        }
        for (JsonNode phase : killChainPhases) {
            if (!AUTHORITY.equals(text(phase, "kill_chain_name"))) {
                continue;
            }
            String phaseName = text(phase, "phase_name");
            phases.add(phaseName == null ? "" : phaseName.toLowerCase(Locale.ROOT));
        }
        return phases;
    }
    
    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
