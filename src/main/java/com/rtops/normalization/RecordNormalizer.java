package com.rtops.normalization;

import com.rtops.domain.CatalogRecord;
import com.rtops.domain.Tactic;
import com.rtops.ingestion.parsers.RawCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps raw candidates to catalog records.
 * 
 * A candidate is rejected when its technique id does not match
 * {@link TechniqueIds#PATTERN} or its tactic is not in the {@link Tactic}
 * registry. Rejections are not errors; they are logged at debug level and
 * dropped. Accepted candidates have all strings trimmed and nulls replaced
 * by empty strings. createdAt is left unset for the merger to stamp.
 */
@Component
public class RecordNormalizer {
    
    private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);
    
    /**
     * Normalize one candidate
     * 
     * @param candidate raw candidate
     * @return the record, or empty if the candidate is rejected
     */
    public Optional<CatalogRecord> normalize(RawCandidate candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        
        String techniqueId = trim(candidate.getTechniqueId());
        if (!TechniqueIds.isValid(techniqueId)) {
            log.debug("Rejected candidate with invalid technique id: {}", candidate);
            return Optional.empty();
        }
        
        Optional<Tactic> tactic = Tactic.fromId(candidate.getTacticId());
        if (tactic.isEmpty()) {
            log.debug("Rejected candidate with unknown tactic: {}", candidate);
            return Optional.empty();
        }
        
        return Optional.of(CatalogRecord.builder()
            .techniqueId(techniqueId)
            .tactic(tactic.get())
            .name(trim(candidate.getName()))
            .description(trim(candidate.getDescription()))
            .build());
    }
    
    /**
     * Normalize a batch, keeping the order of accepted candidates
     * 
     * @param candidates raw candidates
     * @return accepted records
     */
    public List<CatalogRecord> normalizeAll(List<RawCandidate> candidates) {
        List<CatalogRecord> records = new ArrayList<>(candidates.size());
        for (RawCandidate candidate : candidates) {
            normalize(candidate).ifPresent(records::add);
        }
        if (records.size() < candidates.size()) {
            log.debug("Normalized {} of {} candidates", records.size(), candidates.size());
        }
        return records;
    }
    
    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
