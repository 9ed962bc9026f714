package com.rtops.ingestion.parsers;

import com.rtops.ingestion.source.ParsedSource;
import com.rtops.ingestion.source.SourceKind;

import java.util.List;

/**
 * Interface for extracting raw technique candidates from one document shape.
 * Implementations are stateless and never touch the catalog.
 *
 * @param <S> the document shape this parser handles
 */
public interface CandidateParser<S extends ParsedSource> {
    
    /**
     * Extracts raw candidates from a loaded document, in document order
     * 
     * @param source the loaded document
     * @return candidates; entries that cannot be cataloged are already skipped
     * @throws ParseException if the document structure is unusable
     */
    List<RawCandidate> parse(S source) throws ParseException;
    
    /**
     * Returns the document shape this parser handles
     * 
     * @return source kind
     */
    SourceKind getSourceKind();
}
