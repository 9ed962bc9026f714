package com.rtops.ingestion;

import com.rtops.catalog.CatalogMerger;
import com.rtops.catalog.CatalogStore;
import com.rtops.catalog.MergeResult;
import com.rtops.domain.CatalogRecord;
import com.rtops.ingestion.parsers.ParseException;
import com.rtops.ingestion.parsers.RawCandidate;
import com.rtops.ingestion.source.ParsedSource;
import com.rtops.ingestion.source.SourceDocumentLoader;
import com.rtops.normalization.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs catalog import passes over the configured candidate files.
 * 
 * JSON sources (bundles and flat lists) are attempted first because they
 * establish identifiers and tactic membership; workbooks follow and mostly
 * enrich names and descriptions. Every existing candidate is attempted:
 * - a missing path is skipped silently
 * - a file that cannot be loaded or parsed is logged and skipped
 * - each parsed file is merged in its own transaction
 * 
 * A catalog write failure aborts the pass. Files merged before it stay
 * committed and the populated flag is left untouched.
 */
@Service
public class ImportOrchestrator {
    
    private static final Logger log = LoggerFactory.getLogger(ImportOrchestrator.class);
    
    private final SourceDocumentLoader loader;
    private final CandidateExtractor extractor;
    private final RecordNormalizer normalizer;
    private final CatalogMerger merger;
    private final CatalogStore store;
    private final ImportMetrics metrics;
    private final List<Path> bundlePaths;
    private final List<Path> spreadsheetPaths;
    
    public ImportOrchestrator(
            SourceDocumentLoader loader,
            CandidateExtractor extractor,
            RecordNormalizer normalizer,
            CatalogMerger merger,
            CatalogStore store,
            ImportMetrics metrics,
            @Value("${rtops.import.bundle-paths:enterprise-attack.json,/mnt/data/enterprise-attack.json}")
            List<String> bundlePaths,
            @Value("${rtops.import.spreadsheet-paths:enterprise-attack-v17.1.xlsx,/mnt/data/enterprise-attack-v17.1.xlsx}")
            List<String> spreadsheetPaths) {
        this.loader = loader;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.merger = merger;
        this.store = store;
        this.metrics = metrics;
        this.bundlePaths = toPaths(bundlePaths);
        this.spreadsheetPaths = toPaths(spreadsheetPaths);
    }
    
    /**
     * Run an import pass over the configured candidate paths
     * 
     * @return the pass report
     */
    public ImportReport runImport() {
        return runImport(bundlePaths, spreadsheetPaths);
    }
    
    /**
     * Run an import pass over explicit candidate paths
     * 
     * @param jsonCandidates bundle or flat-list files, attempted first
     * @param workbookCandidates spreadsheet files, attempted second
     * @return the pass report
     * @throws com.rtops.catalog.CatalogStoreException if the catalog cannot be written
     */
    public ImportReport runImport(List<Path> jsonCandidates, List<Path> workbookCandidates) {
        long start = System.currentTimeMillis();
        boolean wasPopulated = store.isPopulated();
        
        List<SourceOutcome> outcomes = new ArrayList<>();
        for (Path path : jsonCandidates) {
            outcomes.add(importSource(path, loader::loadJson));
        }
        for (Path path : workbookCandidates) {
            outcomes.add(importSource(path, loader::loadWorkbook));
        }
        
        int total = outcomes.stream().mapToInt(SourceOutcome::getChanges).sum();
        boolean transitioned = false;
        if (total > 0 && !wasPopulated) {
            store.markPopulated();
            transitioned = true;
        }
        
        ImportReport report = new ImportReport(total, transitioned, wasPopulated || total > 0, outcomes);
        metrics.recordPassDuration(System.currentTimeMillis() - start);
        log.info("Catalog import finished: {} sources={}", report.getSummary(), outcomes);
        return report;
    }
    
    private SourceOutcome importSource(Path path, Function<Path, ParsedSource> load) {
        String location = path.toString();
        if (!Files.exists(path)) {
            log.debug("Import source not present: {}", location);
            metrics.recordSource(null, SourceOutcome.Status.MISSING);
            return SourceOutcome.missing(location);
        }
        
        ParsedSource source;
        List<RawCandidate> candidates;
        try {
            source = load.apply(path);
            candidates = extractor.extract(source);
        } catch (ParseException e) {
            log.warn("Skipping unreadable import source {}: {}", location, e.getMessage());
            metrics.recordSource(e.getSourceKind(), SourceOutcome.Status.FAILED);
            return SourceOutcome.failed(location, e.getSourceKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Skipping import source {} after unexpected parse error", location, e);
            metrics.recordSource(null, SourceOutcome.Status.FAILED);
            return SourceOutcome.failed(location, null, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        
        List<CatalogRecord> records = normalizer.normalizeAll(candidates);
        MergeResult result = merger.merge(store, records);
        
        log.info("Imported {} source {}: {} candidates, {} valid, {}",
            source.getKind(), location, candidates.size(), records.size(), result);
        metrics.recordSource(source.getKind(), SourceOutcome.Status.IMPORTED);
        metrics.recordChanges(source.getKind(), result.getChangeCount());
        return SourceOutcome.imported(location, source.getKind(), result.getChangeCount());
    }
    
    private static List<Path> toPaths(List<String> locations) {
        if (locations == null) {
            return List.of();
        }
        return locations.stream()
            .map(String::trim)
            .filter(location -> !location.isEmpty())
            .map(Path::of)
            .collect(Collectors.toList());
    }
}
