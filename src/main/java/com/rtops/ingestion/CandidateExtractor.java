package com.rtops.ingestion;

import com.rtops.ingestion.parsers.BundleParser;
import com.rtops.ingestion.parsers.FlatListParser;
import com.rtops.ingestion.parsers.RawCandidate;
import com.rtops.ingestion.parsers.SpreadsheetParser;
import com.rtops.ingestion.source.ParsedSource;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes each loaded document to the parser for its shape.
 */
@Component
public class CandidateExtractor implements ParsedSource.Visitor<List<RawCandidate>> {
    
    private final BundleParser bundleParser;
    private final FlatListParser flatListParser;
    private final SpreadsheetParser spreadsheetParser;
    
    public CandidateExtractor(
            BundleParser bundleParser,
            FlatListParser flatListParser,
            SpreadsheetParser spreadsheetParser) {
        this.bundleParser = bundleParser;
        this.flatListParser = flatListParser;
        this.spreadsheetParser = spreadsheetParser;
    }
    
    public List<RawCandidate> extract(ParsedSource source) {
        return source.accept(this);
    }
    
    @Override
    public List<RawCandidate> visitBundle(ParsedSource.Bundle bundle) {
        return bundleParser.parse(bundle);
    }
    
    @Override
    public List<RawCandidate> visitFlatList(ParsedSource.FlatList flatList) {
        return flatListParser.parse(flatList);
    }
    
    @Override
    public List<RawCandidate> visitSpreadsheet(ParsedSource.Spreadsheet spreadsheet) {
        return spreadsheetParser.parse(spreadsheet);
    }
}
