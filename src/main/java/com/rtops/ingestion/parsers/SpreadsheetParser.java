package com.rtops.ingestion.parsers;

import com.rtops.domain.Tactic;
import com.rtops.ingestion.source.ParsedSource;
import com.rtops.ingestion.source.SheetData;
import com.rtops.ingestion.source.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Parser for ATT&amp;CK workbooks of arbitrary sheet layout.
 * 
 * Every sheet is inspected; a sheet is technique data when its header row has
 * id, name and tactics columns (see {@link ColumnLayout}). Rows are read top to
 * bottom, which keeps the order of candidates reproducible. A row is kept when
 * its id starts with "T" and its tactics cell names at least one registry
 * tactic; one candidate is emitted per tactic.
 */
@Component
public class SpreadsheetParser implements CandidateParser<ParsedSource.Spreadsheet> {
    
    private static final Logger log = LoggerFactory.getLogger(SpreadsheetParser.class);
    
    private final HeaderSynonyms synonyms;
    
    public SpreadsheetParser(HeaderSynonyms synonyms) {
        this.synonyms = synonyms;
    }
    
    @Override
    public List<RawCandidate> parse(ParsedSource.Spreadsheet source) throws ParseException {
        List<RawCandidate> candidates = new ArrayList<>();
        for (SheetData sheet : source.getSheets()) {
            Optional<ColumnLayout> layout = ColumnLayout.resolve(sheet.getHeader(), synonyms);
            if (layout.isEmpty()) {
                log.debug("Skipping sheet '{}': no technique columns in header {}",
                    sheet.getName(), sheet.getHeader());
                continue;
            }
            int before = candidates.size();
            parseSheet(sheet, layout.get(), candidates);
            log.debug("Sheet '{}' yielded {} candidates", sheet.getName(), candidates.size() - before);
        }
        return candidates;
    }
    
    @Override
    public SourceKind getSourceKind() {
        return SourceKind.SPREADSHEET;
    }
    
    private void parseSheet(SheetData sheet, ColumnLayout layout, List<RawCandidate> out) {
        int idColumn = layout.indexOf(HeaderSynonyms.Column.ID).getAsInt();
        int nameColumn = layout.indexOf(HeaderSynonyms.Column.NAME).getAsInt();
        int tacticsColumn = layout.indexOf(HeaderSynonyms.Column.TACTICS).getAsInt();
        OptionalInt descriptionColumn = layout.indexOf(HeaderSynonyms.Column.DESCRIPTION);
        
        for (int row = 1; row < sheet.getRowCount(); row++) {
            String techniqueId = sheet.cell(row, idColumn).trim();
            if (!techniqueId.startsWith("T")) {
                continue;
            }
            
            List<Tactic> tactics = TacticTokenizer.tokenize(sheet.cell(row, tacticsColumn));
            if (tactics.isEmpty()) {
                continue;
            }
            
            String name = sheet.cell(row, nameColumn).trim();
            String description = descriptionColumn.isPresent()
                ? sheet.cell(row, descriptionColumn.getAsInt()).trim()
                : "";
            for (Tactic tactic : tactics) {
                out.add(new RawCandidate(techniqueId, tactic.getId(), name, description));
            }
        }
    }
}
