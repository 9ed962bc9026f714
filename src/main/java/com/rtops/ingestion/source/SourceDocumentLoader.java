package com.rtops.ingestion.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtops.ingestion.parsers.ParseException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads source files whole and detects their document shape.
 * 
 * JSON files become a {@link ParsedSource.Bundle} when they carry a top-level
 * "objects" array and a {@link ParsedSource.FlatList} when they carry a
 * top-level "techniques" array or are themselves an array. Workbooks are copied into {@link SheetData}
 * and closed before returning. Any read or shape failure surfaces as a
 * {@link ParseException}.
 */
@Component
public class SourceDocumentLoader {
    
    private static final Logger log = LoggerFactory.getLogger(SourceDocumentLoader.class);
    
    private final ObjectMapper objectMapper;
    
    public SourceDocumentLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    /**
     * Load a JSON document and classify it as bundle or flat list
     * 
     * @param path JSON file
     * @return the loaded source
     * @throws ParseException if the file is unreadable, not JSON, or of neither shape
     */
    public ParsedSource loadJson(Path path) throws ParseException {
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new ParseException("Failed to read JSON document: " + e.getMessage(), e, null, path.toString());
        }
        
        if (root != null && root.isArray()) {
            log.debug("Detected bare technique list {} with {} entries", path, root.size());
            return ParsedSource.flatList(path, root);
        }
        if (root != null && root.isObject()) {
            JsonNode objects = root.get("objects");
            if (objects != null && objects.isArray()) {
                log.debug("Detected bundle document {} with {} objects", path, objects.size());
                return ParsedSource.bundle(path, objects);
            }
            JsonNode techniques = root.get("techniques");
            if (techniques != null && techniques.isArray()) {
                log.debug("Detected technique list {} with {} entries", path, techniques.size());
                return ParsedSource.flatList(path, techniques);
            }
        }
        throw new ParseException("Unrecognized JSON document: expected 'objects' or 'techniques' array",
            null, path.toString());
    }
    
    /**
     * Load every sheet of a workbook
     * 
     * @param path .xlsx or .xls file
     * @return the loaded spreadsheet source
     * @throws ParseException if the workbook cannot be opened
     */
    public ParsedSource loadWorkbook(Path path) throws ParseException {
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            DataFormatter formatter = new DataFormatter();
            List<SheetData> sheets = new ArrayList<>();
            for (Sheet sheet : workbook) {
                sheets.add(readSheet(sheet, formatter));
            }
            log.debug("Loaded workbook {} with {} sheets", path, sheets.size());
            return ParsedSource.spreadsheet(path, sheets);
        } catch (IOException | RuntimeException e) {
            throw new ParseException("Failed to read workbook: " + e.getMessage(), e,
                SourceKind.SPREADSHEET, path.toString());
        }
    }
    
    private SheetData readSheet(Sheet sheet, DataFormatter formatter) {
        List<List<String>> rows = new ArrayList<>();
        for (int r = 0; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            List<String> cells = new ArrayList<>();
            if (row != null) {
                for (int c = 0; c < row.getLastCellNum(); c++) {
                    cells.add(cellText(row.getCell(c), formatter));
                }
            }
            rows.add(cells);
        }
        return new SheetData(sheet.getSheetName(), rows);
    }
    
    /**
     * Cell display text; formulas yield their cached result
     */
    private String cellText(Cell cell, DataFormatter formatter) {
        if (cell == null) {
            return "";
        }
        if (cell.getCellType() != CellType.FORMULA) {
            return formatter.formatCellValue(cell);
        }
        switch (cell.getCachedFormulaResultType()) {
            case STRING:
                return cell.getRichStringCellValue().getString();
            case NUMERIC:
                return NumberToTextConverter.toText(cell.getNumericCellValue());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }
}
