package com.rtops.ingestion;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes small .xlsx files for loader and import tests.
 */
public final class WorkbookFixtures {

    private final Map<String, String[][]> sheets = new LinkedHashMap<>();

    public static WorkbookFixtures workbook() {
        return new WorkbookFixtures();
    }

    /**
     * Add a sheet; the first row is the header
     */
    public WorkbookFixtures sheet(String name, String[]... rows) {
        sheets.put(name, rows);
        return this;
    }

    public Path writeTo(Path file) throws IOException {
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            for (Map.Entry<String, String[][]> entry : sheets.entrySet()) {
                Sheet sheet = workbook.createSheet(entry.getKey());
                String[][] rows = entry.getValue();
                for (int r = 0; r < rows.length; r++) {
                    Row row = sheet.createRow(r);
                    for (int c = 0; c < rows[r].length; c++) {
                        if (rows[r][c] != null) {
                            row.createCell(c).setCellValue(rows[r][c]);
                        }
                    }
                }
            }
            workbook.write(out);
        }
        return file;
    }

    public static String[] row(String... cells) {
        return cells;
    }
}
