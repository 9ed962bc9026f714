package com.rtops.ingestion.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtops.ingestion.WorkbookFixtures;
import com.rtops.ingestion.parsers.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.rtops.ingestion.WorkbookFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SourceDocumentLoader
 */
class SourceDocumentLoaderTest {

    @TempDir
    Path tempDir;

    private SourceDocumentLoader loader;

    @BeforeEach
    void setUp() {
        loader = new SourceDocumentLoader(new ObjectMapper());
    }

    private Path write(String name, String content) throws Exception {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    @Test
    void testBundleIsDetectedByObjectsArray() throws Exception {
        Path file = write("bundle.json", """
            {"type": "bundle", "objects": [{"type": "attack-pattern"}, {"type": "malware"}]}
            """);

        ParsedSource source = loader.loadJson(file);

        assertThat(source.getKind()).isEqualTo(SourceKind.BUNDLE);
        assertThat(((ParsedSource.Bundle) source).getObjects().size()).isEqualTo(2);
        assertThat(source.getPath()).isEqualTo(file);
    }

    @Test
    void testLayerIsDetectedByTechniquesArray() throws Exception {
        Path file = write("layer.json", """
            {"name": "layer", "techniques": [{"techniqueID": "T1059", "tactic": "execution"}]}
            """);

        ParsedSource source = loader.loadJson(file);

        assertThat(source.getKind()).isEqualTo(SourceKind.FLAT_LIST);
        assertThat(((ParsedSource.FlatList) source).getTechniques().size()).isEqualTo(1);
    }

    @Test
    void testBareArrayIsAFlatList() throws Exception {
        Path file = write("list.json", "[{\"techniqueID\":\"T1059\",\"tactic\":\"execution\"}]");

        assertThat(loader.loadJson(file).getKind()).isEqualTo(SourceKind.FLAT_LIST);
    }

    @Test
    void testUnsupportedJsonShapeIsRejected() throws Exception {
        Path file = write("other.json", "{\"objects\": {\"not\": \"an array\"}}");

        assertThatThrownBy(() -> loader.loadJson(file))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("Unrecognized JSON document");
    }

    @Test
    void testMalformedJsonIsRejected() throws Exception {
        Path file = write("broken.json", "{\"objects\": [");

        assertThatThrownBy(() -> loader.loadJson(file))
            .isInstanceOf(ParseException.class)
            .satisfies(e -> assertThat(((ParseException) e).getSourcePath()).isEqualTo(file.toString()));
    }

    @Test
    void testWorkbookSheetsAreCopiedCellByCell() throws Exception {
        Path file = WorkbookFixtures.workbook()
            .sheet("README", row("Generated export"))
            .sheet("techniques",
                row("ID", "name", "description", "tactics"),
                row("T1059", "Command and Scripting Interpreter", null, "Execution"))
            .writeTo(tempDir.resolve("attack.xlsx"));

        ParsedSource source = loader.loadWorkbook(file);

        assertThat(source.getKind()).isEqualTo(SourceKind.SPREADSHEET);
        ParsedSource.Spreadsheet spreadsheet = (ParsedSource.Spreadsheet) source;
        assertThat(spreadsheet.getSheets()).extracting(SheetData::getName).containsExactly("README", "techniques");
        SheetData techniques = spreadsheet.getSheets().get(1);
        assertThat(techniques.getHeader()).containsExactly("ID", "name", "description", "tactics");
        assertThat(techniques.cell(1, 1)).isEqualTo("Command and Scripting Interpreter");
        assertThat(techniques.cell(1, 2)).isEmpty();
        assertThat(techniques.cell(1, 3)).isEqualTo("Execution");
        assertThat(techniques.cell(5, 0)).isEmpty();
    }

    @Test
    void testCorruptWorkbookIsRejected() throws Exception {
        Path file = write("corrupt.xlsx", "this is not a zip archive");

        assertThatThrownBy(() -> loader.loadWorkbook(file))
            .isInstanceOf(ParseException.class)
            .satisfies(e -> assertThat(((ParseException) e).getSourceKind()).isEqualTo(SourceKind.SPREADSHEET));
    }
}
