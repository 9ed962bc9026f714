package com.rtops.ingestion.parsers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtops.ingestion.source.ParsedSource;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FlatListParser
 */
class FlatListParserTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final FlatListParser parser = new FlatListParser();

    private ParsedSource.FlatList list(String json) throws Exception {
        return (ParsedSource.FlatList) ParsedSource.flatList(Path.of("layer.json"), mapper.readTree(json));
    }

    @Test
    void testEntryUsesTechniqueIdAsPlaceholderName() throws Exception {
        List<RawCandidate> candidates = parser.parse(list("""
            [{"techniqueID": "T1059", "tactic": "execution"}]
            """));

        assertThat(candidates).containsExactly(new RawCandidate("T1059", "execution", "T1059", ""));
    }

    @Test
    void testEntriesMissingIdOrTacticAreSkipped() throws Exception {
        List<RawCandidate> candidates = parser.parse(list("""
            [
              {"techniqueID": "T1059"},
              {"tactic": "execution"},
              {"techniqueID": "", "tactic": "execution"},
              {"techniqueID": "T1021", "tactic": null},
              {"techniqueID": "T1003", "tactic": "Credential-Access"}
            ]
            """));

        assertThat(candidates).containsExactly(new RawCandidate("T1003", "credential-access", "T1003", ""));
    }

    @Test
    void testTacticIsLowercasedButNotValidated() throws Exception {
        List<RawCandidate> candidates = parser.parse(list("""
            [{"techniqueID": "T1059", "tactic": "Weaponization"}]
            """));

        assertThat(candidates).extracting(RawCandidate::getTacticId).containsExactly("weaponization");
    }
}
