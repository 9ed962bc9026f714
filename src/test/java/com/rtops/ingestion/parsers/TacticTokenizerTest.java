package com.rtops.ingestion.parsers;

import com.rtops.domain.Tactic;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TacticTokenizerTest {

    @Test
    void splitsOnCommasSlashesAndConjunctions() {
        assertThat(TacticTokenizer.tokenize("Initial Access, Execution"))
            .containsExactly(Tactic.INITIAL_ACCESS, Tactic.EXECUTION);
        assertThat(TacticTokenizer.tokenize("Persistence/Privilege Escalation"))
            .containsExactly(Tactic.PERSISTENCE, Tactic.PRIVILEGE_ESCALATION);
        assertThat(TacticTokenizer.tokenize("Discovery and Collection"))
            .containsExactly(Tactic.DISCOVERY, Tactic.COLLECTION);
        assertThat(TacticTokenizer.tokenize("Exfiltration & Impact"))
            .containsExactly(Tactic.EXFILTRATION, Tactic.IMPACT);
    }

    @Test
    void keepsCommandAndControlWhole() {
        assertThat(TacticTokenizer.tokenize("Command and Control"))
            .containsExactly(Tactic.COMMAND_AND_CONTROL);
        assertThat(TacticTokenizer.tokenize("Command & Control, Exfiltration"))
            .containsExactly(Tactic.COMMAND_AND_CONTROL, Tactic.EXFILTRATION);
        assertThat(TacticTokenizer.tokenize("command-and-control"))
            .containsExactly(Tactic.COMMAND_AND_CONTROL);
    }

    @Test
    void matchesCommandAndControlJoinedByConjunction() {
        assertThat(TacticTokenizer.tokenize("Command and Control and Exfiltration"))
            .containsExactly(Tactic.COMMAND_AND_CONTROL, Tactic.EXFILTRATION);
        assertThat(TacticTokenizer.tokenize("Discovery & Command and Control"))
            .containsExactly(Tactic.DISCOVERY, Tactic.COMMAND_AND_CONTROL);
        assertThat(TacticTokenizer.tokenize("Collection and Command & Control and Impact"))
            .containsExactly(Tactic.COLLECTION, Tactic.COMMAND_AND_CONTROL, Tactic.IMPACT);
    }

    @Test
    void dropsPartsWithTrailingUnknownWords() {
        assertThat(TacticTokenizer.tokenize("Defense Evasion Stuff and Execution"))
            .containsExactly(Tactic.EXECUTION);
    }

    @Test
    void dropsUnknownTokensAndDuplicates() {
        assertThat(TacticTokenizer.tokenize("Weaponization, Execution, execution"))
            .containsExactly(Tactic.EXECUTION);
        assertThat(TacticTokenizer.tokenize("Weaponization, Delivery")).isEmpty();
    }

    @Test
    void blankCellYieldsNothing() {
        assertThat(TacticTokenizer.tokenize(null)).isEmpty();
        assertThat(TacticTokenizer.tokenize("   ")).isEmpty();
        assertThat(TacticTokenizer.tokenize(" , / ")).isEmpty();
    }

    @Test
    void toIdentifierHyphenatesDisplayText() {
        assertThat(TacticTokenizer.toIdentifier("  Lateral   Movement ")).isEqualTo("lateral-movement");
        assertThat(TacticTokenizer.toIdentifier("Command & Control")).isEqualTo("command-and-control");
    }
}
