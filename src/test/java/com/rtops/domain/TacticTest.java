package com.rtops.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TacticTest {

    @Test
    void registryHasFourteenTacticsInKillChainOrder() {
        assertThat(Tactic.values()).hasSize(14);
        assertThat(Tactic.values()[0]).isEqualTo(Tactic.RECONNAISSANCE);
        assertThat(Tactic.values()[2]).isEqualTo(Tactic.INITIAL_ACCESS);
        assertThat(Tactic.values()[13]).isEqualTo(Tactic.IMPACT);
        assertThat(Tactic.COMMAND_AND_CONTROL.ordinal()).isLessThan(Tactic.EXFILTRATION.ordinal());
    }

    @Test
    void fromIdAcceptsRegistryIdentifiers() {
        assertThat(Tactic.fromId("initial-access")).contains(Tactic.INITIAL_ACCESS);
        assertThat(Tactic.fromId(" Execution ")).contains(Tactic.EXECUTION);
        assertThat(Tactic.fromId("command-and-control")).contains(Tactic.COMMAND_AND_CONTROL);
    }

    @Test
    void fromIdRejectsUnknownAndDisplayForms() {
        assertThat(Tactic.fromId("initial access")).isEmpty();
        assertThat(Tactic.fromId("weaponization")).isEmpty();
        assertThat(Tactic.fromId("")).isEmpty();
        assertThat(Tactic.fromId(null)).isEmpty();
        assertThat(Tactic.isKnown("impact")).isTrue();
        assertThat(Tactic.isKnown("mobile-impact")).isFalse();
    }

    @Test
    void titlesAreDisplayForms() {
        assertThat(Tactic.COMMAND_AND_CONTROL.getTitle()).isEqualTo("Command & Control");
        assertThat(Tactic.RESOURCE_DEVELOPMENT.getTitle()).isEqualTo("Resource Development");
        assertThat(Tactic.LATERAL_MOVEMENT.toString()).isEqualTo("lateral-movement");
    }
}
