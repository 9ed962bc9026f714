package com.rtops.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Registry of the ATT&amp;CK Enterprise tactics.
 * 
 * Declaration order is the kill-chain order used for every grouped view of the
 * catalog; it is intentionally not alphabetical. The identifier is the lowercase
 * hyphenated form stored in the catalog, the title is the display form.
 */
public enum Tactic {
    
    RECONNAISSANCE("reconnaissance", "Reconnaissance"),
    RESOURCE_DEVELOPMENT("resource-development", "Resource Development"),
    INITIAL_ACCESS("initial-access", "Initial Access"),
    EXECUTION("execution", "Execution"),
    PERSISTENCE("persistence", "Persistence"),
    PRIVILEGE_ESCALATION("privilege-escalation", "Privilege Escalation"),
    DEFENSE_EVASION("defense-evasion", "Defense Evasion"),
    CREDENTIAL_ACCESS("credential-access", "Credential Access"),
    DISCOVERY("discovery", "Discovery"),
    LATERAL_MOVEMENT("lateral-movement", "Lateral Movement"),
    COLLECTION("collection", "Collection"),
    COMMAND_AND_CONTROL("command-and-control", "Command & Control"),
    EXFILTRATION("exfiltration", "Exfiltration"),
    IMPACT("impact", "Impact");
    
    private final String id;
    private final String title;
    
    Tactic(String id, String title) {
        this.id = id;
        this.title = title;
    }
    
    /**
     * Get the catalog identifier of the tactic
     * 
     * @return lowercase hyphenated identifier, e.g. "initial-access"
     */
    @JsonValue
    public String getId() {
        return id;
    }
    
    /**
     * Get the display title of the tactic
     * 
     * @return title, e.g. "Initial Access"
     */
    public String getTitle() {
        return title;
    }
    
    /**
     * Look up a tactic by its catalog identifier.
     * 
     * The lookup is exact apart from surrounding whitespace and case; no other
     * normalization is applied here.
     * 
     * @param id candidate identifier
     * @return the tactic, or empty if the identifier is not in the registry
     */
    public static Optional<Tactic> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String key = id.trim().toLowerCase(Locale.ROOT);
        for (Tactic tactic : values()) {
            if (tactic.id.equals(key)) {
                return Optional.of(tactic);
            }
        }
        return Optional.empty();
    }
    
    /**
     * Check whether an identifier belongs to the registry
     * 
     * @param id candidate identifier
     * @return true if {@link #fromId(String)} would find a tactic
     */
    public static boolean isKnown(String id) {
        return fromId(id).isPresent();
    }
    
    @Override
    public String toString() {
        return id;
    }
}
