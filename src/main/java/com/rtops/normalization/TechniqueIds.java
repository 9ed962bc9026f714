package com.rtops.normalization;

import java.util.regex.Pattern;

/**
 * Technique identifier format: "T" followed by four digits, with an optional
 * three-digit sub-technique suffix ("T1059", "T1059.001").
 */
public final class TechniqueIds {
    
    public static final Pattern PATTERN = Pattern.compile("T\\d{4}(\\.\\d{3})?");
    
    private TechniqueIds() {
    }
    
    public static boolean isValid(String techniqueId) {
        return techniqueId != null && PATTERN.matcher(techniqueId).matches();
    }
}
