package com.rtops.ingestion.parsers;

import com.rtops.domain.Tactic;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits a spreadsheet tactics cell into registry tactics.
 * 
 * Tactics may be combined with commas, slashes, semicolons, "and" or "&amp;".
 * Within a fragment words are matched greedily, longest run first, so titles
 * that contain "and" themselves ("Command and Control") survive even when
 * joined to another tactic by "and". A matched run must end at a conjunction
 * or at the end of the fragment; words up to the next conjunction are dropped
 * otherwise. Tokens outside the registry are dropped.
 */
public final class TacticTokenizer {
    
    private static final Pattern LIST_SEPARATOR = Pattern.compile("[,/;]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String CONJUNCTION = "and";
    
    private TacticTokenizer() {
    }
    
    /**
     * Tokenize a tactics cell
     * 
     * @param cell raw cell text, may be null
     * @return recognized tactics in cell order, without duplicates
     */
    public static List<Tactic> tokenize(String cell) {
        if (cell == null || cell.isBlank()) {
            return List.of();
        }
        
        Set<Tactic> tactics = new LinkedHashSet<>();
        for (String fragment : LIST_SEPARATOR.split(cell)) {
            if (!fragment.isBlank()) {
                matchWords(words(fragment), tactics);
            }
        }
        return new ArrayList<>(tactics);
    }
    
    private static void matchWords(List<String> words, Set<Tactic> out) {
        int i = 0;
        while (i < words.size()) {
            if (CONJUNCTION.equals(words.get(i))) {
                i++;
                continue;
            }
            int matchedEnd = -1;
            for (int end = words.size(); end > i; end--) {
                if (end < words.size() && !CONJUNCTION.equals(words.get(end))) {
                    continue;
                }
                Optional<Tactic> tactic = Tactic.fromId(String.join("-", words.subList(i, end)));
                if (tactic.isPresent()) {
                    out.add(tactic.get());
                    matchedEnd = end;
                    break;
                }
            }
            if (matchedEnd < 0) {
                matchedEnd = i + 1;
                while (matchedEnd < words.size() && !CONJUNCTION.equals(words.get(matchedEnd))) {
                    matchedEnd++;
                }
            }
            i = matchedEnd;
        }
    }
    
    private static List<String> words(String fragment) {
        List<String> words = new ArrayList<>();
        for (String word : toIdentifier(fragment).split("-")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }
    
    /**
     * Convert display text to registry form: "Command &amp; Control" becomes
     * "command-and-control"
     * 
     * @param text display text
     * @return lowercase hyphenated identifier
     */
    static String toIdentifier(String text) {
        String lower = text.trim().toLowerCase(Locale.ROOT).replace("&", " and ");
        return WHITESPACE.matcher(lower.trim()).replaceAll("-");
    }
}
