package com.chessdiagrams;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Replaces typographic characters found in digitized books with their plain notation equivalents.
 * Annotation glyphs are left alone; see {@link AnnotationGlyphs}.
 */
public final class TextNormalizer {

    private static final Map<String, String> REPLACEMENTS = new LinkedHashMap<>();

    static {
        // figurine notation
        REPLACEMENTS.put("♔", "K");
        REPLACEMENTS.put("♕", "Q");
        REPLACEMENTS.put("♖", "R");
        REPLACEMENTS.put("♗", "B");
        REPLACEMENTS.put("♘", "N");
        REPLACEMENTS.put("♙", "");
        REPLACEMENTS.put("♚", "K");
        REPLACEMENTS.put("♛", "Q");
        REPLACEMENTS.put("♜", "R");
        REPLACEMENTS.put("♝", "B");
        REPLACEMENTS.put("♞", "N");
        REPLACEMENTS.put("♟", "");

        REPLACEMENTS.put("…", "...");
        REPLACEMENTS.put("–", "-");
        REPLACEMENTS.put("—", "-");
        REPLACEMENTS.put("−", "-");
        REPLACEMENTS.put("“", "\"");
        REPLACEMENTS.put("”", "\"");
        REPLACEMENTS.put("‘", "'");
        REPLACEMENTS.put("’", "'");
        REPLACEMENTS.put(" ", " ");
        REPLACEMENTS.put("½", "1/2");
    }

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return null;
        }
        String result = text;
        for (Map.Entry<String, String> e : REPLACEMENTS.entrySet()) {
            result = result.replace(e.getKey(), e.getValue());
        }
        return result.trim();
    }

    /**
     * Collapses line breaks, tabs and runs of spaces into single spaces.
     */
    public static String singleLine(String text) {
        if (text == null) {
            return null;
        }
        return text.replaceAll("\\s+", " ").trim();
    }
}
