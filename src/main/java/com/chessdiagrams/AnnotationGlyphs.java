package com.chessdiagrams;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fixed table of chess annotation glyphs removed from a move to obtain its clean form.
 * Check and mate signs, captures, promotions and castling hyphens are notation, not annotation,
 * and are never removed.
 */
public final class AnnotationGlyphs {

    private static final Set<Integer> GLYPHS;

    static {
        Set<Integer> glyphs = new LinkedHashSet<>();
        // move evaluation
        add(glyphs, "!?");
        // position evaluation
        add(glyphs, "±∓∞⩲⩱⯹");
        // strategic and directional marks
        add(glyphs, "↑↓→←↗↘↙↖⇄⇆⟳↻");
        // special annotation marks
        add(glyphs, "□○△▲▼⊕⊖⊗⊙⌓⌚⨀⨁∆Δ†‡≠≡⇔");
        GLYPHS = Collections.unmodifiableSet(glyphs);
    }

    private AnnotationGlyphs() {
    }

    private static void add(Set<Integer> glyphs, String chars) {
        chars.codePoints().forEach(glyphs::add);
    }

    public static boolean isGlyph(int codePoint) {
        return GLYPHS.contains(codePoint);
    }

    public static Set<Integer> codePoints() {
        return GLYPHS;
    }

    public static String strip(String move) {
        if (move == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(move.length());
        move.codePoints()
                .filter(cp -> !isGlyph(cp))
                .forEach(sb::appendCodePoint);
        return sb.toString();
    }
}
