package com.chessdiagrams;

/**
 * Reads diagram number, players and year from a header block such as
 * {@code "27. Alekhine – Nimzowitsch, New York 1927"}.
 */
public class HeaderParser {

    private final BlockPattern pattern;

    public HeaderParser(BlockPattern pattern) {
        this.pattern = pattern;
    }

    public boolean isHeader(String text) {
        return text != null && pattern.matches(TextNormalizer.normalize(text));
    }

    /**
     * @return the parsed header, or null when the text is not a header
     */
    public HeaderInfo parse(String text) {
        if (text == null) {
            return null;
        }
        BlockPattern.Match match = pattern.match(TextNormalizer.normalize(text));
        if (match == null) {
            return null;
        }
        String white = trimToNull(match.get("player1"));
        String black = trimToNull(match.get("player2"));
        String players = null;
        if (white != null && black != null) {
            players = white + " - " + black;
        } else if (white != null) {
            players = white;
        } else if (black != null) {
            players = black;
        }
        return new HeaderInfo(trimToNull(match.get("diagramNumber")), players, trimToNull(match.get("year")));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
