package com.chessdiagrams;

/**
 * Parses the first move of a solution block, e.g. {@code "8.f3! A nice set-up..."}
 * or {@code "22...Bxh2+!"}.
 */
public class SolutionParser {

    public static final int DEFAULT_FULL_MOVE_MAX_LENGTH = 80;

    private final BlockPattern pattern;
    private final int fullMoveMaxLength;

    public SolutionParser(BlockPattern pattern) {
        this(pattern, DEFAULT_FULL_MOVE_MAX_LENGTH);
    }

    public SolutionParser(BlockPattern pattern, int fullMoveMaxLength) {
        if (fullMoveMaxLength <= 0) {
            throw new ConfigurationException("fullMoveMaxLength must be positive, got " + fullMoveMaxLength);
        }
        this.pattern = pattern;
        this.fullMoveMaxLength = fullMoveMaxLength;
    }

    public boolean isSolution(String text) {
        return text != null && pattern.matches(TextNormalizer.normalize(text));
    }

    /**
     * @return the parsed solution, or null when the text is not a solution
     */
    public SolutionDetails parse(String text) {
        if (text == null) {
            return null;
        }
        // 1. Match on the normalized text, keep the original for fullText
        BlockPattern.Match match = pattern.match(TextNormalizer.normalize(text));
        if (match == null) {
            return null;
        }

        String number = match.get("moveNumber");
        String dots = match.get("dots") == null ? "." : match.get("dots").trim();
        String body = match.get("moveBody") == null ? "" : match.get("moveBody").trim();

        int moveNumber;
        try {
            moveNumber = Integer.parseInt(number.trim());
        } catch (NumberFormatException | NullPointerException e) {
            return null;
        }

        // 2. One dot is a white move, "..." a black reply
        Side turn = dots.length() == 1 ? Side.WHITE : Side.BLACK;

        // 3. First token keeps its annotations
        String[] tokens = body.split("\\s+");
        String annotated = tokens.length > 0 ? tokens[0] : "";

        // 4. Clean move
        String clean = AnnotationGlyphs.strip(annotated);

        // 5. Bounded full move for display
        String fullMove = TextNormalizer.singleLine(moveNumber + dots + " " + body);
        if (fullMove.length() > fullMoveMaxLength) {
            fullMove = fullMove.substring(0, fullMoveMaxLength);
        }

        return new SolutionDetails(moveNumber, dots, turn, annotated, clean, fullMove, text);
    }
}
