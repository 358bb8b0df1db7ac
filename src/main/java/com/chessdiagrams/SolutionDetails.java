package com.chessdiagrams;

/**
 * Everything the solution parser extracts from one solution block.
 */
public final class SolutionDetails {

    private final int moveNumber;
    private final String dots;
    private final Side turn;
    private final String moveAnnotated;
    private final String moveClean;
    private final String fullMove;
    private final String fullText;

    public SolutionDetails(int moveNumber, String dots, Side turn, String moveAnnotated,
                           String moveClean, String fullMove, String fullText) {
        this.moveNumber = moveNumber;
        this.dots = dots;
        this.turn = turn;
        this.moveAnnotated = moveAnnotated;
        this.moveClean = moveClean;
        this.fullMove = fullMove;
        this.fullText = fullText;
    }

    public int getMoveNumber() {
        return moveNumber;
    }

    public String getDots() {
        return dots;
    }

    public Side getTurn() {
        return turn;
    }

    /** First move with its annotation glyphs, e.g. {@code "f3!"}. */
    public String getMoveAnnotated() {
        return moveAnnotated;
    }

    /** First move without annotation glyphs, e.g. {@code "f3"}. */
    public String getMoveClean() {
        return moveClean;
    }

    /** Move number, dots and move text, cut to the configured length. */
    public String getFullMove() {
        return fullMove;
    }

    /** The solution block text exactly as read from the book. */
    public String getFullText() {
        return fullText;
    }
}
