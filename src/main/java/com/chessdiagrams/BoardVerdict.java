package com.chessdiagrams;

/**
 * Outcome of classifying an image as a chessboard. False positives and negatives are expected.
 */
public final class BoardVerdict {

    private static final BoardVerdict REJECTED = new BoardVerdict(false, 0.0, 0);

    private final boolean chessboard;
    private final double confidence;
    private final int squareContours;

    public BoardVerdict(boolean chessboard, double confidence, int squareContours) {
        this.chessboard = chessboard;
        this.confidence = confidence;
        this.squareContours = squareContours;
    }

    public static BoardVerdict rejected() {
        return REJECTED;
    }

    public boolean isChessboard() {
        return chessboard;
    }

    /** Between 0 and 1. */
    public double getConfidence() {
        return confidence;
    }

    public int getSquareContours() {
        return squareContours;
    }

    @Override
    public String toString() {
        return (chessboard ? "chessboard" : "not a chessboard")
                + String.format(" (confidence %.2f, %d square contours)", confidence, squareContours);
    }
}
