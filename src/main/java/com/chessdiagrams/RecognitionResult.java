package com.chessdiagrams;

/**
 * Position read from a board image.
 */
public final class RecognitionResult {

    private final String fen;
    private final Side sideToMove;

    public RecognitionResult(String fen, Side sideToMove) {
        this.fen = fen;
        this.sideToMove = sideToMove;
    }

    public String getFen() {
        return fen;
    }

    /** May be null when the service does not say. */
    public Side getSideToMove() {
        return sideToMove;
    }

    @Override
    public String toString() {
        return fen + (sideToMove == null ? "" : " (" + sideToMove.label() + " to move)");
    }
}
