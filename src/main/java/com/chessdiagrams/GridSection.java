package com.chessdiagrams;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Analysis of one grid cell.
 */
public class GridSection {

    private final int page;
    private final int sectionNumber;
    private final int row;
    private final int col;
    private final BoundingBox bbox;
    private final List<Bubble> bubbles;
    private final boolean isChessboard;
    private final double chessboardConfidence;
    private final String detectedDiagramNumber;
    private final int calculatedDiagramNumber;

    private String fen;
    private Side turn;
    private String imagePath;

    public GridSection(int page, GridCell cell, List<Bubble> bubbles, BoardVerdict verdict,
                       String detectedDiagramNumber, int calculatedDiagramNumber) {
        this.page = page;
        this.sectionNumber = cell.getSectionNumber();
        this.row = cell.getRow();
        this.col = cell.getCol();
        this.bbox = BoundingBox.of(cell.getBounds());
        this.bubbles = Collections.unmodifiableList(new ArrayList<>(bubbles));
        this.isChessboard = verdict.isChessboard();
        this.chessboardConfidence = verdict.getConfidence();
        this.detectedDiagramNumber = detectedDiagramNumber;
        this.calculatedDiagramNumber = calculatedDiagramNumber;
    }

    public void applyRecognition(RecognitionResult result) {
        if (result != null) {
            this.fen = result.getFen();
            this.turn = result.getSideToMove();
        }
    }

    public void setImagePath(String imagePath) {
        this.imagePath = imagePath;
    }

    public int getPage() {
        return page;
    }

    public int getSectionNumber() {
        return sectionNumber;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public BoundingBox getBbox() {
        return bbox;
    }

    public List<Bubble> getBubbles() {
        return bubbles;
    }

    public boolean isChessboard() {
        return isChessboard;
    }

    public double getChessboardConfidence() {
        return chessboardConfidence;
    }

    public String getDetectedDiagramNumber() {
        return detectedDiagramNumber;
    }

    public int getCalculatedDiagramNumber() {
        return calculatedDiagramNumber;
    }

    public String getFen() {
        return fen;
    }

    public Side getTurn() {
        return turn;
    }

    public String getImagePath() {
        return imagePath;
    }

    @Override
    public String toString() {
        return "Page " + page + " section " + sectionNumber + ": diagram " + calculatedDiagramNumber
                + (isChessboard ? ", chessboard" : "") + ", bubbles " + bubbles;
    }
}
