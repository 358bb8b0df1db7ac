package com.chessdiagrams;

import org.opencv.core.Rect;

/**
 * One cell of a page grid. Section numbers run row-major from 1.
 */
public final class GridCell {

    private final int row;
    private final int col;
    private final int sectionNumber;
    private final Rect bounds;

    public GridCell(int row, int col, int sectionNumber, Rect bounds) {
        this.row = row;
        this.col = col;
        this.sectionNumber = sectionNumber;
        this.bounds = bounds;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public int getSectionNumber() {
        return sectionNumber;
    }

    public Rect getBounds() {
        return bounds.clone();
    }

    @Override
    public String toString() {
        return "Section " + sectionNumber + " [row " + row + ", col " + col + ", " + bounds + "]";
    }
}
