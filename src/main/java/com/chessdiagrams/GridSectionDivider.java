package com.chessdiagrams;

import java.util.ArrayList;
import java.util.List;

import org.opencv.core.Rect;

/**
 * Cuts a page into a fixed rows x columns grid. Boundaries fall on
 * {@code k * width / columns} and {@code k * height / rows}, so the cells tile
 * the page without gaps or overlap.
 */
public class GridSectionDivider {

    private final int rows;
    private final int columns;

    public GridSectionDivider(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new ConfigurationException("Grid must have positive dimensions: " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
    }

    public List<GridCell> divide(int width, int height) {
        List<GridCell> cells = new ArrayList<>(rows * columns);
        int section = 1;
        for (int row = 0; row < rows; row++) {
            int top = row * height / rows;
            int bottom = (row + 1) * height / rows;
            for (int col = 0; col < columns; col++) {
                int left = col * width / columns;
                int right = (col + 1) * width / columns;
                cells.add(new GridCell(row, col, section++, new Rect(left, top, right - left, bottom - top)));
            }
        }
        return cells;
    }

    /** Position-derived diagram number: column-major within the page, pages in sequence. */
    public int diagramNumber(int page, int firstGridPage, GridCell cell) {
        int base = (page - firstGridPage) * rows * columns;
        return base + cell.getCol() * rows + cell.getRow() + 1;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }
}
