package com.chessdiagrams;

import org.opencv.core.Rect;

/**
 * Serializable rectangle in page pixels.
 */
public final class BoundingBox {

    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public BoundingBox(int x, int y, int width, int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public static BoundingBox of(Rect rect) {
        return new BoundingBox(rect.x, rect.y, rect.width, rect.height);
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + width + "x" + height + ")";
    }
}
