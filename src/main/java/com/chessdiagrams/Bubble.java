package com.chessdiagrams;

/**
 * A small circular marker printed above a grid diagram.
 */
public final class Bubble {

    private final Integer digit;
    private final FillStyle fillStyle;
    private final BoundingBox bbox;

    public Bubble(Integer digit, FillStyle fillStyle, BoundingBox bbox) {
        this.digit = digit;
        this.fillStyle = fillStyle;
        this.bbox = bbox;
    }

    /** Null when the digit could not be read. */
    public Integer getDigit() {
        return digit;
    }

    public FillStyle getFillStyle() {
        return fillStyle;
    }

    public BoundingBox getBbox() {
        return bbox;
    }

    @Override
    public String toString() {
        return (digit == null ? "?" : digit) + "_" + fillStyle.name().toLowerCase();
    }
}
