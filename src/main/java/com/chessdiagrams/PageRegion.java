package com.chessdiagrams;

import org.opencv.core.Mat;
import org.opencv.core.Rect;

/**
 * One text or image region of a page as delivered by a {@link DocumentSource}.
 * Regions of one page may arrive in any order.
 */
public class PageRegion {

    private final BlockKind kind;
    private final Rect bounds;
    private final String text;
    private final Mat image;

    private PageRegion(BlockKind kind, Rect bounds, String text, Mat image) {
        this.kind = kind;
        this.bounds = bounds;
        this.text = text;
        this.image = image;
    }

    public static PageRegion text(Rect bounds, String text) {
        return new PageRegion(BlockKind.TEXT, bounds, text, null);
    }

    public static PageRegion image(Rect bounds, Mat image) {
        return new PageRegion(BlockKind.IMAGE, bounds, null, image);
    }

    public BlockKind getKind() {
        return kind;
    }

    public Rect getBounds() {
        return bounds;
    }

    public String getText() {
        return text;
    }

    public Mat getImage() {
        return image;
    }
}
