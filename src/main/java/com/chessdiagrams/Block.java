package com.chessdiagrams;

import org.opencv.core.Mat;
import org.opencv.core.Rect;

/**
 * A text or image region placed in the document-wide block stream.
 * {@code globalIndex} is the only distance used when correlating blocks.
 */
public final class Block {

    private final int page;
    private final int index;
    private final int globalIndex;
    private final BlockKind kind;
    private final String text;
    private final Mat image;
    private final Rect bounds;

    public Block(int page, int index, int globalIndex, PageRegion region) {
        this.page = page;
        this.index = index;
        this.globalIndex = globalIndex;
        this.kind = region.getKind();
        this.text = region.getText();
        this.image = region.getImage();
        this.bounds = region.getBounds() == null ? new Rect() : region.getBounds().clone();
    }

    public int getPage() {
        return page;
    }

    /** Position of the block on its page, 0-based. */
    public int getIndex() {
        return index;
    }

    public int getGlobalIndex() {
        return globalIndex;
    }

    public BlockKind getKind() {
        return kind;
    }

    public boolean isText() {
        return kind == BlockKind.TEXT;
    }

    public boolean isImage() {
        return kind == BlockKind.IMAGE;
    }

    public String getText() {
        return text;
    }

    public Mat getImage() {
        return image;
    }

    public Rect getBounds() {
        return bounds.clone();
    }

    public int distanceTo(Block other) {
        return Math.abs(globalIndex - other.globalIndex);
    }

    @Override
    public String toString() {
        return "Block#" + globalIndex + "[page " + page + ", " + kind + "]";
    }
}
