package com.chessdiagrams;

import java.util.ArrayList;
import java.util.List;

/**
 * Blocks assigned to the roles of one diagram. Any role may be missing.
 */
public final class DiagramCandidate {

    private final Block anchor;
    private final Block header;
    private final Block image;
    private final Block solution;

    public DiagramCandidate(Block anchor, Block header, Block image, Block solution) {
        this.anchor = anchor;
        this.header = header;
        this.image = image;
        this.solution = solution;
    }

    public Block getAnchor() {
        return anchor;
    }

    public Block getHeader() {
        return header;
    }

    public Block getImage() {
        return image;
    }

    public Block getSolution() {
        return solution;
    }

    public boolean hasImage() {
        return image != null;
    }

    /** An image with nothing to tie it to a puzzle. */
    public boolean isNoise() {
        return header == null && solution == null;
    }

    public List<Block> blocks() {
        List<Block> result = new ArrayList<>(3);
        if (header != null) result.add(header);
        if (image != null) result.add(image);
        if (solution != null) result.add(solution);
        result.sort((a, b) -> Integer.compare(a.getGlobalIndex(), b.getGlobalIndex()));
        return result;
    }

    public int firstPage() {
        return blocks().get(0).getPage();
    }

    public boolean spansPages() {
        List<Block> blocks = blocks();
        return blocks.get(0).getPage() != blocks.get(blocks.size() - 1).getPage();
    }

    @Override
    public String toString() {
        return "DiagramCandidate[header=" + header + ", image=" + image + ", solution=" + solution + "]";
    }
}
