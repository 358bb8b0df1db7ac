package com.chessdiagrams;

import org.opencv.core.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Flattens the pages of a document into one ordered block stream.
 */
public class BlockStreamBuilder {

    private static final Logger log = LoggerFactory.getLogger(BlockStreamBuilder.class);

    private static final Comparator<PageRegion> READING_ORDER = Comparator
            .comparingInt((PageRegion r) -> top(r))
            .thenComparingInt(BlockStreamBuilder::left);

    private final Integer pageStart;
    private final Integer pageEnd;
    private int skippedPages;

    public BlockStreamBuilder() {
        this(null, null);
    }

    /**
     * @param pageStart first page to read (1-based, inclusive), or null for the first page
     * @param pageEnd   last page to read (inclusive), or null for the last page
     */
    public BlockStreamBuilder(Integer pageStart, Integer pageEnd) {
        this.pageStart = pageStart;
        this.pageEnd = pageEnd;
    }

    public List<Block> build(DocumentSource source) throws IOException {
        int first = pageStart == null ? 1 : Math.max(1, pageStart);
        int last = pageEnd == null ? source.getPageCount() : Math.min(pageEnd, source.getPageCount());

        List<Block> blocks = new ArrayList<>();
        skippedPages = 0;
        for (int page = first; page <= last; page++) {
            List<PageRegion> regions;
            try {
                regions = new ArrayList<>(source.getRegions(page));
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable page {}: {}", page, e.toString());
                skippedPages++;
                continue;
            }
            // stable sort, so regions on the same line keep their native order
            regions.sort(READING_ORDER);

            int index = 0;
            for (PageRegion region : regions) {
                if (region.getKind() == BlockKind.TEXT
                        && (region.getText() == null || region.getText().trim().isEmpty())) {
                    continue;
                }
                blocks.add(new Block(page, index++, blocks.size(), region));
            }
            if (index == 0) {
                log.debug("Page {} has no usable regions", page);
            }
        }

        log.info("Built block stream: {} blocks from pages {} to {}", blocks.size(), first, last);
        return blocks;
    }

    /** Pages of the last {@link #build} that failed to read. */
    public int getSkippedPages() {
        return skippedPages;
    }

    private static int top(PageRegion region) {
        Rect bounds = region.getBounds();
        return bounds == null ? 0 : bounds.y;
    }

    private static int left(PageRegion region) {
        Rect bounds = region.getBounds();
        return bounds == null ? 0 : bounds.x;
    }
}
