package com.chessdiagrams;

import org.opencv.core.Mat;

import java.io.IOException;
import java.util.List;

/**
 * Pull-based access to the pages of a book. Page numbers are 1-based.
 */
public interface DocumentSource extends AutoCloseable {

    int getPageCount();

    /**
     * Text and image regions of one page, in no particular order.
     */
    List<PageRegion> getRegions(int page) throws IOException;

    /**
     * The whole page rendered as a BGR image, used by grid layouts.
     */
    Mat renderPage(int page) throws IOException;

    @Override
    void close() throws IOException;
}
