package com.chessdiagrams;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.opencv.core.Mat;
import org.opencv.core.Rect;

/** In-memory document built page by page. */
class FakeDocumentSource implements DocumentSource {

    private final List<List<PageRegion>> pages = new ArrayList<>();
    private final Map<Integer, Mat> renders = new HashMap<>();
    private final Map<Integer, IOException> failures = new HashMap<>();
    private int nextTop;
    boolean closed;

    FakeDocumentSource newPage() {
        pages.add(new ArrayList<>());
        nextTop = 0;
        return this;
    }

    /** Appends a text region below the previous region of the current page. */
    FakeDocumentSource text(String text) {
        return add(PageRegion.text(new Rect(50, nextTop, 400, 20), text), 20);
    }

    FakeDocumentSource image(Mat image) {
        return add(PageRegion.image(new Rect(50, nextTop, 200, 200), image), 200);
    }

    FakeDocumentSource region(PageRegion region) {
        pages.get(pages.size() - 1).add(region);
        return this;
    }

    /** Reading or rendering the page throws the given error. */
    FakeDocumentSource fail(int page, IOException error) {
        failures.put(page, error);
        return this;
    }

    FakeDocumentSource render(int page, Mat image) {
        renders.put(page, image);
        return this;
    }

    private FakeDocumentSource add(PageRegion region, int height) {
        pages.get(pages.size() - 1).add(region);
        nextTop += height + 10;
        return this;
    }

    @Override
    public int getPageCount() {
        return pages.size();
    }

    @Override
    public List<PageRegion> getRegions(int page) throws IOException {
        if (failures.containsKey(page)) {
            throw failures.get(page);
        }
        return pages.get(page - 1);
    }

    @Override
    public Mat renderPage(int page) throws IOException {
        if (failures.containsKey(page)) {
            throw failures.get(page);
        }
        Mat image = renders.get(page);
        if (image == null) {
            throw new IOException("No rendering for page " + page);
        }
        return image;
    }

    @Override
    public void close() {
        closed = true;
    }
}
