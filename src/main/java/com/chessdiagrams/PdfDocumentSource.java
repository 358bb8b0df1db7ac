package com.chessdiagrams;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.DrawObject;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.state.Concatenate;
import org.apache.pdfbox.contentstream.operator.state.Restore;
import org.apache.pdfbox.contentstream.operator.state.Save;
import org.apache.pdfbox.contentstream.operator.state.SetGraphicsStateParameters;
import org.apache.pdfbox.contentstream.operator.state.SetMatrix;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.apache.pdfbox.util.Matrix;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a PDF with PDFBox. Text comes back as paragraph blocks built from the
 * positioned lines of a page; images are located where the content stream draws
 * them. Coordinates are PDF points measured from the top-left corner.
 */
public class PdfDocumentSource implements DocumentSource {

    private static final Logger log = LoggerFactory.getLogger(PdfDocumentSource.class);

    // a vertical gap above this many line heights starts a new paragraph
    private static final float PARAGRAPH_GAP = 0.8f;

    private final PDDocument document;
    private final PDFRenderer renderer;
    private final int renderDpi;
    private final String name;

    public PdfDocumentSource(Path pdf, int renderDpi) throws IOException {
        File file = pdf.toFile();
        this.document = Loader.loadPDF(file);
        this.renderer = new PDFRenderer(document);
        this.renderDpi = renderDpi;
        this.name = file.getName();
        log.info("Opened {} ({} pages)", name, document.getNumberOfPages());
    }

    @Override
    public int getPageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public List<PageRegion> getRegions(int page) throws IOException {
        checkPage(page);
        List<PageRegion> regions = new ArrayList<>();

        LineStripper stripper = new LineStripper();
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        stripper.getText(document);
        regions.addAll(groupLines(stripper.lines));

        ImageLocator locator = new ImageLocator(page);
        locator.processPage(document.getPage(page - 1));
        regions.addAll(locator.regions);

        log.debug("Page {}: {} text blocks, {} images", page, regions.size() - locator.regions.size(),
                locator.regions.size());
        return regions;
    }

    @Override
    public Mat renderPage(int page) throws IOException {
        checkPage(page);
        BufferedImage image = renderer.renderImageWithDPI(page - 1, renderDpi, ImageType.RGB);
        return MatConversions.fromBufferedImage(image);
    }

    @Override
    public void close() throws IOException {
        document.close();
    }

    private void checkPage(int page) {
        if (page < 1 || page > getPageCount()) {
            throw new IllegalArgumentException("Page " + page + " outside 1.." + getPageCount() + " of " + name);
        }
    }

    /** One line of text with its extent. */
    static class TextLine {
        final float left;
        final float top;
        final float bottom;
        float right;
        final StringBuilder text = new StringBuilder();

        TextLine(float left, float top, float right, float bottom, String text) {
            this.left = left;
            this.top = top;
            this.right = right;
            this.bottom = bottom;
            this.text.append(text);
        }

        float height() {
            return Math.max(1f, bottom - top);
        }
    }

    // Captures every written string with its position
    static class LineStripper extends PDFTextStripper {
        final List<TextLine> lines = new ArrayList<>();

        LineStripper() throws IOException {
            super();
            setSortByPosition(true);
        }

        @Override
        protected void writeString(String string, List<TextPosition> textPositions) throws IOException {
            if (textPositions.isEmpty() || string.trim().isEmpty()) {
                return;
            }
            float left = Float.MAX_VALUE;
            float right = 0;
            float top = Float.MAX_VALUE;
            float bottom = 0;
            for (TextPosition tp : textPositions) {
                left = Math.min(left, tp.getXDirAdj());
                right = Math.max(right, tp.getXDirAdj() + tp.getWidthDirAdj());
                top = Math.min(top, tp.getYDirAdj() - tp.getHeightDir());
                bottom = Math.max(bottom, tp.getYDirAdj());
            }

            TextLine last = lines.isEmpty() ? null : lines.get(lines.size() - 1);
            if (last != null && Math.abs(last.bottom - bottom) < 1f) {
                // same baseline: continuation of the previous line
                last.text.append(' ').append(string);
                last.right = Math.max(last.right, right);
                return;
            }
            lines.add(new TextLine(left, top, right, bottom, string));
        }
    }

    /**
     * Joins consecutive lines into paragraph blocks. A new block starts when the
     * gap to the previous line exceeds {@link #PARAGRAPH_GAP} line heights.
     */
    static List<PageRegion> groupLines(List<TextLine> lines) {
        List<PageRegion> blocks = new ArrayList<>();
        StringBuilder text = null;
        float left = 0, top = 0, right = 0, bottom = 0;
        TextLine previous = null;

        for (TextLine line : lines) {
            boolean newBlock = previous == null
                    || line.top - previous.bottom > PARAGRAPH_GAP * previous.height()
                    || line.top < previous.top;
            if (newBlock) {
                if (text != null) {
                    blocks.add(PageRegion.text(rect(left, top, right, bottom), text.toString()));
                }
                text = new StringBuilder(line.text);
                left = line.left;
                top = line.top;
                right = line.right;
                bottom = line.bottom;
            } else {
                text.append('\n').append(line.text);
                left = Math.min(left, line.left);
                right = Math.max(right, line.right);
                bottom = Math.max(bottom, line.bottom);
            }
            previous = line;
        }
        if (text != null) {
            blocks.add(PageRegion.text(rect(left, top, right, bottom), text.toString()));
        }
        return blocks;
    }

    private static Rect rect(float left, float top, float right, float bottom) {
        return new Rect(Math.round(left), Math.round(top),
                Math.max(1, Math.round(right - left)), Math.max(1, Math.round(bottom - top)));
    }

    // Locates drawn images through the current transformation matrix
    private static class ImageLocator extends PDFStreamEngine {
        final List<PageRegion> regions = new ArrayList<>();
        final int pageNumber;
        float pageHeight;

        ImageLocator(int pageNumber) {
            this.pageNumber = pageNumber;
            addOperator(new Concatenate(this));
            addOperator(new DrawObject(this));
            addOperator(new SetGraphicsStateParameters(this));
            addOperator(new Save(this));
            addOperator(new Restore(this));
            addOperator(new SetMatrix(this));
        }

        @Override
        public void processPage(PDPage page) throws IOException {
            pageHeight = page.getCropBox().getHeight();
            super.processPage(page);
        }

        @Override
        protected void processOperator(Operator operator, List<COSBase> operands) throws IOException {
            if (!OperatorName.DRAW_OBJECT.equals(operator.getName())) {
                super.processOperator(operator, operands);
                return;
            }
            COSName objectName = (COSName) operands.get(0);
            PDXObject xobject = getResources().getXObject(objectName);
            if (xobject instanceof PDImageXObject) {
                Matrix ctm = getGraphicsState().getCurrentTransformationMatrix();
                float width = Math.abs(ctm.getScalingFactorX());
                float height = Math.abs(ctm.getScalingFactorY());
                float x = ctm.getTranslateX();
                float top = pageHeight - ctm.getTranslateY() - height;
                try {
                    Mat image = MatConversions.fromBufferedImage(((PDImageXObject) xobject).getImage());
                    regions.add(PageRegion.image(rect(x, top, x + width, top + height), image));
                } catch (IOException | RuntimeException e) {
                    log.warn("Skipping undecodable image {} on page {}: {}", objectName.getName(), pageNumber,
                            e.getMessage());
                }
            } else if (xobject instanceof PDFormXObject) {
                showForm((PDFormXObject) xobject);
            }
        }
    }
}
