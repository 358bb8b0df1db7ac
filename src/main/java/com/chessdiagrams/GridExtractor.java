package com.chessdiagrams;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the pipeline for books that print their diagrams in a fixed grid with
 * bubble markers above every board.
 */
public class GridExtractor {

    private static final Logger log = LoggerFactory.getLogger(GridExtractor.class);

    private final ExtractorConfig config;
    private final GridSectionDivider divider;
    private final BubbleAnalyzer bubbleAnalyzer;
    private final BoardClassifier classifier;
    private final RecognitionClient recognition;
    private final ImageStore imageStore;

    public GridExtractor(ExtractorConfig config) {
        this(config, new ChessboardValidator(config.chessboard),
                new TesseractDigitRecognizer(config.tessDataPath, config.ocrLanguage, config.bubbles.ocrConfidenceFloor),
                DiagramExtractor.recognitionClient(config), ImageStore.from(config));
    }

    /**
     * @param digits      null to skip OCR
     * @param recognition null to skip position recognition
     */
    public GridExtractor(ExtractorConfig config, BoardClassifier classifier, DigitRecognizer digits,
                         RecognitionClient recognition, ImageStore imageStore) {
        config.validate();
        this.config = config;
        this.divider = new GridSectionDivider(config.grid.rows, config.grid.columns);
        this.bubbleAnalyzer = new BubbleAnalyzer(config.bubbles, config.grid.diagramNumberFraction, digits);
        this.classifier = classifier;
        this.recognition = recognition;
        this.imageStore = imageStore;
    }

    public ExtractionResult<GridSection> extract(DocumentSource source) throws IOException {
        int first = config.pageStart == null ? 1 : config.pageStart;
        int last = config.pageEnd == null ? source.getPageCount() : Math.min(config.pageEnd, source.getPageCount());

        ExtractionSummary summary = new ExtractionSummary();
        int callsBefore = recognition == null ? 0 : recognition.getCalls();
        int failuresBefore = recognition == null ? 0 : recognition.getFailures();

        List<GridSection> sections = new ArrayList<>();
        for (int page = first; page <= last; page++) {
            if (config.maxDiagrams != null && summary.chessboardSections >= config.maxDiagrams) {
                log.info("Reached the limit of {} diagrams", config.maxDiagrams);
                break;
            }
            List<GridSection> pageSections;
            try {
                Mat pageImage = source.renderPage(page);
                log.info("Processing grid page {} ({}x{})", page, pageImage.width(), pageImage.height());
                pageSections = analyzePage(pageImage, page);
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping grid page {}: {}", page, e.toString());
                summary.skippedPages++;
                continue;
            }
            for (GridSection section : pageSections) {
                sections.add(section);
                if (section.isChessboard()) {
                    summary.chessboardSections++;
                    summary.countTurn(section.getTurn());
                } else {
                    summary.rejectedImages++;
                }
            }
        }

        summary.records = sections.size();
        if (recognition != null) {
            summary.recognitionCalls = recognition.getCalls() - callsBefore;
            summary.recognitionFailures = recognition.getFailures() - failuresBefore;
        }
        return new ExtractionResult<>(sections, summary);
    }

    public List<GridSection> analyzePage(Mat pageImage, int page) {
        List<GridSection> sections = new ArrayList<>();
        for (GridCell cell : divider.divide(pageImage.width(), pageImage.height())) {
            sections.add(analyzeCell(pageImage, page, cell));
        }
        return sections;
    }

    private GridSection analyzeCell(Mat pageImage, int page, GridCell cell) {
        Rect bounds = cell.getBounds();
        Mat cellImage = pageImage.submat(bounds);

        // 1. Bubble strip on top
        int stripHeight = Math.max(1, (int) (bounds.height * config.grid.bubbleAreaFraction));
        Mat strip = cellImage.submat(0, stripHeight, 0, bounds.width);
        List<Bubble> bubbles = bubbleAnalyzer.analyze(strip, bounds.x, bounds.y);
        String detectedNumber = bubbleAnalyzer.detectDiagramNumber(strip);

        // 2. Board below it
        Mat body = body(cellImage, stripHeight);
        BoardVerdict verdict = body == null ? BoardVerdict.rejected() : classifier.classify(body);

        GridSection section = new GridSection(page, cell, bubbles, verdict, detectedNumber,
                divider.diagramNumber(page, config.grid.firstGridPage, cell));
        section.setImagePath(imageStore.saveSection(cellImage, page, cell.getSectionNumber()));
        if (verdict.isChessboard() && recognition != null) {
            section.applyRecognition(recognition.recognize(body));
        }
        log.debug("{}", section);
        return section;
    }

    private Mat body(Mat cellImage, int stripHeight) {
        int pad = config.grid.bodyPadding;
        int top = stripHeight + pad;
        int bottom = cellImage.rows() - pad;
        int left = pad;
        int right = cellImage.cols() - pad;
        if (bottom <= top || right <= left) {
            return null;
        }
        return cellImage.submat(top, bottom, left, right);
    }
}
