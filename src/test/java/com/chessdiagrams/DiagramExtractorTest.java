package com.chessdiagrams;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import nu.pattern.OpenCV;

class DiagramExtractorTest {

    private static final String FEN = "8/8/8/8/8/8/8/K6k w - - 0 1";

    private final FakeBoardClassifier classifier = new FakeBoardClassifier();
    private final RecognitionClientTest.ScriptedService service = new RecognitionClientTest.ScriptedService();
    private final RecognitionClient recognition =
            new RecognitionClient(service, 0, 0, new Random(7), millis -> { });

    @BeforeAll
    static void loadOpenCv() {
        OpenCV.loadLocally();
    }

    private Mat board() {
        return classifier.accept(new Mat(16, 16, CvType.CV_8UC3, new Scalar(128, 128, 128)));
    }

    private FakeDocumentSource book() {
        return new FakeDocumentSource()
                .newPage()
                .text("1. Alekhine – Nimzowitsch, New York 1927").image(board()).text("8.f3! White wins a piece.")
                .text("2. Tal - Botvinnik, Moscow 1960")
                .newPage()
                .image(board()).text("22...Bxh2+! 23.Kxh2 Qh4+")
                .newPage()
                .text("3. Kasparov - Topalov, Wijk aan Zee 1999")
                .image(new Mat(16, 16, CvType.CV_8UC3, new Scalar(0, 0, 0)))
                .image(board()).text("24.Rxd4!! Kxd4 25.Re4+");
    }

    @Test
    void testExtractsRecordsWithRecognition() throws IOException {
        service.failOn.add(2);
        DiagramExtractor extractor = new DiagramExtractor(new ExtractorConfig(), classifier, recognition,
                ImageStore.disabled());

        ExtractionResult<Diagram> result = extractor.extract(book());
        List<Diagram> diagrams = result.getRecords();

        assertThat(diagrams).hasSize(3);
        Diagram first = diagrams.get(0);
        assertThat(first.getPage()).isEqualTo(1);
        assertThat(first.getDiagramNumber()).isEqualTo("1");
        assertThat(first.getPlayers()).isEqualTo("Alekhine - Nimzowitsch");
        assertThat(first.getYear()).isEqualTo("1927");
        assertThat(first.getSolutionMoveNumber()).isEqualTo(8);
        assertThat(first.getSolutionMoveClean()).isEqualTo("f3");
        assertThat(first.getSolutionMoveAnnotated()).isEqualTo("f3!");
        assertThat(first.getTurnFromText()).isEqualTo(Side.WHITE);
        assertThat(first.getFen()).isEqualTo(FEN);
        assertThat(first.getTurnFromApi()).isEqualTo(Side.WHITE);
        assertThat(first.getChessboardConfidence()).isEqualTo(0.9);
        assertThat(first.getImagePath()).isNull();

        Diagram second = diagrams.get(1);
        assertThat(second.getDiagramNumber()).isEqualTo("2");
        assertThat(second.getPage()).isEqualTo(1);
        assertThat(second.getHeaderPage()).isEqualTo(1);
        assertThat(second.getImagePage()).isEqualTo(2);
        assertThat(second.getSolutionPage()).isEqualTo(2);
        assertThat(second.getTurnFromText()).isEqualTo(Side.BLACK);
        assertThat(second.getFen()).isNull();
        assertThat(second.getTurnFromApi()).isNull();

        assertThat(diagrams.get(2).getDiagramNumber()).isEqualTo("3");
        assertThat(diagrams.get(2).getSolutionMoveClean()).isEqualTo("Rxd4");
        assertThat(diagrams.get(2).getFen()).isEqualTo(FEN);

        ExtractionSummary summary = result.getSummary();
        assertThat(summary.getRecords()).isEqualTo(3);
        assertThat(summary.getCrossPageDiagrams()).isEqualTo(1);
        assertThat(summary.getRejectedImages()).isEqualTo(1);
        assertThat(summary.getUnmatchedHeaders()).isZero();
        assertThat(summary.getRecognitionCalls()).isEqualTo(3);
        assertThat(summary.getRecognitionFailures()).isEqualTo(1);
        assertThat(summary.getWhiteToMove()).isEqualTo(2);
        assertThat(summary.getBlackToMove()).isEqualTo(1);
    }

    @Test
    void testWithoutRecognitionPositionsStayEmpty() throws IOException {
        DiagramExtractor extractor = new DiagramExtractor(new ExtractorConfig(), classifier, null,
                ImageStore.disabled());

        ExtractionResult<Diagram> result = extractor.extract(book());

        assertThat(result.getRecords()).hasSize(3);
        assertThat(result.getRecords()).allSatisfy(diagram -> assertThat(diagram.getFen()).isNull());
        assertThat(result.getSummary().getRecognitionCalls()).isZero();
        assertThat(service.calls).isZero();
    }

    @Test
    void testUnreadablePageDoesNotStopExtraction() throws IOException {
        FakeDocumentSource source = new FakeDocumentSource()
                .newPage()
                .text("1. Alekhine – Nimzowitsch, New York 1927").image(board()).text("8.f3! White wins a piece.")
                .newPage()
                .text("2. Tal - Botvinnik, Moscow 1960").image(board()).text("22...Bxh2+! 23.Kxh2 Qh4+")
                .newPage()
                .text("3. Kasparov - Topalov, Wijk aan Zee 1999").image(board()).text("24.Rxd4!! Kxd4 25.Re4+")
                .fail(2, new IOException("damaged content stream"));
        DiagramExtractor extractor = new DiagramExtractor(new ExtractorConfig(), classifier, null,
                ImageStore.disabled());

        ExtractionResult<Diagram> result = extractor.extract(source);

        assertThat(result.getRecords()).extracting(Diagram::getDiagramNumber).containsExactly("1", "3");
        assertThat(result.getSummary().getSkippedPages()).isEqualTo(1);
    }

    @Test
    void testRepeatedHeaderIsCountedOnce() throws IOException {
        FakeDocumentSource source = new FakeDocumentSource()
                .newPage()
                .text("1. Alekhine – Nimzowitsch, New York 1927").image(board()).text("8.f3! White wins a piece.")
                .newPage()
                .text("1. Alekhine – Nimzowitsch, New York 1927").image(board()).text("8.f3! White wins a piece.");
        DiagramExtractor extractor = new DiagramExtractor(new ExtractorConfig(), classifier, null,
                ImageStore.disabled());

        ExtractionResult<Diagram> result = extractor.extract(source);

        assertThat(result.getRecords()).extracting(Diagram::getDiagramNumber).containsExactly("1");
        assertThat(result.getSummary().getRepeatedHeaders()).isEqualTo(1);
    }

    @Test
    void testPageRangeAndLimit() throws IOException {
        ExtractorConfig config = new ExtractorConfig();
        config.pageStart = 2;
        DiagramExtractor fromPageTwo = new DiagramExtractor(config, classifier, null, ImageStore.disabled());

        List<Diagram> diagrams = fromPageTwo.extract(book()).getRecords();

        // the header of diagram 2 lies on page 1, so its board has no anchor
        assertThat(diagrams).extracting(Diagram::getDiagramNumber).containsExactly("3");

        ExtractorConfig limited = new ExtractorConfig();
        limited.maxDiagrams = 1;
        List<Diagram> one = new DiagramExtractor(limited, classifier, null, ImageStore.disabled())
                .extract(book()).getRecords();
        assertThat(one).extracting(Diagram::getDiagramNumber).containsExactly("1");
    }

    @Test
    void testSavesBoardImages(@TempDir Path out) throws IOException {
        ImageStore store = new ImageStore(out, true, true, false);
        ExtractorConfig config = new ExtractorConfig();
        config.saveNonChessboardImages = true;

        List<Diagram> diagrams = new DiagramExtractor(config, classifier, null, store).extract(book()).getRecords();

        assertThat(Path.of(diagrams.get(0).getImagePath()))
                .isEqualTo(out.resolve(ImageStore.CHESSBOARDS).resolve("diagram_001_page_1.png"));
        assertThat(out.resolve(ImageStore.CHESSBOARDS).resolve("diagram_002_page_2.png")).exists();
        assertThat(out.resolve(ImageStore.CHESSBOARDS).resolve("diagram_003_page_3.png")).exists();
        try (var files = Files.list(out.resolve(ImageStore.NON_CHESSBOARDS))) {
            assertThat(files.count()).isEqualTo(1);
        }
    }
}
