package com.chessdiagrams;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

import nu.pattern.OpenCV;

class GridExtractorTest {

    private static final String FEN = "8/8/8/8/8/8/8/K6k w - - 0 1";

    // anything with dark ink below the strip counts as a board
    private final BoardClassifier inkClassifier = image -> Core.mean(image).val[0] < 220
            ? new BoardVerdict(true, 0.8, 64) : BoardVerdict.rejected();

    @BeforeAll
    static void loadOpenCv() {
        OpenCV.loadLocally();
    }

    private static ExtractorConfig gridConfig() {
        ExtractorConfig config = new ExtractorConfig();
        config.layout = Layout.GRID;
        config.grid.firstGridPage = 18;
        return config;
    }

    /** 600x900 page: 3x2 cells of 300x300, boards in the cells listed. */
    private static Mat page(int... boardCells) {
        Mat page = SyntheticImages.blank(600, 900);
        for (int cell : boardCells) {
            int left = (cell % 2) * 300;
            int top = (cell / 2) * 300;
            Imgproc.rectangle(page, new Point(left + 60, top + 130), new Point(left + 240, top + 280),
                    SyntheticImages.BLACK, -1);
        }
        return page;
    }

    @Test
    void testSectionsAreNumberedColumnMajor() {
        GridExtractor extractor = new GridExtractor(gridConfig(), inkClassifier, null, null, ImageStore.disabled());

        List<GridSection> sections = extractor.analyzePage(page(0, 3), 19);

        assertThat(sections).hasSize(6);
        assertThat(sections).extracting(GridSection::getSectionNumber).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(sections).extracting(GridSection::getCalculatedDiagramNumber).containsExactly(7, 10, 8, 11, 9, 12);
        assertThat(sections).extracting(GridSection::isChessboard)
                .containsExactly(true, false, false, true, false, false);
        assertThat(sections.get(3).getRow()).isEqualTo(1);
        assertThat(sections.get(3).getCol()).isEqualTo(1);
        assertThat(sections.get(3).getBbox().getX()).isEqualTo(300);
        assertThat(sections.get(3).getBbox().getY()).isEqualTo(300);
    }

    @Test
    void testBubblesAreReportedInPageCoordinates() {
        Mat page = page(1);
        SyntheticImages.outlinedBubble(page, 300 + 180, 50, 14);
        GridExtractor extractor = new GridExtractor(gridConfig(), inkClassifier, null, null, ImageStore.disabled());

        List<GridSection> sections = extractor.analyzePage(page, 18);

        assertThat(sections.get(0).getBubbles()).isEmpty();
        List<Bubble> bubbles = sections.get(1).getBubbles();
        assertThat(bubbles).hasSize(1);
        assertThat(bubbles.get(0).getFillStyle()).isEqualTo(FillStyle.OUTLINED);
        assertThat(bubbles.get(0).getBbox().getX()).isBetween(460, 470);
    }

    @Test
    void testExtractRecognizesBoardsAndSkipsUnrenderablePages() throws IOException {
        RecognitionClientTest.ScriptedService service = new RecognitionClientTest.ScriptedService();
        RecognitionClient recognition = new RecognitionClient(service, 0, 0, new Random(3), millis -> { });
        FakeDocumentSource source = new FakeDocumentSource().newPage().newPage().newPage()
                .render(1, page(0, 1, 2))
                .render(3, page(5));
        ExtractorConfig config = gridConfig();
        config.grid.firstGridPage = 1;

        ExtractionResult<GridSection> result =
                new GridExtractor(config, inkClassifier, null, recognition, ImageStore.disabled()).extract(source);

        assertThat(result.getRecords()).hasSize(12);
        assertThat(result.getRecords()).filteredOn(GridSection::isChessboard)
                .extracting(GridSection::getFen).containsOnly(FEN);
        assertThat(result.getRecords().get(11).getPage()).isEqualTo(3);
        assertThat(result.getRecords().get(11).getCalculatedDiagramNumber()).isEqualTo(18);
        assertThat(result.getRecords().get(11).getTurn()).isEqualTo(Side.WHITE);

        ExtractionSummary summary = result.getSummary();
        assertThat(summary.getChessboardSections()).isEqualTo(4);
        assertThat(summary.getRejectedImages()).isEqualTo(8);
        assertThat(summary.getRecognitionCalls()).isEqualTo(4);
        assertThat(summary.getWhiteToMove()).isEqualTo(4);
        assertThat(summary.getSkippedPages()).isEqualTo(1);
    }

    @Test
    void testPageFailingAnalysisIsSkipped() throws IOException {
        BoardClassifier failsOnTallCells = image -> {
            if (image.rows() > 400) {
                throw new IllegalStateException("cell too tall: " + image.rows());
            }
            return inkClassifier.classify(image);
        };
        FakeDocumentSource source = new FakeDocumentSource().newPage().newPage().newPage()
                .render(1, page(0))
                .render(2, SyntheticImages.blank(600, 2400))
                .render(3, page(1));
        ExtractorConfig config = gridConfig();
        config.grid.firstGridPage = 1;

        ExtractionResult<GridSection> result =
                new GridExtractor(config, failsOnTallCells, null, null, ImageStore.disabled()).extract(source);

        assertThat(result.getRecords()).hasSize(12);
        assertThat(result.getRecords()).extracting(GridSection::getPage).containsOnly(1, 3);
        assertThat(result.getSummary().getChessboardSections()).isEqualTo(2);
        assertThat(result.getSummary().getSkippedPages()).isEqualTo(1);
    }

    @Test
    void testStopsAfterDiagramLimit() throws IOException {
        FakeDocumentSource source = new FakeDocumentSource().newPage().newPage()
                .render(1, page(0, 1))
                .render(2, page(0));
        ExtractorConfig config = gridConfig();
        config.maxDiagrams = 2;

        ExtractionResult<GridSection> result =
                new GridExtractor(config, inkClassifier, null, null, ImageStore.disabled()).extract(source);

        assertThat(result.getRecords()).hasSize(6);
        assertThat(result.getRecords()).allSatisfy(section -> assertThat(section.getPage()).isEqualTo(1));
        assertThat(result.getRecords()).extracting(GridSection::getFen).containsOnlyNulls();
    }
}
