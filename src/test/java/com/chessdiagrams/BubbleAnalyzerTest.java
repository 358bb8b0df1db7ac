package com.chessdiagrams;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.Mat;

import nu.pattern.OpenCV;

class BubbleAnalyzerTest {

    @BeforeAll
    static void loadOpenCv() {
        OpenCV.loadLocally();
    }

    /** Answers with a fixed string and keeps what it was shown. */
    static class RecordingRecognizer implements DigitRecognizer {
        final List<Mat> seen = new ArrayList<>();
        final String answer;

        RecordingRecognizer(String answer) {
            this.answer = answer;
        }

        @Override
        public String recognizeDigits(Mat image) {
            seen.add(image);
            return answer;
        }
    }

    private static BubbleAnalyzer analyzer(DigitRecognizer recognizer) {
        return new BubbleAnalyzer(new ExtractorConfig.BubbleSettings(), 0.25, recognizer);
    }

    @Test
    void testFindsBubblesLeftToRightWithFillStyle() {
        Mat strip = SyntheticImages.blank(400, 100);
        SyntheticImages.filledBubble(strip, 260, 50, 14);
        SyntheticImages.outlinedBubble(strip, 180, 50, 14);

        List<Bubble> bubbles = analyzer(new RecordingRecognizer("7")).analyze(strip);

        assertThat(bubbles).hasSize(2);
        assertThat(bubbles).extracting(Bubble::getFillStyle).containsExactly(FillStyle.OUTLINED, FillStyle.FILLED);
        assertThat(bubbles).extracting(Bubble::getDigit).containsExactly(7, 7);
        assertThat(bubbles.get(0).getBbox().getX()).isBetween(160, 170);
    }

    @Test
    void testFilledBubblesAreInvertedForOcr() {
        Mat strip = SyntheticImages.blank(400, 100);
        SyntheticImages.filledBubble(strip, 260, 50, 14);
        RecordingRecognizer recognizer = new RecordingRecognizer("3");

        analyzer(recognizer).analyze(strip);

        assertThat(recognizer.seen).hasSize(1);
        Mat shown = recognizer.seen.get(0);
        // the dark disk reaches the recognizer as a light area
        assertThat(Core.mean(shown).val[0]).isGreaterThan(200);
    }

    @Test
    void testIgnoresDiagramNumberArea() {
        Mat strip = SyntheticImages.blank(400, 100);
        SyntheticImages.filledBubble(strip, 40, 50, 14);

        assertThat(analyzer(null).analyze(strip)).isEmpty();
    }

    @Test
    void testNoBubblesIsAnEmptyList() {
        assertThat(analyzer(null).analyze(SyntheticImages.blank(400, 100))).isEmpty();
        assertThat(analyzer(null).analyze(new Mat())).isEmpty();
    }

    @Test
    void testKeepsAtMostTwoBubbles() {
        Mat strip = SyntheticImages.blank(400, 100);
        for (int x = 140; x <= 350; x += 70) {
            SyntheticImages.outlinedBubble(strip, x, 50, 12);
        }

        List<Bubble> bubbles = analyzer(null).analyze(strip);

        assertThat(bubbles).hasSize(2);
        assertThat(bubbles.get(0).getBbox().getX()).isLessThan(bubbles.get(1).getBbox().getX());
        assertThat(bubbles.get(1).getBbox().getX()).isBetween(195, 205);
        assertThat(bubbles).extracting(Bubble::getDigit).containsOnlyNulls();
    }

    @Test
    void testMergesMarksCloserThanMinimumSpacing() {
        Mat strip = SyntheticImages.blank(400, 100);
        SyntheticImages.outlinedBubble(strip, 200, 60, 14);
        SyntheticImages.filledBubble(strip, 205, 15, 6);

        List<Bubble> bubbles = analyzer(null).analyze(strip);

        assertThat(bubbles).hasSize(1);
        assertThat(bubbles.get(0).getFillStyle()).isEqualTo(FillStyle.OUTLINED);
    }

    @Test
    void testBoxesAreTranslatedToPageCoordinates() {
        Mat strip = SyntheticImages.blank(400, 100);
        SyntheticImages.outlinedBubble(strip, 180, 50, 14);

        Bubble bubble = analyzer(null).analyze(strip, 1000, 2000).get(0);

        assertThat(bubble.getBbox().getX()).isBetween(1160, 1170);
        assertThat(bubble.getBbox().getY()).isBetween(2030, 2040);
    }

    @Test
    void testUnreadableDigitsAreNull() {
        Mat strip = SyntheticImages.blank(400, 100);
        SyntheticImages.outlinedBubble(strip, 180, 50, 14);

        assertThat(analyzer(new RecordingRecognizer("")).analyze(strip).get(0).getDigit()).isNull();
        assertThat(BubbleAnalyzer.toNumber("12")).isEqualTo(12);
        assertThat(BubbleAnalyzer.toNumber("1O")).isNull();
        assertThat(BubbleAnalyzer.toNumber("12345678901")).isNull();
        assertThat(BubbleAnalyzer.toNumber(null)).isNull();
    }

    @Test
    void testReadsDiagramNumberOnTheLeft() {
        RecordingRecognizer recognizer = new RecordingRecognizer("12");
        Mat strip = SyntheticImages.blank(400, 100);

        assertThat(analyzer(recognizer).detectDiagramNumber(strip)).isEqualTo("12");
        assertThat(recognizer.seen.get(0).cols()).isEqualTo(100 * 3 + 20);
        assertThat(analyzer(null).detectDiagramNumber(strip)).isNull();
    }
}
