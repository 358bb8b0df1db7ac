package com.chessdiagrams;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the bubble markers in the strip above a grid diagram and reads the
 * large diagram number at the left of that strip.
 */
public class BubbleAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BubbleAnalyzer.class);

    private static final int OCR_SCALE = 3;
    private static final int OCR_BORDER = 10;

    private final ExtractorConfig.BubbleSettings settings;
    private final double diagramNumberFraction;
    private final DigitRecognizer recognizer;

    /**
     * @param recognizer null to skip reading digits
     */
    public BubbleAnalyzer(ExtractorConfig.BubbleSettings settings, double diagramNumberFraction,
                          DigitRecognizer recognizer) {
        this.settings = settings;
        this.diagramNumberFraction = diagramNumberFraction;
        this.recognizer = recognizer;
    }

    private static class CandidateBubble {
        final Rect box;
        final double area;

        CandidateBubble(Rect box, double area) {
            this.box = box;
            this.area = area;
        }
    }

    public List<Bubble> analyze(Mat strip) {
        return analyze(strip, 0, 0);
    }

    /**
     * @param originX page x of the strip's left edge, added to every bubble box
     * @param originY page y of the strip's top edge
     * @return bubbles left to right; empty when there are none
     */
    public List<Bubble> analyze(Mat strip, int originX, int originY) {
        if (strip == null || strip.empty()) {
            return Collections.emptyList();
        }
        Mat gray = MatConversions.toGray(strip);
        int skip = (int) (gray.cols() * diagramNumberFraction);
        if (skip >= gray.cols()) {
            return Collections.emptyList();
        }
        Mat region = gray.submat(0, gray.rows(), skip, gray.cols());

        // 1. Dark marks become foreground
        Mat binary = new Mat();
        Imgproc.threshold(region, binary, 0, 255, Imgproc.THRESH_BINARY_INV | Imgproc.THRESH_OTSU);

        List<MatOfPoint> contours = new ArrayList<>();
        Imgproc.findContours(binary, contours, new Mat(), Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);

        // 2. Round, bubble-sized shapes
        List<CandidateBubble> candidates = new ArrayList<>();
        for (MatOfPoint contour : contours) {
            double area = Imgproc.contourArea(contour);
            if (area < settings.minArea || area > settings.maxArea) {
                continue;
            }
            double perimeter = Imgproc.arcLength(new MatOfPoint2f(contour.toArray()), true);
            if (perimeter <= 0) {
                continue;
            }
            double circularity = 4 * Math.PI * area / (perimeter * perimeter);
            Rect box = Imgproc.boundingRect(contour);
            double aspect = (double) box.width / box.height;
            if (circularity < settings.minCircularity || aspect < settings.minAspect || aspect > settings.maxAspect) {
                continue;
            }
            candidates.add(new CandidateBubble(new Rect(box.x + skip, box.y, box.width, box.height), area));
        }

        // 3. One bubble per position, left to right
        candidates.sort((a, b) -> Integer.compare(a.box.x, b.box.x));
        List<CandidateBubble> unique = new ArrayList<>();
        for (CandidateBubble candidate : candidates) {
            CandidateBubble last = unique.isEmpty() ? null : unique.get(unique.size() - 1);
            if (last != null && Math.abs(candidate.box.x - last.box.x) < settings.minSpacing) {
                if (candidate.area > last.area) {
                    unique.set(unique.size() - 1, candidate);
                }
                continue;
            }
            unique.add(candidate);
        }
        if (unique.size() > settings.maxBubbles) {
            unique = unique.subList(0, settings.maxBubbles);
        }

        // 4. Fill style and digit
        List<Bubble> bubbles = new ArrayList<>(unique.size());
        for (CandidateBubble candidate : unique) {
            Rect box = candidate.box;
            FillStyle fill = fillStyle(gray, box);
            Integer digit = readBubbleDigit(gray, box, fill);
            Rect pageBox = new Rect(box.x + originX, box.y + originY, box.width, box.height);
            bubbles.add(new Bubble(digit, fill, BoundingBox.of(pageBox)));
        }
        log.debug("Found {} bubbles: {}", bubbles.size(), bubbles);
        return bubbles;
    }

    /**
     * Reads the large diagram number printed left of the bubbles.
     *
     * @return the digits, or null when nothing could be read
     */
    public String detectDiagramNumber(Mat strip) {
        if (recognizer == null || strip == null || strip.empty()) {
            return null;
        }
        Mat gray = MatConversions.toGray(strip);
        int width = (int) (gray.cols() * diagramNumberFraction);
        if (width <= 0) {
            return null;
        }
        return recognize(gray.submat(0, gray.rows(), 0, width), false);
    }

    private FillStyle fillStyle(Mat gray, Rect box) {
        Rect inner = new Rect(box.x + box.width / 4, box.y + box.height / 4,
                Math.max(1, box.width / 2), Math.max(1, box.height / 2));
        double mean = Core.mean(gray.submat(inner)).val[0];
        return mean < settings.fillThreshold ? FillStyle.FILLED : FillStyle.OUTLINED;
    }

    private Integer readBubbleDigit(Mat gray, Rect box, FillStyle fill) {
        if (recognizer == null) {
            return null;
        }
        int insetX = (int) Math.round(box.width * 0.15);
        int insetY = (int) Math.round(box.height * 0.15);
        Rect inner = new Rect(box.x + insetX, box.y + insetY,
                Math.max(1, box.width - 2 * insetX), Math.max(1, box.height - 2 * insetY));
        return toNumber(recognize(gray.submat(inner), fill == FillStyle.FILLED));
    }

    // recognizers answer digit strings; anything else is unreadable
    static Integer toNumber(String digits) {
        if (digits == null || digits.isEmpty() || digits.length() > 9) {
            return null;
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return null;
            }
        }
        return Integer.valueOf(digits);
    }

    private String recognize(Mat region, boolean invert) {
        try {
            Mat prepared = new Mat();
            if (invert) {
                Core.bitwise_not(region, prepared);
            } else {
                region.copyTo(prepared);
            }
            Mat scaled = new Mat();
            Imgproc.resize(prepared, scaled, new Size(prepared.cols() * OCR_SCALE, prepared.rows() * OCR_SCALE),
                    0, 0, Imgproc.INTER_CUBIC);
            Mat padded = new Mat();
            Core.copyMakeBorder(scaled, padded, OCR_BORDER, OCR_BORDER, OCR_BORDER, OCR_BORDER,
                    Core.BORDER_CONSTANT, new Scalar(255));
            return recognizer.recognizeDigits(padded);
        } catch (Exception e) {
            log.warn("Digit recognition failed: {}", e.getMessage());
            return null;
        }
    }
}
