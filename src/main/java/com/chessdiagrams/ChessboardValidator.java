package com.chessdiagrams;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an image region shows a chessboard by counting the square-ish
 * contours a board diagram produces.
 */
public class ChessboardValidator implements BoardClassifier {

    private static final Logger log = LoggerFactory.getLogger(ChessboardValidator.class);

    private static final int WARP_SIZE = 400;

    private final ExtractorConfig.ChessboardSettings settings;

    public ChessboardValidator() {
        this(new ExtractorConfig.ChessboardSettings());
    }

    public ChessboardValidator(ExtractorConfig.ChessboardSettings settings) {
        this.settings = settings;
    }

    @Override
    public BoardVerdict classify(Mat image) {
        if (image == null || image.empty()) {
            return BoardVerdict.rejected();
        }
        try {
            return evaluate(image);
        } catch (Exception e) {
            log.warn("Chessboard check failed on {}x{} image: {}", image.width(), image.height(), e.getMessage());
            return BoardVerdict.rejected();
        }
    }

    private BoardVerdict evaluate(Mat image) {
        // 1. Grayscale + blur + edges
        Mat gray = MatConversions.toGray(image);
        Mat blurred = new Mat();
        Imgproc.GaussianBlur(gray, blurred, new Size(5, 5), 0);
        Mat edges = new Mat();
        Imgproc.Canny(blurred, edges, settings.cannyLow, settings.cannyHigh);
        if (settings.edgeDilation > 0) {
            // close the gaps Canny leaves where four squares meet
            Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(3, 3));
            Imgproc.dilate(edges, edges, kernel, new Point(-1, -1), settings.edgeDilation);
        }

        // 2. Every contour, nested ones included
        List<MatOfPoint> contours = new ArrayList<>();
        Mat hierarchy = new Mat();
        Imgproc.findContours(edges, contours, hierarchy, Imgproc.RETR_TREE, Imgproc.CHAIN_APPROX_SIMPLE);

        // 3. Keep the quadrilaterals that could be board squares
        List<Double> squareAreas = new ArrayList<>();
        Point[] dominantQuad = null;
        double dominantArea = 0;
        for (MatOfPoint contour : contours) {
            MatOfPoint2f curve = new MatOfPoint2f(contour.toArray());
            double perimeter = Imgproc.arcLength(curve, true);
            MatOfPoint2f approx = new MatOfPoint2f();
            Imgproc.approxPolyDP(curve, approx, settings.approxEpsilon * perimeter, true);
            if (approx.total() != 4) {
                continue;
            }
            Rect box = Imgproc.boundingRect(contour);
            if (box.width <= settings.minSide || box.height <= settings.minSide) {
                continue;
            }
            double aspect = (double) box.width / box.height;
            if (aspect < settings.minAspect || aspect > settings.maxAspect) {
                continue;
            }
            double area = Imgproc.contourArea(approx);
            if (area <= 0) {
                continue;
            }
            squareAreas.add(area);
            if (area > dominantArea) {
                dominantArea = area;
                dominantQuad = approx.toArray();
            }
        }

        int count = squareAreas.size();
        if (count < settings.minSquareContours || count > settings.maxSquareContours) {
            log.debug("Rejected image: {} square contours outside [{}, {}]",
                    count, settings.minSquareContours, settings.maxSquareContours);
            return new BoardVerdict(false, 0.0, count);
        }

        // 4. Board squares share one size, well below the size of the board
        double median = median(squareAreas);
        double uniform = uniformFraction(squareAreas, median);
        double cellFraction = dominantArea <= 0 ? 1.0 : median / dominantArea;
        double patternScore = dominantQuad == null ? 0.0 : checkChessBoardPattern(gray, dominantQuad);
        double confidence = 0.4 * uniform + 0.3 * Math.min(1.0, count / 64.0) + 0.3 * patternScore;

        boolean accepted = uniform >= settings.minUniformFraction && cellFraction <= settings.maxCellFraction;
        log.debug("Image {}x{}: {} square contours, uniform {}, cell fraction {}, pattern {} -> {}",
                image.width(), image.height(), count, String.format("%.2f", uniform),
                String.format("%.3f", cellFraction), String.format("%.2f", patternScore),
                accepted ? "chessboard" : "rejected");
        return new BoardVerdict(accepted, accepted ? confidence : 0.0, count);
    }

    private static double median(List<Double> areas) {
        List<Double> sorted = new ArrayList<>(areas);
        Collections.sort(sorted);
        return sorted.get(sorted.size() / 2);
    }

    private double uniformFraction(List<Double> areas, double median) {
        if (median <= 0) {
            return 0.0;
        }
        int close = 0;
        for (double area : areas) {
            double ratio = area >= median ? area / median : median / area;
            if (ratio <= settings.uniformAreaRatio) {
                close++;
            }
        }
        return (double) close / areas.size();
    }


    /**
     * Warps the quadrilateral to a square and measures the brightness variance of
     * its 8x8 cells. An alternating board scores close to 1.
     */
    static double checkChessBoardPattern(Mat gray, Point[] corners) {
        try {
            Point[] ordered = orderPoints(corners);
            Point[] dstPoints = new Point[]{
                    new Point(0, 0),
                    new Point(WARP_SIZE, 0),
                    new Point(WARP_SIZE, WARP_SIZE),
                    new Point(0, WARP_SIZE)
            };

            Mat perspectiveMatrix = Imgproc.getPerspectiveTransform(new MatOfPoint2f(ordered), new MatOfPoint2f(dstPoints));
            Mat warped = new Mat();
            Imgproc.warpPerspective(gray, warped, perspectiveMatrix, new Size(WARP_SIZE, WARP_SIZE));

            int squareSize = WARP_SIZE / 8;
            List<Double> brightnesses = new ArrayList<>();
            for (int row = 0; row < 8; row++) {
                for (int col = 0; col < 8; col++) {
                    Rect squareRect = new Rect(col * squareSize + 5, row * squareSize + 5,
                            squareSize - 10, squareSize - 10);
                    Scalar mean = Core.mean(new Mat(warped, squareRect));
                    brightnesses.add(mean.val[0]);
                }
            }

            double sum = 0;
            for (double b : brightnesses) sum += b;
            double meanBrightness = sum / brightnesses.size();

            double variance = 0;
            for (double b : brightnesses) {
                variance += Math.pow(b - meanBrightness, 2);
            }
            variance /= brightnesses.size();

            return Math.min(1.0, variance / 1000.0);
        } catch (Exception e) {
            log.debug("Pattern check failed: {}", e.getMessage());
            return 0.0;
        }
    }

    /** Orders four corners as top-left, top-right, bottom-right, bottom-left. */
    static Point[] orderPoints(Point[] pts) {
        Point[] result = new Point[4];
        List<Point> points = new ArrayList<>(Arrays.asList(pts));

        points.sort((p1, p2) -> Double.compare(p1.y, p2.y));

        List<Point> top = new ArrayList<>(points.subList(0, 2));
        top.sort((p1, p2) -> Double.compare(p1.x, p2.x));
        result[0] = top.get(0);
        result[1] = top.get(1);

        List<Point> bottom = new ArrayList<>(points.subList(2, 4));
        bottom.sort((p1, p2) -> Double.compare(p1.x, p2.x));
        result[3] = bottom.get(0);
        result[2] = bottom.get(1);

        return result;
    }
}
