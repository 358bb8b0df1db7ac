package com.chessdiagrams;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/** Drawings used by the image tests. */
final class SyntheticImages {

    static final Scalar WHITE = new Scalar(255, 255, 255);
    static final Scalar BLACK = new Scalar(0, 0, 0);

    private SyntheticImages() {
    }

    static Mat blank(int width, int height) {
        return new Mat(height, width, CvType.CV_8UC3, WHITE);
    }

    /** A printed diagram: 8x8 alternating squares inside a thin frame. */
    static Mat chessboard(int squareSize, int margin) {
        int side = 8 * squareSize + 2 * margin;
        Mat image = blank(side, side);
        drawChessboard(image, margin, margin, squareSize);
        return image;
    }

    static void drawChessboard(Mat image, int left, int top, int squareSize) {
        Scalar light = new Scalar(230, 230, 230);
        Scalar dark = new Scalar(100, 100, 100);
        for (int row = 0; row < 8; row++) {
            for (int col = 0; col < 8; col++) {
                Point from = new Point(left + col * squareSize, top + row * squareSize);
                Point to = new Point(left + (col + 1) * squareSize - 1, top + (row + 1) * squareSize - 1);
                Imgproc.rectangle(image, from, to, (row + col) % 2 == 0 ? light : dark, -1);
            }
        }
        Imgproc.rectangle(image, new Point(left - 3, top - 3),
                new Point(left + 8 * squareSize + 2, top + 8 * squareSize + 2), BLACK, 2);
    }

    /** Lines of "text": long thin strokes. */
    static Mat textPage(int width, int height) {
        Mat image = blank(width, height);
        for (int y = 20; y < height - 10; y += 18) {
            Imgproc.line(image, new Point(15, y), new Point(width - 15, y), BLACK, 2);
        }
        return image;
    }

    static void outlinedBubble(Mat image, int centerX, int centerY, int radius) {
        Imgproc.circle(image, new Point(centerX, centerY), radius, BLACK, 2);
    }

    static void filledBubble(Mat image, int centerX, int centerY, int radius) {
        Imgproc.circle(image, new Point(centerX, centerY), radius, BLACK, -1);
    }
}
