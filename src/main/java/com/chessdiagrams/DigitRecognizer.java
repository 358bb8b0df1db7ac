package com.chessdiagrams;

import org.opencv.core.Mat;

/**
 * Reads the digits printed in a small image.
 */
public interface DigitRecognizer {

    /**
     * @param image dark digits on a light background
     * @return the digits read, or null when nothing was read confidently
     */
    String recognizeDigits(Mat image);
}
