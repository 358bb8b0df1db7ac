package com.chessdiagrams;

import org.opencv.core.Mat;

/**
 * Decides whether an image region shows a chessboard diagram.
 */
public interface BoardClassifier {

    BoardVerdict classify(Mat image);
}
