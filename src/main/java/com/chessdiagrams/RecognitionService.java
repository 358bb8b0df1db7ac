package com.chessdiagrams;

import java.io.IOException;

import org.opencv.core.Mat;

/**
 * Turns a chessboard image into a position.
 */
public interface RecognitionService {

    /**
     * @throws IOException on transport errors, error statuses and unreadable replies
     */
    RecognitionResult recognize(Mat boardImage) throws IOException, InterruptedException;
}
