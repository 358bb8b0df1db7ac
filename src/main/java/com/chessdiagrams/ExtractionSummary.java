package com.chessdiagrams;

import org.slf4j.Logger;

/**
 * Counters of one extraction run.
 */
public class ExtractionSummary {

    int records;
    int crossPageDiagrams;
    int unmatchedHeaders;
    int repeatedHeaders;
    int rejectedImages;
    int droppedCandidates;
    int recognitionCalls;
    int recognitionFailures;
    int whiteToMove;
    int blackToMove;
    int chessboardSections;
    int skippedPages;

    public int getRecords() {
        return records;
    }

    public int getCrossPageDiagrams() {
        return crossPageDiagrams;
    }

    public int getUnmatchedHeaders() {
        return unmatchedHeaders;
    }

    public int getRepeatedHeaders() {
        return repeatedHeaders;
    }

    /** Pages that could not be read and were left out of the run. */
    public int getSkippedPages() {
        return skippedPages;
    }

    public int getRejectedImages() {
        return rejectedImages;
    }

    public int getDroppedCandidates() {
        return droppedCandidates;
    }

    public int getRecognitionCalls() {
        return recognitionCalls;
    }

    public int getRecognitionFailures() {
        return recognitionFailures;
    }

    public int getWhiteToMove() {
        return whiteToMove;
    }

    public int getBlackToMove() {
        return blackToMove;
    }

    public int getChessboardSections() {
        return chessboardSections;
    }

    void countTurn(Side side) {
        if (side == Side.WHITE) {
            whiteToMove++;
        } else if (side == Side.BLACK) {
            blackToMove++;
        }
    }

    public void logTo(Logger log) {
        log.info("=== Extraction summary ===");
        log.info("Records: {} ({} spanning pages)", records, crossPageDiagrams);
        log.info("Unmatched headers: {}, repeated headers: {}, rejected images: {}, dropped candidates: {}",
                unmatchedHeaders, repeatedHeaders, rejectedImages, droppedCandidates);
        if (skippedPages > 0) {
            log.warn("Skipped pages: {}", skippedPages);
        }
        log.info("Chessboard sections: {}", chessboardSections);
        log.info("Recognition calls: {}, failures: {}", recognitionCalls, recognitionFailures);
        log.info("White to move: {}, black to move: {}", whiteToMove, blackToMove);
    }
}
