package com.chessdiagrams;

import java.util.Collections;
import java.util.List;

/**
 * Diagrams found by one assembly pass plus the counts of what was left behind.
 */
public final class AssemblyResult {

    private final List<DiagramCandidate> candidates;
    private final int droppedCandidates;
    private final int rejectedImages;
    private final int unmatchedHeaders;
    private final int repeatedHeaders;

    public AssemblyResult(List<DiagramCandidate> candidates, int droppedCandidates, int rejectedImages,
                          int unmatchedHeaders, int repeatedHeaders) {
        this.candidates = Collections.unmodifiableList(candidates);
        this.droppedCandidates = droppedCandidates;
        this.rejectedImages = rejectedImages;
        this.unmatchedHeaders = unmatchedHeaders;
        this.repeatedHeaders = repeatedHeaders;
    }

    public List<DiagramCandidate> getCandidates() {
        return candidates;
    }

    /** Images that found neither header nor solution. */
    public int getDroppedCandidates() {
        return droppedCandidates;
    }

    public int getRejectedImages() {
        return rejectedImages;
    }

    /** Headers that ended up in no diagram. */
    public int getUnmatchedHeaders() {
        return unmatchedHeaders;
    }

    /** Headers skipped because the same puzzle was already emitted. */
    public int getRepeatedHeaders() {
        return repeatedHeaders;
    }
}
