package com.chessdiagrams;

import com.google.gson.annotations.SerializedName;

/**
 * Known book formats. A preset supplies the diagram structure and both patterns;
 * explicit values in the configuration take precedence.
 */
public enum BookPreset {

    /** "27. Alekhine – Nimzowitsch, New York 1927", board, then "8.f3! ..." */
    @SerializedName("woodpecker_method")
    WOODPECKER_METHOD(
            DiagramStructure.HEADER_IMAGE_SOLUTION,
            "(\\d+)\\.\\s*([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*)\\s*[–-]\\s*([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*),.*?(\\d{4})",
            "^\\s*(\\d+)(\\.{1,3})\\s*([a-hRNBQKO0-9][^\\n]*)"),

    /** Boards anchor the search: "Problem 12: Tal vs Koblents, 1957" before the board, "Solution: 1.Rxh7+ ..." after it. */
    @SerializedName("tactics_problems")
    TACTICS_PROBLEMS(
            DiagramStructure.IMAGE_HEADER_SOLUTION,
            "Problem\\s+(\\d+):\\s*([A-Z][a-z]+.*?)\\s+vs\\.?\\s+([A-Z][a-z]+.*?),?\\s*(\\d{4})",
            "Solution:\\s*(\\d+)(\\.{1,3})\\s*([a-hRNBQKO0-9][^\\n]*)");

    private final DiagramStructure structure;
    private final String headerPattern;
    private final String solutionPattern;

    BookPreset(DiagramStructure structure, String headerPattern, String solutionPattern) {
        this.structure = structure;
        this.headerPattern = headerPattern;
        this.solutionPattern = solutionPattern;
    }

    public DiagramStructure getStructure() {
        return structure;
    }

    public String getHeaderPattern() {
        return headerPattern;
    }

    public String getSolutionPattern() {
        return solutionPattern;
    }
}
