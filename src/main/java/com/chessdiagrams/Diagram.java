package com.chessdiagrams;

import com.google.gson.annotations.SerializedName;

/**
 * One extracted puzzle. Fields that could not be correlated or recognized stay null.
 */
public class Diagram {

    private final int page;
    private final String diagramNumber;
    private final String players;
    private final String year;

    private final Integer solutionMoveNumber;
    @SerializedName("solution_move")
    private final String solutionMoveClean;
    @SerializedName("solution_move_with_notation")
    private final String solutionMoveAnnotated;
    private final String solutionFullMove;
    private final String solutionFullText;
    @SerializedName("solution_turn")
    private final Side turnFromText;

    private String fen;
    @SerializedName("api_turn")
    private Side turnFromApi;
    private String imagePath;

    private final Integer imagePage;
    private final Integer headerPage;
    private final Integer solutionPage;
    private final double chessboardConfidence;

    public Diagram(int page, HeaderInfo header, SolutionDetails solution,
                   Integer imagePage, Integer headerPage, Integer solutionPage, double chessboardConfidence) {
        this.page = page;
        this.diagramNumber = header == null ? null : header.getDiagramNumber();
        this.players = header == null ? null : header.getPlayers();
        this.year = header == null ? null : header.getYear();
        this.solutionMoveNumber = solution == null ? null : solution.getMoveNumber();
        this.solutionMoveClean = solution == null ? null : solution.getMoveClean();
        this.solutionMoveAnnotated = solution == null ? null : solution.getMoveAnnotated();
        this.solutionFullMove = solution == null ? null : solution.getFullMove();
        this.solutionFullText = solution == null ? null : solution.getFullText();
        this.turnFromText = solution == null ? null : solution.getTurn();
        this.imagePage = imagePage;
        this.headerPage = headerPage;
        this.solutionPage = solutionPage;
        this.chessboardConfidence = chessboardConfidence;
    }

    public void applyRecognition(RecognitionResult result) {
        if (result != null) {
            this.fen = result.getFen();
            this.turnFromApi = result.getSideToMove();
        }
    }

    public void setImagePath(String imagePath) {
        this.imagePath = imagePath;
    }

    public int getPage() {
        return page;
    }

    public String getDiagramNumber() {
        return diagramNumber;
    }

    public String getPlayers() {
        return players;
    }

    public String getYear() {
        return year;
    }

    public Integer getSolutionMoveNumber() {
        return solutionMoveNumber;
    }

    public String getSolutionMoveClean() {
        return solutionMoveClean;
    }

    public String getSolutionMoveAnnotated() {
        return solutionMoveAnnotated;
    }

    public String getSolutionFullMove() {
        return solutionFullMove;
    }

    public String getSolutionFullText() {
        return solutionFullText;
    }

    public Side getTurnFromText() {
        return turnFromText;
    }

    public String getFen() {
        return fen;
    }

    public Side getTurnFromApi() {
        return turnFromApi;
    }

    public String getImagePath() {
        return imagePath;
    }

    public Integer getImagePage() {
        return imagePage;
    }

    public Integer getHeaderPage() {
        return headerPage;
    }

    public Integer getSolutionPage() {
        return solutionPage;
    }

    public double getChessboardConfidence() {
        return chessboardConfidence;
    }

    @Override
    public String toString() {
        return "Diagram " + diagramNumber + " (page " + page + "): " + players + " " + year
                + ", " + solutionFullMove;
    }
}
