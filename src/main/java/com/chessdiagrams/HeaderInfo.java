package com.chessdiagrams;

public final class HeaderInfo {

    private final String diagramNumber;
    private final String players;
    private final String year;

    public HeaderInfo(String diagramNumber, String players, String year) {
        this.diagramNumber = diagramNumber;
        this.players = players;
        this.year = year;
    }

    public String getDiagramNumber() {
        return diagramNumber;
    }

    /** Both players as {@code "White - Black"}. */
    public String getPlayers() {
        return players;
    }

    public String getYear() {
        return year;
    }

    /** Identifies the puzzle; a header printed twice has the same key. */
    public String key() {
        return diagramNumber + "_" + players + "_" + year;
    }
}
