package com.chessdiagrams;

import com.google.gson.annotations.SerializedName;

/**
 * How a book places its diagrams.
 */
public enum Layout {
    /** Header, board image and solution text as separate regions of the text flow. */
    @SerializedName("diagrams")
    DIAGRAMS,
    /** Pages of boards in a fixed rows x columns grid with bubble markers above each board. */
    @SerializedName("grid")
    GRID
}
