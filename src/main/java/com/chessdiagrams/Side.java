package com.chessdiagrams;

import java.util.Locale;

import com.google.gson.annotations.SerializedName;

/**
 * Side to move.
 */
public enum Side {
    @SerializedName("white")
    WHITE("white"),
    @SerializedName("black")
    BLACK("black");

    private final String label;

    Side(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Reads the side from the forms used by books and by the recognition service
     * ("w", "b", "white", "black"). Returns null for anything else.
     */
    public static Side parse(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "w":
            case "white":
                return WHITE;
            case "b":
            case "black":
                return BLACK;
            default:
                return null;
        }
    }
}
