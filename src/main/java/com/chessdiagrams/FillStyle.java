package com.chessdiagrams;

import com.google.gson.annotations.SerializedName;

/**
 * Whether a bubble is a ring with a dark digit or a dark disk with a light digit.
 */
public enum FillStyle {
    @SerializedName("outlined")
    OUTLINED,
    @SerializedName("filled")
    FILLED
}
