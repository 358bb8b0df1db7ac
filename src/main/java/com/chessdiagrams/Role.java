package com.chessdiagrams;

/**
 * Part a block plays in a diagram.
 */
public enum Role {
    HEADER,
    IMAGE,
    SOLUTION
}
