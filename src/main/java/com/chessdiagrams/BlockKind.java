package com.chessdiagrams;

public enum BlockKind {
    TEXT,
    IMAGE
}
