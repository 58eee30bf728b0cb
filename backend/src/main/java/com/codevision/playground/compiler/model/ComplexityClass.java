package com.codevision.playground.compiler.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Coarse complexity orders, ranked 1 (constant) to 8 (factorial). */
public enum ComplexityClass {
    CONSTANT(1, "O(1)"),
    LOGARITHMIC(2, "O(log n)"),
    LINEAR(3, "O(n)"),
    LINEARITHMIC(4, "O(n log n)"),
    QUADRATIC(5, "O(n²)"),
    CUBIC(6, "O(n³)"),
    EXPONENTIAL(7, "O(2ⁿ)"),
    FACTORIAL(8, "O(n!)");

    private final int rank;
    private final String notation;

    ComplexityClass(int rank, String notation) {
        this.rank = rank;
        this.notation = notation;
    }

    @JsonValue
    public int rank() {
        return rank;
    }

    public String notation() {
        return notation;
    }
}
