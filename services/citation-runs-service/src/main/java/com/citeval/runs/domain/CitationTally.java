package com.citeval.runs.domain;

public record CitationTally(int citations, int valid, int misused, int hallucinated) {

    public CitationTally {
        requireNonNegative("citations", citations);
        requireNonNegative("valid", valid);
        requireNonNegative("misused", misused);
        requireNonNegative("hallucinated", hallucinated);
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
