package com.csentinel.core.analysis;

/** Severity label with its CVSS-style score. */
public enum Severity {
    CRITICAL(9.8);

    private final double score;

    Severity(double score) {
        this.score = score;
    }

    public double score() { return score; }
}
