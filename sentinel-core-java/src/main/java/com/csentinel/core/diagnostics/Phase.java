package com.csentinel.core.diagnostics;

/**
 * Pipeline stage that produced a diagnostic.
 */
public enum Phase {
    PREPROCESS("preprocess"),
    LEXER("lexer"),
    PARSER("parser"),
    CFG("cfg"),
    ANALYSIS("analysis"),
    PIPELINE("pipeline");

    private final String label;

    Phase(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
