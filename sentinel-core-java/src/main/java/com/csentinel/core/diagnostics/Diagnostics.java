package com.csentinel.core.diagnostics;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Diagnostics sink handed to every pipeline stage.
 *
 * Warnings and errors are collected so they can travel with the partial
 * results of a run. Every entry, INFO included, is echoed to the configured
 * stream with the "[c-sentinel]" prefix. The owner creates one sink per run.
 */
public class Diagnostics {

    private static final String PREFIX = "[c-sentinel] ";

    private final PrintStream echo;
    private final List<Diagnostic> collected = new ArrayList<>();

    public Diagnostics(PrintStream echo) {
        this.echo = echo;
    }

    /** Sink that echoes to stderr. */
    public static Diagnostics toStderr() {
        return new Diagnostics(System.err);
    }

    /** Sink that only collects. */
    public static Diagnostics silent() {
        return new Diagnostics(null);
    }

    public void info(Phase phase, String message) {
        if (echo != null) {
            echo.println(PREFIX + new Diagnostic(phase, Diagnostic.Level.INFO, message));
        }
    }

    public void warn(Phase phase, String message) {
        record(new Diagnostic(phase, Diagnostic.Level.WARNING, message));
    }

    public void error(Phase phase, String message) {
        record(new Diagnostic(phase, Diagnostic.Level.ERROR, message));
    }

    private void record(Diagnostic diagnostic) {
        collected.add(diagnostic);
        if (echo != null) {
            echo.println(PREFIX + diagnostic);
        }
    }

    /** Warnings and errors recorded so far, in order. */
    public List<Diagnostic> entries() {
        return Collections.unmodifiableList(collected);
    }

    public List<Diagnostic> entries(Phase phase) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : collected) {
            if (d.phase() == phase) result.add(d);
        }
        return result;
    }

    public boolean hasErrors() {
        for (Diagnostic d : collected) {
            if (d.level() == Diagnostic.Level.ERROR) return true;
        }
        return false;
    }
}
