package com.csentinel.core.diagnostics;

import com.google.gson.annotations.SerializedName;

/**
 * One advisory log entry. Never read back by the pipeline itself.
 */
public record Diagnostic(
    @SerializedName("phase")   Phase phase,
    @SerializedName("level")   Level level,
    @SerializedName("message") String message
) {

    public enum Level { INFO, WARNING, ERROR }

    @Override
    public String toString() {
        return level + " " + phase.label() + ": " + message;
    }
}
