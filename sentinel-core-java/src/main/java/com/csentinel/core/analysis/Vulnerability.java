package com.csentinel.core.analysis;

import com.google.gson.annotations.SerializedName;

/**
 * One finding. {@code function} is the unsafe callee, {@code variable} the
 * reconstructed label of the written target ({@code buf}, {@code &x},
 * {@code base[]}, {@code a.m}, {@code a->m}). Line is null when the callee
 * carries no position.
 */
public record Vulnerability(
    @SerializedName("type")           VulnerabilityType type,
    @SerializedName("severity")       Severity severity,
    @SerializedName("severity_score") double severityScore,
    @SerializedName("function")       String function,
    @SerializedName("line")           Integer line,
    @SerializedName("variable")       String variable,
    @SerializedName("message")        String message
) {

    public static Vulnerability critical(VulnerabilityType type, String function, Integer line, String variable) {
        String message = "Unsafe function '" + function + "' writes to " + type.region()
                + " buffer '" + variable + "'";
        return new Vulnerability(type, Severity.CRITICAL, Severity.CRITICAL.score(),
                function, line, variable, message);
    }
}
