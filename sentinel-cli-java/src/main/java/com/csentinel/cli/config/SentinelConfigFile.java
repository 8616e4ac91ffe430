package com.csentinel.cli.config;

import com.csentinel.core.SentinelConfig;
import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Deserialized form of the optional JSON configuration file. Every key may be
 * absent; getters then return the {@link SentinelConfig#defaults()} value.
 */
public class SentinelConfigFile {

    /** Deepest nesting the parser and visitors descend into (default: 256). */
    @SerializedName("max_nesting_depth")
    private Integer maxNestingDepth;

    /** Extra identifiers to treat as type names, e.g. typedefs from unexpanded headers. */
    @SerializedName("typedef_names")
    private List<String> typedefNames;

    /** Whether diagnostics are echoed to stderr during the run (default: true). */
    @SerializedName("echo_diagnostics")
    private Boolean echoDiagnostics;

    public int getMaxNestingDepth() {
        return maxNestingDepth != null ? maxNestingDepth : SentinelConfig.defaults().maxNestingDepth;
    }

    public List<String> getTypedefNames() {
        return typedefNames != null ? typedefNames : Collections.emptyList();
    }

    public boolean isEchoDiagnostics() {
        return echoDiagnostics == null || echoDiagnostics;
    }

    public SentinelConfig toConfig() {
        return new SentinelConfig(getMaxNestingDepth(), new LinkedHashSet<>(getTypedefNames()), isEchoDiagnostics());
    }
}
