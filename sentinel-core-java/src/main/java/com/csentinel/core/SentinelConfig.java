package com.csentinel.core;

import java.util.Collections;
import java.util.Set;

/**
 * Tuning knobs for one pipeline run.
 */
public class SentinelConfig {

    /** Deepest statement/expression nesting the parser accepts, folded operator chains included. */
    public final int maxNestingDepth;

    /** Identifiers treated as type names in addition to typedefs seen in the source. */
    public final Set<String> typedefNames;

    /** Whether diagnostics are echoed to stderr while the run progresses. */
    public final boolean echoDiagnostics;

    public SentinelConfig(int maxNestingDepth, Set<String> typedefNames, boolean echoDiagnostics) {
        this.maxNestingDepth = maxNestingDepth;
        this.typedefNames = typedefNames != null ? Set.copyOf(typedefNames) : Collections.emptySet();
        this.echoDiagnostics = echoDiagnostics;
    }

    /**
     * Tree depth the visitors descend to. Declarators, struct fields and a few
     * other nodes add tree levels the parser does not count, up to three per
     * counted level, so any tree the parser accepted fits.
     */
    public int traversalDepthLimit() {
        return 4 * maxNestingDepth + 8;
    }

    public static SentinelConfig defaults() {
        return new SentinelConfig(256, Collections.emptySet(), true);
    }
}
