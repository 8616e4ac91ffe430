package com.csentinel.core.analysis;

public enum VulnerabilityType {
    HEAP_OVERFLOW("heap"),
    STACK_OVERFLOW("stack");

    private final String region;

    VulnerabilityType(String region) {
        this.region = region;
    }

    /** Memory region the overflowed buffer lives in, as used in finding messages. */
    public String region() { return region; }
}
