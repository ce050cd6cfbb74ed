package com.wavescope.analytics.variant;

public enum VariantType {
    SNAPSHOT("snapshot"),
    AGGREGATED("aggregated"),
    PROJECTED("projected"),
    COMPARATIVE("comparative");

    private final String code;

    VariantType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
