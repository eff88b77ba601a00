package org.nowstart.avwap.data.type;

public enum AnchorRole {
    CURRENT(""),
    PREVIOUS("PREV_");

    private final String labelPrefix;

    AnchorRole(String labelPrefix) {
        this.labelPrefix = labelPrefix;
    }

    public String label(String base) {
        return labelPrefix + base;
    }
}
