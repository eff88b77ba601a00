package org.nowstart.avwap.data.type;

public enum SkipReason {
    NO_ANCHORS,
    NO_ELIGIBLE_ANCHOR,
    NO_BARS,
    ANCHOR_BAR_MISSING,
    INSUFFICIENT_TRAILING_BARS,
    BANDS_UNDEFINED,
    EVALUATION_FAILED
}
