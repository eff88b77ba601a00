package org.nowstart.avwap.signal.core;

import org.nowstart.avwap.data.type.BandLevel;

public record AvwapBands(
        double vwap,
        double stdev
) {

    public double level(BandLevel level) {
        return vwap + level.stdevMultiple() * stdev;
    }

    public double upper(int k) {
        return level(BandLevel.upper(k));
    }

    public double lower(int k) {
        return level(BandLevel.lower(k));
    }
}
