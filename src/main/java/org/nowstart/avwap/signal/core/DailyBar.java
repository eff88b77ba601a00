package org.nowstart.avwap.signal.core;

import java.time.LocalDate;

public record DailyBar(
        LocalDate date,
        double open,
        double high,
        double low,
        double close,
        double volume
) {

    public double typicalPrice() {
        return (open + high + low + close) / 4.0;
    }

    public boolean spans(double level) {
        return low <= level && level <= high;
    }
}
