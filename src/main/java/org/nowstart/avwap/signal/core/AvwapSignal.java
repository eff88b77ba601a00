package org.nowstart.avwap.signal.core;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import org.nowstart.avwap.data.type.TradeSide;

public record AvwapSignal(
        String symbol,
        LocalDate date,
        String label,
        TradeSide side
) {

    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("MM/dd");

    public String displayDate() {
        return DISPLAY_DATE.format(date);
    }

    public String toLogLine() {
        return symbol + "," + displayDate() + "," + label + "," + side;
    }
}
